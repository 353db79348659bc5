package com.yaml2sbml.core.assembler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.config.ConverterConfig;
import com.yaml2sbml.core.exception.DuplicateIdentifierException;
import com.yaml2sbml.core.exception.SchemaException;
import com.yaml2sbml.core.exception.UnknownIdentifierException;
import com.yaml2sbml.core.io.OdeDocumentLoader;
import com.yaml2sbml.core.model.Compartment;
import com.yaml2sbml.core.model.Parameter;
import com.yaml2sbml.core.model.RateRule;
import com.yaml2sbml.core.model.SbmlModel;
import com.yaml2sbml.core.model.Species;

/**
 * Tests for {@link ModelAssembler}.
 */
class ModelAssemblerTest {

    private static final String PREDATOR_PREY = """
        states:
          - stateId: prey
            initialValue: 10
          - stateId: predator
            initialValue: 5
        parameters:
          - parameterId: alpha
            nominalValue: 1.1
        odes:
          - state: prey
            rightHandSide: alpha*prey - prey*predator
        """;

    /** One declaration of {@code observable_dup} per declaring block, in processing order. */
    private static final Map<String, String> DECLARATIONS = declarations();

    private static Map<String, String> declarations() {
        Map<String, String> declarations = new LinkedHashMap<>();
        declarations.put("time", "time:\n  variable: observable_dup\n");
        declarations.put("parameters", "parameters:\n  - parameterId: observable_dup\n    nominalValue: 1\n");
        declarations.put("states", "states:\n  - stateId: observable_dup\n    initialValue: 1\n");
        declarations.put("assignments", "assignments:\n  - assignmentId: observable_dup\n    formula: 2\n");
        declarations.put("functions",
            "functions:\n  - functionId: observable_dup\n    arguments: a\n    formula: a\n");
        declarations.put("observables", "observables:\n  - observableId: dup\n    observableFormula: 1\n");
        return declarations;
    }

    static Stream<Arguments> declaringBlockPairs() {
        List<String> blocks = new ArrayList<>(DECLARATIONS.keySet());
        List<Arguments> pairs = new ArrayList<>();
        for (int first = 0; first < blocks.size(); first++) {
            for (int second = first + 1; second < blocks.size(); second++) {
                pairs.add(Arguments.of(blocks.get(first), blocks.get(second)));
            }
        }
        return pairs.stream();
    }

    private final OdeDocumentLoader loader = new OdeDocumentLoader();
    private final ModelAssembler assembler = new ModelAssembler(ConverterConfig.defaults());

    private SbmlModel assemble(String yaml) {
        return assembler.assemble(loader.parse(yaml), "model");
    }

    @Test
    void blockOrder_isFixed() {
        assertThat(assembler.blockOrder()).containsExactly(
            "time", "parameters", "states", "assignments", "functions",
            "observables", "odes", "noise", "events");
    }

    @Test
    void assemble_predatorPrey() {
        SbmlModel model = assemble(PREDATOR_PREY);

        assertThat(model.entities().get(0)).isEqualTo(Compartment.defaultCompartment());
        assertThat(model.species()).extracting(Species::id, Species::initialAmount)
            .containsExactly(
                tuple("prey", 10.0),
                tuple("predator", 5.0));
        assertThat(model.parameters()).containsExactly(Parameter.constant("alpha", 1.1, "dimensionless"));
        assertThat(model.rateRules()).singleElement()
            .satisfies(rule -> {
                assertThat(rule.variable()).isEqualTo("prey");
                assertThat(rule.formula().toInfix()).isEqualTo("alpha * prey - prey * predator");
            });
        assertThat(model.diagnostics()).isEmpty();
    }

    @Test
    void assemble_entitiesFollowBlockOrderNotDocumentOrder() {
        SbmlModel model = assemble(PREDATOR_PREY);

        assertThat(model.entities())
            .extracting(entity -> entity.getClass().getSimpleName())
            .containsExactly("Compartment", "Parameter", "Species", "Species", "RateRule");
    }

    @Test
    void assemble_missingParameter_citesName() {
        String withoutAlpha = PREDATOR_PREY.replace("""
            parameters:
              - parameterId: alpha
                nominalValue: 1.1
            """, "");

        assertThatThrownBy(() -> assemble(withoutAlpha))
            .isInstanceOf(UnknownIdentifierException.class)
            .hasMessageContaining("alpha")
            .satisfies(e -> assertThat(((UnknownIdentifierException) e).getIdentifier()).isEqualTo("alpha"));
    }

    @Test
    void assemble_unknownBlock_throws() {
        assertThatThrownBy(() -> assemble(PREDATOR_PREY + "reactions:\n  - id: r1\n"))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("reactions");
    }

    @Test
    void assemble_sameIdentifierInTwoBlocks_throws() {
        assertThatThrownBy(() -> assemble("""
            time:
              variable: prey
            states:
              - stateId: prey
                initialValue: 1
            """))
            .isInstanceOf(DuplicateIdentifierException.class)
            .hasMessageContaining("prey");
    }

    @ParameterizedTest(name = "{0} then {1}")
    @MethodSource("declaringBlockPairs")
    void assemble_nameDeclaredByTwoBlocks_failsInLaterBlock(String earlier, String later) {
        String yaml = DECLARATIONS.get(later) + DECLARATIONS.get(earlier);

        assertThatThrownBy(() -> assemble(yaml))
            .isInstanceOf(DuplicateIdentifierException.class)
            .hasMessageContaining("observable_dup")
            .satisfies(e -> assertThat(((DuplicateIdentifierException) e).getBlock()).isEqualTo(later));
    }

    @ParameterizedTest
    @ValueSource(strings = {"time", "parameters", "states", "assignments", "functions"})
    void assemble_nameOfCompartment_throws(String block) {
        String yaml = DECLARATIONS.get(block).replace("observable_dup", Compartment.DEFAULT_ID);

        assertThatThrownBy(() -> assemble(yaml))
            .isInstanceOf(DuplicateIdentifierException.class)
            .hasMessageContaining("already declared as compartment")
            .satisfies(e -> assertThat(((DuplicateIdentifierException) e).getBlock()).isEqualTo(block));
    }

    @Test
    void assemble_observableNamedLikeCustomCompartment_throws() {
        ModelAssembler custom = new ModelAssembler(new ConverterConfig(
            new ConverterConfig.CompartmentSettings("observable_dup", 1.0), null, null, null));

        assertThatThrownBy(() -> custom.assemble(loader.parse(DECLARATIONS.get("observables")), "model"))
            .isInstanceOf(DuplicateIdentifierException.class)
            .hasMessageContaining("observable_dup");
    }

    @Test
    void assemble_invalidCompartmentId_throws() {
        ModelAssembler custom = new ModelAssembler(new ConverterConfig(
            new ConverterConfig.CompartmentSettings("my cell", 1.0), null, null, null));

        assertThatThrownBy(() -> custom.assemble(loader.parse(PREDATOR_PREY), "model"))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("my cell");
    }

    @Test
    void assemble_eventsAndNoise_produceOneDiagnosticEach() {
        SbmlModel model = assemble(PREDATOR_PREY + "noise:\nevents:\n  - trigger: gt(prey, 20)\n");

        assertThat(model.diagnostics()).extracting(diagnostic -> diagnostic.block())
            .containsExactly("noise", "events");
        assertThat(model.entities()).hasSize(5);
    }

    @Test
    void assemble_eventsWithFailPolicy_throws() {
        ModelAssembler strict = new ModelAssembler(
            new ConverterConfig(null, null, null, ConverterConfig.UnsupportedBlockPolicy.FAIL));
        JsonNode document = loader.parse(PREDATOR_PREY + "events:\n");

        assertThatThrownBy(() -> strict.assemble(document, "model"))
            .isInstanceOf(SchemaException.class);
    }

    @Test
    void assemble_observablesNotAList_noObservablesAndNoError() {
        SbmlModel model = assemble(PREDATOR_PREY + "observables: prey\n");

        assertThat(model.observables()).isEmpty();
        assertThat(model.diagnostics()).hasSize(1);
    }

    @Test
    void assemble_configuredCompartment() {
        ModelAssembler custom = new ModelAssembler(new ConverterConfig(
            new ConverterConfig.CompartmentSettings("cell", 2.5), null, null, null));

        SbmlModel model = custom.assemble(loader.parse(PREDATOR_PREY), "model");

        assertThat(model.compartments()).containsExactly(new Compartment("cell", 2.5, true));
        assertThat(model.species()).allSatisfy(species -> assertThat(species.compartment()).isEqualTo("cell"));
    }

    @Test
    void assemble_rateRuleForUndeclaredState_throws() {
        assertThatThrownBy(() -> assemble(PREDATOR_PREY + "  - state: wolf\n    rightHandSide: 1\n"))
            .isInstanceOf(UnknownIdentifierException.class)
            .hasMessageContaining("wolf");
    }

    @Test
    void assemble_documentNotAMapping_throws() {
        assertThatThrownBy(() -> assembler.assemble(null, "model"))
            .isInstanceOf(SchemaException.class);
    }

    @Test
    void assemble_sameDocumentTwice_yieldsEqualModels() {
        JsonNode document = loader.parse(PREDATOR_PREY);

        assertThat(assembler.assemble(document, "m")).isEqualTo(assembler.assemble(document, "m"));
    }

    @Test
    void rateRules_matchStates() {
        SbmlModel model = assemble(PREDATOR_PREY);

        assertThat(model.rateRules()).extracting(RateRule::variable).containsExactly("prey");
    }
}
