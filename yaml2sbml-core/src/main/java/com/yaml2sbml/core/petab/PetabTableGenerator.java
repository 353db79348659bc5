package com.yaml2sbml.core.petab;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.config.ConverterConfig;
import com.yaml2sbml.core.expression.NumberFormats;
import com.yaml2sbml.core.io.DocumentFields;
import com.yaml2sbml.core.io.Field;
import com.yaml2sbml.core.renderer.GeneratedFile;

/**
 * Writes the PEtab parameter and observable tables.
 *
 * <p>Produces {@code parameters_<model>.tsv} with one row per parameter and, when the
 * document has observables, {@code observables_<model>.tsv}. Optional columns are read
 * from the block entries and fall back to:
 * <ul>
 *   <li>{@code parameterName}: the parameter id</li>
 *   <li>{@code parameterScale}: lin</li>
 *   <li>{@code lowerBound} / {@code upperBound}: -inf / inf</li>
 *   <li>{@code estimate}: 1</li>
 *   <li>{@code observableTransformation}: lin</li>
 *   <li>{@code noiseFormula}: 1</li>
 *   <li>{@code noiseDistribution}: normal</li>
 * </ul>
 * The observable formula column refers to the model parameter that carries the observable.
 */
public class PetabTableGenerator implements CompanionTableGenerator {

    private static final Logger log = LoggerFactory.getLogger(PetabTableGenerator.class);

    static final List<String> PARAMETER_COLUMNS = List.of(
        "parameterId", "parameterName", "parameterScale", "lowerBound", "upperBound", "nominalValue", "estimate");
    static final List<String> OBSERVABLE_COLUMNS = List.of(
        "observableId", "observableName", "observableFormula", "observableTransformation",
        "noiseFormula", "noiseDistribution");

    private static final Field PARAMETER_ID = Field.of("parameterId", "id");
    private static final Field PARAMETER_NAME = Field.of("parameterName");
    private static final Field PARAMETER_SCALE = Field.of("parameterScale");
    private static final Field LOWER_BOUND = Field.of("lowerBound");
    private static final Field UPPER_BOUND = Field.of("upperBound");
    private static final Field NOMINAL_VALUE = Field.of("nominalValue", "value");
    private static final Field ESTIMATE = Field.of("estimate");

    private static final Field OBSERVABLE_ID = Field.of("observableId", "id");
    private static final Field OBSERVABLE_NAME = Field.of("observableName");
    private static final Field OBSERVABLE_TRANSFORMATION = Field.of("observableTransformation");
    private static final Field NOISE_FORMULA = Field.of("noiseFormula");
    private static final Field NOISE_DISTRIBUTION = Field.of("noiseDistribution");

    private final String observablePrefix;

    public PetabTableGenerator(ConverterConfig config) {
        this.observablePrefix = Objects.requireNonNull(config, "config must not be null").observables().prefix();
    }

    @Override
    public List<GeneratedFile> generate(JsonNode document, String modelName) {
        List<GeneratedFile> files = new ArrayList<>();
        files.add(new GeneratedFile("parameters_" + modelName + ".tsv", parameterTable(document), GeneratedFile.TSV));

        JsonNode observables = document.get("observables");
        if (observables != null && observables.isArray() && observables.size() > 0) {
            files.add(new GeneratedFile("observables_" + modelName + ".tsv", observableTable(observables),
                GeneratedFile.TSV));
        } else {
            log.debug("No observables, skipping observable table");
        }
        return files;
    }

    String parameterTable(JsonNode document) {
        StringBuilder table = new StringBuilder();
        appendRow(table, PARAMETER_COLUMNS);
        for (JsonNode entry : DocumentFields.entries("parameters", document.get("parameters"))) {
            String id = DocumentFields.requiredText("parameters", entry, PARAMETER_ID);
            double value = DocumentFields.requiredNumber("parameters", entry, NOMINAL_VALUE);
            appendRow(table, List.of(
                id,
                text(entry, PARAMETER_NAME, id),
                text(entry, PARAMETER_SCALE, "lin"),
                text(entry, LOWER_BOUND, "-inf"),
                text(entry, UPPER_BOUND, "inf"),
                NumberFormats.format(value),
                text(entry, ESTIMATE, "1")));
        }
        return table.toString();
    }

    String observableTable(JsonNode observables) {
        StringBuilder table = new StringBuilder();
        appendRow(table, OBSERVABLE_COLUMNS);
        for (JsonNode entry : DocumentFields.entries("observables", observables)) {
            String id = DocumentFields.requiredText("observables", entry, OBSERVABLE_ID);
            appendRow(table, List.of(
                id,
                text(entry, OBSERVABLE_NAME, id),
                observablePrefix + id,
                text(entry, OBSERVABLE_TRANSFORMATION, "lin"),
                text(entry, NOISE_FORMULA, "1"),
                text(entry, NOISE_DISTRIBUTION, "normal")));
        }
        return table.toString();
    }

    private static String text(JsonNode entry, Field field, String defaultValue) {
        return DocumentFields.find(entry, field)
            .filter(JsonNode::isValueNode)
            .map(value -> value.asText().trim())
            .filter(value -> !value.isEmpty())
            .orElse(defaultValue);
    }

    private static void appendRow(StringBuilder table, List<String> cells) {
        table.append(String.join("\t", cells)).append('\n');
    }
}
