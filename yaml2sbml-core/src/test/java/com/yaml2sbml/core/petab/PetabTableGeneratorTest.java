package com.yaml2sbml.core.petab;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.config.ConverterConfig;
import com.yaml2sbml.core.io.OdeDocumentLoader;
import com.yaml2sbml.core.renderer.GeneratedFile;

/**
 * Tests for {@link PetabTableGenerator}.
 */
class PetabTableGeneratorTest {

    private final OdeDocumentLoader loader = new OdeDocumentLoader();
    private final PetabTableGenerator generator = new PetabTableGenerator(ConverterConfig.defaults());

    @Test
    void generate_parameterTableWithDefaultsAndOverrides() {
        JsonNode document = loader.parse("""
            parameters:
              - parameterId: alpha
                nominalValue: 1.1
              - parameterId: beta
                nominalValue: 2
                parameterScale: log10
                lowerBound: 0.01
                upperBound: 100
                estimate: 0
            """);

        List<GeneratedFile> files = generator.generate(document, "lv");

        assertThat(files).extracting(GeneratedFile::relativePath).containsExactly("parameters_lv.tsv");
        assertThat(files.get(0).content().split("\n")).containsExactly(
            "parameterId\tparameterName\tparameterScale\tlowerBound\tupperBound\tnominalValue\testimate",
            "alpha\talpha\tlin\t-inf\tinf\t1.1\t1",
            "beta\tbeta\tlog10\t0.01\t100\t2\t0");
        assertThat(files.get(0).contentType()).isEqualTo(GeneratedFile.TSV);
    }

    @Test
    void generate_observableTableRefersToModelParameter() {
        JsonNode document = loader.parse("""
            parameters:
              - id: k
                value: 1
            observables:
              - id: Obs_1
                formula: S1 + S2
              - observableId: Obs_2
                observableFormula: k * S3
                noiseFormula: sigma
                noiseDistribution: laplace
            """);

        List<GeneratedFile> files = generator.generate(document, "m");

        assertThat(files).extracting(GeneratedFile::relativePath)
            .containsExactly("parameters_m.tsv", "observables_m.tsv");
        assertThat(files.get(1).content().split("\n")).containsExactly(
            "observableId\tobservableName\tobservableFormula\tobservableTransformation\tnoiseFormula\tnoiseDistribution",
            "Obs_1\tObs_1\tobservable_Obs_1\tlin\t1\tnormal",
            "Obs_2\tObs_2\tobservable_Obs_2\tlin\tsigma\tlaplace");
    }

    @Test
    void generate_noParameters_headerOnly() {
        List<GeneratedFile> files = generator.generate(loader.parse("observables:\n"), "empty");

        assertThat(files).singleElement()
            .satisfies(file -> assertThat(file.content()).isEqualTo(String.join("\t",
                PetabTableGenerator.PARAMETER_COLUMNS) + "\n"));
    }
}
