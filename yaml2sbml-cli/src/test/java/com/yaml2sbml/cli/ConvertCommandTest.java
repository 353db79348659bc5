package com.yaml2sbml.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConvertCommand}.
 */
class ConvertCommandTest extends CommandTestSupport {

    @TempDir
    Path tempDir;

    @Test
    void convert_writesModelAndReportsWarnings() throws IOException {
        Path yaml = write(tempDir, "lv.yml", LOTKA_VOLTERRA);
        Path outDir = tempDir.resolve("out");

        int exitCode = run("convert", yaml.toString(), outDir.toString(), "lv");

        assertThat(exitCode).isZero();
        assertThat(outDir.resolve("lv.xml")).exists();
        assertThat(Files.readString(outDir.resolve("lv.xml"))).contains("<rateRule variable=\"prey\">");
        assertThat(out.toString()).contains("✓ Wrote").contains("lv.xml");
        assertThat(err.toString()).contains("⚠ events:");
    }

    @Test
    void convert_withPetab_writesTables() throws IOException {
        Path yaml = write(tempDir, "lv.yml", LOTKA_VOLTERRA);
        Path outDir = tempDir.resolve("out");

        int exitCode = run("convert", yaml.toString(), outDir.toString(), "lv.xml", "--petab");

        assertThat(exitCode).isZero();
        assertThat(outDir.resolve("lv.xml")).exists();
        assertThat(outDir.resolve("parameters_lv.tsv")).exists();
        assertThat(outDir.resolve("observables_lv.tsv")).exists();
    }

    @Test
    void convert_dryRun_printsWithoutWriting() throws IOException {
        Path yaml = write(tempDir, "lv.yml", LOTKA_VOLTERRA);
        Path outDir = tempDir.resolve("out");

        int exitCode = run("convert", yaml.toString(), outDir.toString(), "lv", "--dry-run");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("<sbml").doesNotContain("✓ Wrote");
        assertThat(outDir).doesNotExist();
    }

    @Test
    void convert_undeclaredState_failsWithoutWriting() throws IOException {
        Path yaml = write(tempDir, "broken.yml", """
            states:
              - stateId: x
                initialValue: 1
            odes:
              - state: y
                rightHandSide: -x
            """);
        Path outDir = tempDir.resolve("out");

        int exitCode = run("convert", yaml.toString(), outDir.toString(), "broken");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Conversion failed").contains("'y'");
        assertThat(outDir).doesNotExist();
    }

    @Test
    void convert_eventsWithFailPolicy_fails() throws IOException {
        Path yaml = write(tempDir, "lv.yml", LOTKA_VOLTERRA);
        Path config = write(tempDir, "yaml2sbml.yaml", """
            eventsPolicy: FAIL
            """);

        int exitCode = run("convert", yaml.toString(), tempDir.resolve("out").toString(), "lv",
            "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("events are not supported");
    }

    @Test
    void convert_missingInput_fails() {
        int exitCode = run("convert", tempDir.resolve("missing.yml").toString(), tempDir.toString(), "m");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Conversion failed");
    }
}
