package com.yaml2sbml.cli;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest extends CommandTestSupport {

    @Test
    void listFunctions_includesArity() {
        int exitCode = run("list", "functions");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("• exp (arguments: 1)").contains("• log (arguments: 1 to 2)");
    }

    @Test
    void listConstants_includesAliases() {
        int exitCode = run("list", "constants");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("• time").contains("• INF, inf, infinity");
    }

    @Test
    void listBlocks_inProcessingOrder() {
        int exitCode = run("list", "blocks");

        assertThat(exitCode).isZero();
        String printed = out.toString();
        assertThat(printed.indexOf("• time")).isLessThan(printed.indexOf("• parameters"));
        assertThat(printed.indexOf("• functions")).isLessThan(printed.indexOf("• odes"));
    }

    @Test
    void listUnknownType_fails() {
        int exitCode = run("list", "units");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown type: units");
    }
}
