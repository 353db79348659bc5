package com.yaml2sbml.core.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.UncheckedIOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.exception.SchemaException;

/**
 * Tests for {@link OdeDocumentLoader}.
 */
class OdeDocumentLoaderTest {

    private final OdeDocumentLoader loader = new OdeDocumentLoader();

    @TempDir
    Path tempDir;

    @Test
    void parse_mappingRoot() {
        JsonNode root = loader.parse("time:\n  variable: t\n");

        assertThat(root.get("time").get("variable").asText()).isEqualTo("t");
    }

    @Test
    void parse_emptyBlocksAreNullNodes() {
        JsonNode root = loader.parse("observables:\nnoise:\n");

        assertThat(root.has("observables")).isTrue();
        assertThat(root.get("observables").isNull()).isTrue();
    }

    @Test
    void parse_duplicateTopLevelKey_throws() {
        assertThatThrownBy(() -> loader.parse("time:\n  variable: t\ntime:\n  variable: s\n"))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("Invalid YAML");
    }

    @Test
    void parse_emptyDocument_throws() {
        assertThatThrownBy(() -> loader.parse(""))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("empty");
    }

    @Test
    void parse_listRoot_throws() {
        assertThatThrownBy(() -> loader.parse("- a\n- b\n"))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("mapping");
    }

    @Test
    void parse_malformedYaml_throws() {
        assertThatThrownBy(() -> loader.parse("states: [unclosed"))
            .isInstanceOf(SchemaException.class);
    }

    @Test
    void load_missingFile_throws() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.yml")))
            .isInstanceOf(UncheckedIOException.class);
    }
}
