package com.yaml2sbml.core.renderer.impl;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.yaml2sbml.core.renderer.GeneratedFile;
import com.yaml2sbml.core.renderer.GeneratedOutput;
import com.yaml2sbml.core.renderer.RenderContext;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_createsMissingDirectoriesAndWritesFiles() throws IOException {
        Path outputDir = tempDir.resolve("nested/out");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("model.xml", "<sbml/>", GeneratedFile.SBML),
            new GeneratedFile("tables/parameters_model.tsv", "parameterId\n", GeneratedFile.TSV)));

        renderer.render(output, RenderContext.of(outputDir));

        assertThat(Files.readString(outputDir.resolve("model.xml"))).isEqualTo("<sbml/>");
        assertThat(Files.readString(outputDir.resolve("tables/parameters_model.tsv"))).isEqualTo("parameterId\n");
    }

    @Test
    void render_overwritesExistingFile() throws IOException {
        Files.writeString(tempDir.resolve("model.xml"), "old");

        renderer.render(new GeneratedOutput(List.of(new GeneratedFile("model.xml", "new", GeneratedFile.SBML))),
            RenderContext.of(tempDir));

        assertThat(Files.readString(tempDir.resolve("model.xml"))).isEqualTo("new");
    }
}
