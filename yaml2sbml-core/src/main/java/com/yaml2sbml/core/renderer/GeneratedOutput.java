package com.yaml2sbml.core.renderer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * All files produced by one conversion, the model document first.
 *
 * @param files generated files in write order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Finds a file by its relative path.
     *
     * @param relativePath path to look for
     * @return the file, or empty
     */
    public Optional<GeneratedFile> find(String relativePath) {
        return files.stream().filter(file -> file.relativePath().equals(relativePath)).findFirst();
    }
}
