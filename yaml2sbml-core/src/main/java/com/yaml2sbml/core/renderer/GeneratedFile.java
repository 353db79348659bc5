package com.yaml2sbml.core.renderer;

import java.util.Objects;

/**
 * One output file of a conversion.
 *
 * @param relativePath path relative to the output directory (e.g. "lotka_volterra.xml")
 * @param content file content
 * @param contentType media type, e.g. "application/sbml+xml" or "text/tab-separated-values"
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String SBML = "application/sbml+xml";
    public static final String TSV = "text/tab-separated-values";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
