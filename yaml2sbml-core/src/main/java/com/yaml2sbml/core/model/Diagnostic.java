package com.yaml2sbml.core.model;

import java.util.Objects;

/**
 * Non-fatal finding reported during conversion.
 *
 * @param severity severity
 * @param block block the finding concerns
 * @param message description
 */
public record Diagnostic(
    DiagnosticSeverity severity,
    String block,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Diagnostic warning(String block, String message) {
        return new Diagnostic(DiagnosticSeverity.WARNING, block, message);
    }

    @Override
    public String toString() {
        return severity + " [" + block + "] " + message;
    }
}
