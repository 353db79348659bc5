package com.yaml2sbml.core.model;

/**
 * Severity of a non-fatal diagnostic.
 */
public enum DiagnosticSeverity {
    /** Informational, conversion unaffected */
    INFO,

    /** Part of the document contributes nothing to the model */
    WARNING
}
