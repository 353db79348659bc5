package com.yaml2sbml.cli;

import java.io.PrintWriter;
import java.util.List;

import com.yaml2sbml.core.model.Diagnostic;

/**
 * Prints conversion diagnostics for the user.
 */
final class Diagnostics {

    private Diagnostics() {
    }

    static void print(List<Diagnostic> diagnostics, PrintWriter err) {
        for (Diagnostic diagnostic : diagnostics) {
            err.println("⚠ " + diagnostic.block() + ": " + diagnostic.message());
        }
    }
}
