package com.yaml2sbml.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import com.yaml2sbml.Yaml2SbmlCLI;

import picocli.CommandLine;

/**
 * Runs the command line with captured output streams.
 */
abstract class CommandTestSupport {

    static final String LOTKA_VOLTERRA = """
        time:
          variable: t
        parameters:
          - parameterId: alpha
            nominalValue: 1.1
          - parameterId: beta
            nominalValue: 0.4
        states:
          - stateId: prey
            initialValue: 10
          - stateId: predator
            initialValue: 5
        odes:
          - state: prey
            rightHandSide: alpha * prey - beta * prey * predator
          - state: predator
            rightHandSide: beta * prey * predator - alpha * predator
        observables:
          - observableId: prey_measured
            observableFormula: log10(prey)
        events:
          - eventId: dose
        """;

    protected final StringWriter out = new StringWriter();
    protected final StringWriter err = new StringWriter();

    protected int run(String... args) {
        CommandLine commandLine = Yaml2SbmlCLI.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    protected static Path write(Path dir, String fileName, String content) throws IOException {
        Path file = dir.resolve(fileName);
        Files.writeString(file, content);
        return file;
    }
}
