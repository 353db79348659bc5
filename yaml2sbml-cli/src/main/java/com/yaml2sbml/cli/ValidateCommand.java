package com.yaml2sbml.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yaml2sbml.core.config.ConfigLoader;
import com.yaml2sbml.core.convert.ConversionResult;
import com.yaml2sbml.core.convert.Yaml2Sbml;
import com.yaml2sbml.core.exception.ConversionException;
import com.yaml2sbml.core.model.SbmlModel;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command to check a YAML model without writing anything.
 *
 * <p>Runs the full conversion in memory and reports the model summary, or the first
 * error.
 */
@Command(
    name = "validate",
    description = "Validate a YAML ODE model",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "YAML model file")
    private Path yamlFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        log.info("Validating model: {}", yamlFile);

        try {
            ConversionResult result = new Yaml2Sbml(ConfigLoader.load(configPath))
                .convert(yamlFile, "model", false);
            SbmlModel model = result.model();
            Diagnostics.print(result.diagnostics(), err);
            out.printf("✓ %s is valid%n", yamlFile);
            out.printf("  States:      %d%n", model.species().size());
            out.printf("  Parameters:  %d%n", model.parameters().size());
            out.printf("  Functions:   %d%n", model.functionDefinitions().size());
            out.printf("  ODEs:        %d%n", model.rateRules().size());
            out.printf("  Observables: %d%n", model.observables().size());
            return 0;
        } catch (ConversionException e) {
            err.println("✗ " + yamlFile + " is invalid: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            log.error("Validation of {} failed", yamlFile, e);
            err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
