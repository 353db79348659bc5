package com.yaml2sbml.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yaml2sbml.core.config.ConfigLoader;
import com.yaml2sbml.core.config.ConverterConfig;
import com.yaml2sbml.core.convert.ConversionResult;
import com.yaml2sbml.core.convert.Yaml2Sbml;
import com.yaml2sbml.core.exception.ConversionException;
import com.yaml2sbml.core.renderer.OutputRenderer;
import com.yaml2sbml.core.renderer.impl.ConsoleRenderer;
import com.yaml2sbml.core.renderer.impl.FileSystemRenderer;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command to convert a YAML model into an SBML file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Writes out/lotka_volterra.xml
 * yaml2sbml convert lotka_volterra.yml out lotka_volterra
 *
 * # Also writes out/parameters_lotka_volterra.tsv and out/observables_lotka_volterra.tsv
 * yaml2sbml convert lotka_volterra.yml out lotka_volterra --petab
 *
 * # Print instead of writing
 * yaml2sbml convert lotka_volterra.yml out lotka_volterra --dry-run
 * }</pre>
 */
@Command(
    name = "convert",
    description = "Convert a YAML ODE model to SBML",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "YAML model file")
    private Path yamlFile;

    @Parameters(index = "1", description = "Output directory")
    private Path outputDir;

    @Parameters(index = "2", description = "Model name; the SBML file is <name>.xml")
    private String modelName;

    @Option(names = {"--petab"}, description = "Also write PEtab parameter and observable tables")
    private boolean petab;

    @Option(names = {"--dry-run"}, description = "Print the generated files instead of writing them")
    private boolean dryRun;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ConverterConfig config = ConfigLoader.load(configPath);
        OutputRenderer renderer = dryRun ? new ConsoleRenderer(out) : new FileSystemRenderer();

        try {
            ConversionResult result = new Yaml2Sbml(config).convert(yamlFile, outputDir, modelName, petab, renderer);
            Diagnostics.print(result.diagnostics(), err);
            if (!dryRun) {
                result.output().files().forEach(file ->
                    out.println("✓ Wrote " + outputDir.resolve(file.relativePath())));
            }
            return 0;
        } catch (ConversionException e) {
            log.debug("Conversion of {} failed", yamlFile, e);
            err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            log.error("Conversion of {} failed", yamlFile, e);
            err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        }
    }
}
