package com.yaml2sbml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yaml2sbml.cli.ConvertCommand;
import com.yaml2sbml.cli.ListCommand;
import com.yaml2sbml.cli.ValidateCommand;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point for yaml2sbml.
 *
 * <p>yaml2sbml converts ODE models written in YAML into SBML documents, optionally
 * together with PEtab parameter and observable tables.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code convert} - Convert a YAML model to SBML</li>
 *   <li>{@code validate} - Check a YAML model without writing anything</li>
 *   <li>{@code list} - List builtin functions, reserved constants or blocks</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Convert, writing out/lotka_volterra.xml
 * yaml2sbml convert lotka_volterra.yml out lotka_volterra
 *
 * # Also write the PEtab tables
 * yaml2sbml convert lotka_volterra.yml out lotka_volterra --petab
 *
 * # Check a model
 * yaml2sbml -v validate lotka_volterra.yml
 * }</pre>
 */
@Command(
    name = "yaml2sbml",
    mixinStandardHelpOptions = true,
    version = "yaml2sbml 1.0.0-SNAPSHOT",
    description = "Converts ODE models written in YAML into SBML",
    subcommands = {
        ConvertCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class Yaml2SbmlCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Yaml2SbmlCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("yaml2sbml - YAML ODE models to SBML");
        System.out.println();
        System.out.println("Use 'yaml2sbml --help' to see available commands");
        System.out.println("Use 'yaml2sbml <command> --help' for command-specific help");
    }

    /**
     * Configures logging from the global options before the selected command runs.
     *
     * @param parseResult parsed command line
     * @return exit code of the selected command
     */
    int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the configured command line.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        Yaml2SbmlCLI cli = new Yaml2SbmlCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
