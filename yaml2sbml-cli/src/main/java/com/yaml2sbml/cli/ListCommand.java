package com.yaml2sbml.cli;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yaml2sbml.core.assembler.ModelAssembler;
import com.yaml2sbml.core.config.ConverterConfig;
import com.yaml2sbml.core.expression.BuiltinFunction;
import com.yaml2sbml.core.expression.ReservedConstant;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command to list what formulas and documents may contain.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Builtin functions and their argument counts
 * yaml2sbml list functions
 *
 * # Reserved names
 * yaml2sbml list constants
 *
 * # Top-level blocks, in processing order
 * yaml2sbml list blocks
 * }</pre>
 */
@Command(
    name = "list",
    description = "List builtin functions, reserved constants, or blocks",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: functions, constants, or blocks")
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase()) {
            case "functions", "function" -> listFunctions(out);
            case "constants", "constant" -> listConstants(out);
            case "blocks", "block" -> listBlocks(out);
            default -> {
                log.error("Unknown type: {}. Use: functions, constants, or blocks", type);
                spec.commandLine().getErr().println("Unknown type: " + type + ". Use: functions, constants, or blocks");
                yield 1;
            }
        };
    }

    private int listFunctions(PrintWriter out) {
        out.println("Builtin Functions:");
        out.println();
        for (Map.Entry<String, BuiltinFunction> entry : BuiltinFunction.byName().entrySet()) {
            out.printf("  • %s (arguments: %s)%n", entry.getKey(), entry.getValue().describeArity());
        }
        return 0;
    }

    private int listConstants(PrintWriter out) {
        out.println("Reserved Names:");
        out.println();
        for (ReservedConstant constant : ReservedConstant.values()) {
            out.printf("  • %s%n", String.join(", ", constant.names()));
        }
        return 0;
    }

    private int listBlocks(PrintWriter out) {
        out.println("Blocks (in processing order):");
        out.println();
        String blocks = new ModelAssembler(ConverterConfig.defaults()).blockOrder().stream()
            .map(block -> "  • " + block)
            .collect(Collectors.joining(System.lineSeparator()));
        out.println(blocks);
        return 0;
    }
}
