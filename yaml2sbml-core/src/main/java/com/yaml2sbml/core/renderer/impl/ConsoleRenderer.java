package com.yaml2sbml.core.renderer.impl;

import java.io.PrintWriter;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yaml2sbml.core.renderer.GeneratedFile;
import com.yaml2sbml.core.renderer.GeneratedOutput;
import com.yaml2sbml.core.renderer.OutputRenderer;
import com.yaml2sbml.core.renderer.RenderContext;

/**
 * Prints generated files instead of writing them. Used for dry runs.
 *
 * <p><b>Configuration:</b>
 * <ul>
 *   <li>{@code console.showHeaders} - print a header line per file (default true)</li>
 *   <li>{@code console.separator} - separator between files (default "---")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String DEFAULT_SEPARATOR = "---";

    private final PrintWriter out;

    public ConsoleRenderer() {
        this(new PrintWriter(System.out, true));
    }

    public ConsoleRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (i > 0) {
                out.println(separator);
            }
            if (showHeaders) {
                out.println("# " + context.outputDirectory().resolve(file.relativePath())
                    + " (" + file.content().length() + " bytes)");
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
        log.debug("Printed {} file(s) instead of writing to {}", output.files().size(), context.outputDirectory());
    }
}
