package com.yaml2sbml.core.renderer;

/**
 * Destination for the files of a conversion.
 *
 * <p>The conversion facade produces every file in memory first and hands the complete
 * {@link GeneratedOutput} to a renderer only when nothing failed, so a renderer never
 * sees a partial result.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public void render(GeneratedOutput output, RenderContext context) {
 *         Files.createDirectories(context.outputDirectory());
 *         for (GeneratedFile file : output.files()) {
 *             Files.writeString(context.outputDirectory().resolve(file.relativePath()), file.content());
 *         }
 *     }
 * }
 * }</pre>
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer, e.g. "filesystem" or "console".
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Writes the output.
     *
     * @param output files to write
     * @param context destination settings
     * @throws IllegalStateException if the output cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
