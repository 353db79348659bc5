package com.yaml2sbml.core.convert;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.assembler.ModelAssembler;
import com.yaml2sbml.core.config.ConverterConfig;
import com.yaml2sbml.core.io.OdeDocumentLoader;
import com.yaml2sbml.core.model.SbmlModel;
import com.yaml2sbml.core.petab.CompanionTableGenerator;
import com.yaml2sbml.core.petab.PetabTableGenerator;
import com.yaml2sbml.core.renderer.GeneratedFile;
import com.yaml2sbml.core.renderer.GeneratedOutput;
import com.yaml2sbml.core.renderer.OutputRenderer;
import com.yaml2sbml.core.renderer.RenderContext;
import com.yaml2sbml.core.renderer.impl.FileSystemRenderer;
import com.yaml2sbml.core.writer.ModelDocumentWriter;
import com.yaml2sbml.core.writer.SbmlDocumentWriter;

/**
 * Converts ODE documents into SBML.
 *
 * <p>Every file is produced in memory before anything is written, so a failing
 * conversion leaves the output directory untouched.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Yaml2Sbml converter = new Yaml2Sbml(ConverterConfig.defaults());
 * ConversionResult result = converter.convert(Path.of("lotka_volterra.yml"), Path.of("out"),
 *     "lotka_volterra", true);
 * // Creates out/lotka_volterra.xml, out/parameters_lotka_volterra.tsv
 * result.diagnostics().forEach(System.out::println);
 * }</pre>
 */
public class Yaml2Sbml {

    private static final Logger log = LoggerFactory.getLogger(Yaml2Sbml.class);

    static final String MODEL_FILE_EXTENSION = ".xml";

    private final ConverterConfig config;
    private final OdeDocumentLoader loader;
    private final CompanionTableGenerator tableGenerator;

    public Yaml2Sbml() {
        this(ConverterConfig.defaults());
    }

    public Yaml2Sbml(ConverterConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.loader = new OdeDocumentLoader();
        this.tableGenerator = new PetabTableGenerator(config);
    }

    /**
     * Converts a file and writes the results to a directory.
     *
     * @param yamlFile input document
     * @param outputDir directory receiving the model file and tables
     * @param modelName model name; {@code .xml} is appended to form the file name if absent
     * @param petab whether to also write the PEtab tables
     * @return the conversion result
     * @throws com.yaml2sbml.core.exception.ConversionException if the document is invalid;
     *         nothing is written in that case
     */
    public ConversionResult convert(Path yamlFile, Path outputDir, String modelName, boolean petab) {
        return convert(yamlFile, outputDir, modelName, petab, new FileSystemRenderer());
    }

    /**
     * Converts a file and hands the results to a renderer.
     *
     * @param yamlFile input document
     * @param outputDir output directory passed to the renderer
     * @param modelName model name
     * @param petab whether to also produce the PEtab tables
     * @param renderer destination of the generated files
     * @return the conversion result
     */
    public ConversionResult convert(Path yamlFile, Path outputDir, String modelName, boolean petab,
                                    OutputRenderer renderer) {
        Objects.requireNonNull(outputDir, "outputDir must not be null");
        ConversionResult result = convert(yamlFile, modelName, petab);
        renderer.render(result.output(), RenderContext.of(outputDir));
        return result;
    }

    /**
     * Converts a file without writing anything.
     *
     * @param yamlFile input document
     * @param modelName model name
     * @param petab whether to also produce the PEtab tables
     * @return the conversion result
     */
    public ConversionResult convert(Path yamlFile, String modelName, boolean petab) {
        log.info("Converting {} to model {}", yamlFile, modelName);
        JsonNode document = loader.load(yamlFile);
        return convert(document, modelName, petab);
    }

    /**
     * Converts a loaded document without writing anything.
     *
     * @param document document root
     * @param modelName model name
     * @param petab whether to also produce the PEtab tables
     * @return the conversion result
     */
    public ConversionResult convert(JsonNode document, String modelName, boolean petab) {
        Objects.requireNonNull(modelName, "modelName must not be null");
        String modelId = modelId(modelName);

        SbmlModel model = new ModelAssembler(config).assemble(document, modelId);
        String sbml = serialize(model);

        List<GeneratedFile> files = new ArrayList<>();
        files.add(new GeneratedFile(modelFileName(modelName), sbml, GeneratedFile.SBML));
        if (petab) {
            files.addAll(tableGenerator.generate(document, modelId));
        }
        return new ConversionResult(model, sbml, new GeneratedOutput(files));
    }

    /**
     * Converts a loaded document to an SBML string.
     *
     * @param document document root
     * @param modelName model name
     * @return the SBML document text
     */
    public String toSbml(JsonNode document, String modelName) {
        return convert(document, modelName, false).sbml();
    }

    /**
     * Returns the model file name: the model name with {@code .xml} appended if absent.
     *
     * @param modelName model name
     * @return file name
     */
    public static String modelFileName(String modelName) {
        return modelName.endsWith(MODEL_FILE_EXTENSION) ? modelName : modelName + MODEL_FILE_EXTENSION;
    }

    /**
     * Returns the model name without the {@code .xml} extension.
     *
     * @param modelName model name
     * @return model identifier
     */
    public static String modelId(String modelName) {
        return modelName.endsWith(MODEL_FILE_EXTENSION)
            ? modelName.substring(0, modelName.length() - MODEL_FILE_EXTENSION.length())
            : modelName;
    }

    private static String serialize(SbmlModel model) {
        ModelDocumentWriter writer = new SbmlDocumentWriter(model.modelId());
        writer.addAll(model);
        return writer.serialize();
    }
}
