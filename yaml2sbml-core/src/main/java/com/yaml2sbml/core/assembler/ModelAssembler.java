package com.yaml2sbml.core.assembler;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.yaml2sbml.core.builder.AssignmentsBlockBuilder;
import com.yaml2sbml.core.builder.BlockBuilder;
import com.yaml2sbml.core.builder.BuildContext;
import com.yaml2sbml.core.builder.EventsBlockBuilder;
import com.yaml2sbml.core.builder.FunctionsBlockBuilder;
import com.yaml2sbml.core.builder.NoiseBlockBuilder;
import com.yaml2sbml.core.builder.ObservablesBlockBuilder;
import com.yaml2sbml.core.builder.OdesBlockBuilder;
import com.yaml2sbml.core.builder.ParametersBlockBuilder;
import com.yaml2sbml.core.builder.StatesBlockBuilder;
import com.yaml2sbml.core.builder.TimeBlockBuilder;
import com.yaml2sbml.core.config.ConverterConfig;
import com.yaml2sbml.core.exception.SchemaException;
import com.yaml2sbml.core.model.Compartment;
import com.yaml2sbml.core.model.SbmlModel;

/**
 * Turns a loaded ODE document into an {@link SbmlModel}.
 *
 * <p>Blocks are processed in a fixed order, independent of their order in the document:
 * <ol>
 *   <li>time</li>
 *   <li>parameters</li>
 *   <li>states</li>
 *   <li>assignments</li>
 *   <li>functions</li>
 *   <li>observables</li>
 *   <li>odes</li>
 *   <li>noise</li>
 *   <li>events</li>
 * </ol>
 * A formula can therefore refer to any name declared by an earlier block. Absent blocks
 * are skipped; a top-level key that names no block is rejected before anything is built.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * JsonNode document = new OdeDocumentLoader().load(Path.of("lotka_volterra.yml"));
 * SbmlModel model = new ModelAssembler(ConverterConfig.defaults()).assemble(document, "lotka_volterra");
 * }</pre>
 */
public class ModelAssembler {

    private static final Logger log = LoggerFactory.getLogger(ModelAssembler.class);

    private final ConverterConfig config;
    private final Compartment compartment;
    private final List<BlockBuilder> builders;

    public ModelAssembler(ConverterConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.compartment = new Compartment(config.compartment().id(), config.compartment().size(), true);
        this.builders = List.of(
            new TimeBlockBuilder(),
            new ParametersBlockBuilder(),
            new StatesBlockBuilder(),
            new AssignmentsBlockBuilder(),
            new FunctionsBlockBuilder(),
            new ObservablesBlockBuilder(),
            new OdesBlockBuilder(),
            new NoiseBlockBuilder(),
            new EventsBlockBuilder()
        );
    }

    /**
     * Returns the block names in processing order.
     *
     * @return block names
     */
    public List<String> blockOrder() {
        return builders.stream().map(BlockBuilder::blockName).toList();
    }

    /**
     * Builds the model.
     *
     * @param document document root, a mapping of block name to content
     * @param modelId SBML model identifier, or null
     * @return the assembled model; the compartment is its first entity
     * @throws SchemaException if the document is not a mapping or has an unknown block
     * @throws com.yaml2sbml.core.exception.ConversionException if any block is invalid
     */
    public SbmlModel assemble(JsonNode document, String modelId) {
        if (document == null || !document.isObject()) {
            throw new SchemaException("Document must be a mapping of blocks");
        }
        rejectUnknownBlocks(document);

        BuildContext context = new BuildContext(config, compartment);
        context.add(compartment);

        for (BlockBuilder builder : builders) {
            if (!document.has(builder.blockName())) {
                log.debug("Block '{}' absent, skipping", builder.blockName());
                continue;
            }
            log.debug("Building block '{}'", builder.blockName());
            builder.build(document.get(builder.blockName()), context);
        }

        SbmlModel model = new SbmlModel(modelId, context.entities(), context.diagnostics());
        log.info("Assembled model {}: {} species, {} parameters, {} rate rules, {} function(s), {} warning(s)",
            modelId, model.species().size(), model.parameters().size() + model.observables().size(),
            model.rateRules().size(), model.functionDefinitions().size(), model.diagnostics().size());
        return model;
    }

    private void rejectUnknownBlocks(JsonNode document) {
        Set<String> known = Set.copyOf(blockOrder());
        Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
        while (fields.hasNext()) {
            String key = fields.next().getKey();
            if (!known.contains(key)) {
                throw new SchemaException("Unknown block '" + key + "'. Expected one of: "
                    + String.join(", ", blockOrder()));
            }
        }
    }
}
