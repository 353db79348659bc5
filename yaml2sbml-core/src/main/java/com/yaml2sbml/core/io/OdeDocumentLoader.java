package com.yaml2sbml.core.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.yaml2sbml.core.exception.SchemaException;

/**
 * Reads an ODE model description from YAML into a Jackson tree.
 *
 * <p>The root must be a mapping from block name to block content. Key order is kept.
 * A block name appearing twice is rejected rather than silently overwritten.
 */
public class OdeDocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(OdeDocumentLoader.class);

    private final ObjectMapper yamlMapper;

    public OdeDocumentLoader() {
        this.yamlMapper = YAMLMapper.builder()
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .build();
    }

    /**
     * Loads a document from a file.
     *
     * @param yamlFile path to the YAML file
     * @return root mapping node
     * @throws SchemaException if the file is not valid YAML or its root is not a mapping
     * @throws UncheckedIOException if the file cannot be read
     */
    public JsonNode load(Path yamlFile) {
        log.debug("Loading ODE document from: {}", yamlFile);
        try {
            return parse(Files.readString(yamlFile));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + yamlFile, e);
        }
    }

    /**
     * Parses a document from YAML text.
     *
     * @param yaml YAML text
     * @return root mapping node
     * @throws SchemaException if the text is not valid YAML or its root is not a mapping
     */
    public JsonNode parse(String yaml) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new SchemaException(null, "Invalid YAML: " + e.getOriginalMessage(), e);
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new SchemaException("Document is empty");
        }
        if (!root.isObject()) {
            throw new SchemaException("Document root must be a mapping of blocks, found " + root.getNodeType());
        }
        return root;
    }
}
