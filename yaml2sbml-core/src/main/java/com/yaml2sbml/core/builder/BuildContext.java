package com.yaml2sbml.core.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yaml2sbml.core.config.ConverterConfig;
import com.yaml2sbml.core.expression.ExpressionCompiler;
import com.yaml2sbml.core.model.Compartment;
import com.yaml2sbml.core.model.Diagnostic;
import com.yaml2sbml.core.model.ModelEntity;
import com.yaml2sbml.core.registry.IdentifierKind;
import com.yaml2sbml.core.registry.IdentifierRegistry;
import com.yaml2sbml.core.registry.ReferenceValidator;

/**
 * State of one running conversion, shared by the block builders.
 *
 * <p>Holds the identifier registry, a compiler that knows the functions declared so far,
 * the configuration, and the entities and diagnostics built so far. Entities are kept in
 * the order they are added. The compartment id is declared up front, so no block can
 * reuse it.
 */
public class BuildContext {

    private static final Logger log = LoggerFactory.getLogger(BuildContext.class);

    /** Block name reported when the configured compartment id is rejected. */
    static final String COMPARTMENT_BLOCK = "compartment";

    private final ConverterConfig config;
    private final Compartment compartment;
    private final IdentifierRegistry registry;
    private final ReferenceValidator validator;
    private final ExpressionCompiler compiler;
    private final List<ModelEntity> entities = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * @param config converter configuration
     * @param compartment the model compartment
     * @throws com.yaml2sbml.core.exception.SchemaException if the compartment id is not a valid SBML id
     * @throws com.yaml2sbml.core.exception.DuplicateIdentifierException if the compartment id is a reserved name
     */
    public BuildContext(ConverterConfig config, Compartment compartment) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.compartment = Objects.requireNonNull(compartment, "compartment must not be null");
        this.registry = new IdentifierRegistry();
        this.validator = new ReferenceValidator(registry);
        this.compiler = new ExpressionCompiler(registry::isFunction);
        registry.declare(COMPARTMENT_BLOCK, compartment.id(), IdentifierKind.COMPARTMENT);
    }

    public ConverterConfig config() {
        return config;
    }

    public Compartment compartment() {
        return compartment;
    }

    public IdentifierRegistry registry() {
        return registry;
    }

    public ReferenceValidator validator() {
        return validator;
    }

    public ExpressionCompiler compiler() {
        return compiler;
    }

    /**
     * Adds an entity to the model.
     *
     * @param entity the entity
     */
    public void add(ModelEntity entity) {
        entities.add(Objects.requireNonNull(entity, "entity must not be null"));
    }

    /**
     * Records a non-fatal diagnostic and logs it.
     *
     * @param diagnostic the diagnostic
     */
    public void report(Diagnostic diagnostic) {
        log.debug("{}", diagnostic);
        diagnostics.add(diagnostic);
    }

    public List<ModelEntity> entities() {
        return Collections.unmodifiableList(entities);
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
