package com.yaml2sbml.core.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yaml2sbml.core.exception.DuplicateIdentifierException;
import com.yaml2sbml.core.exception.SchemaException;
import com.yaml2sbml.core.exception.UnknownIdentifierException;
import com.yaml2sbml.core.expression.BuiltinFunction;
import com.yaml2sbml.core.expression.ReservedConstant;

/**
 * Namespace of every identifier declared while converting one document.
 *
 * <p>A name can be declared once, whatever its kind. Declaration order is kept so
 * that listings and error messages are deterministic. The registry is owned by a
 * single conversion and is not thread-safe.
 */
public class IdentifierRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdentifierRegistry.class);

    /** SBML SId syntax. */
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<String, IdentifierKind> entries = new LinkedHashMap<>();
    private final Map<String, Integer> functionArities = new LinkedHashMap<>();

    /**
     * Checks that a name is usable as an SBML identifier.
     *
     * @param name candidate name
     * @return true if the name matches {@code [A-Za-z_][A-Za-z0-9_]*}
     */
    public static boolean isValidIdentifier(String name) {
        return name != null && IDENTIFIER_PATTERN.matcher(name).matches();
    }

    /**
     * Declares a name.
     *
     * @param block block doing the declaration, for error messages
     * @param name the name
     * @param kind what the name refers to
     * @throws SchemaException if the name is not a valid identifier
     * @throws DuplicateIdentifierException if the name is already declared or reserved
     */
    public void declare(String block, String name, IdentifierKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (!isValidIdentifier(name)) {
            throw new SchemaException(block, "'" + name + "' is not a valid identifier");
        }
        if (ReservedConstant.isReserved(name)) {
            throw new DuplicateIdentifierException(block, name,
                "'" + name + "' is a reserved constant and cannot be declared");
        }
        IdentifierKind existing = entries.get(name);
        if (existing != null) {
            throw new DuplicateIdentifierException(block, name,
                "'" + name + "' is already declared as " + existing.label());
        }
        entries.put(name, kind);
        log.debug("Declared {} '{}'", kind.label(), name);
    }

    /**
     * Declares a function definition together with its number of arguments.
     *
     * @param block block doing the declaration
     * @param name function name
     * @param arity number of arguments
     * @throws DuplicateIdentifierException if the name is declared or is a builtin function
     */
    public void declareFunction(String block, String name, int arity) {
        if (BuiltinFunction.isBuiltin(name)) {
            throw new DuplicateIdentifierException(block, name,
                "'" + name + "' is a builtin function and cannot be redefined");
        }
        declare(block, name, IdentifierKind.FUNCTION);
        functionArities.put(name, arity);
    }

    /**
     * Resolves a name.
     *
     * @param name the name
     * @return its kind
     * @throws UnknownIdentifierException if the name is not declared
     */
    public IdentifierKind resolve(String name) {
        IdentifierKind kind = entries.get(name);
        if (kind == null) {
            throw new UnknownIdentifierException(null, name, "Unknown identifier '" + name + "'");
        }
        return kind;
    }

    public Optional<IdentifierKind> find(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public boolean isFunction(String name) {
        return entries.get(name) == IdentifierKind.FUNCTION;
    }

    /**
     * Returns the declared argument count of a function definition.
     *
     * @param name function name
     * @return arity, or empty if the name is not a declared function
     */
    public Optional<Integer> arityOf(String name) {
        return Optional.ofNullable(functionArities.get(name));
    }

    /**
     * Returns all entries in declaration order.
     *
     * @return unmodifiable view of name to kind
     */
    public Map<String, IdentifierKind> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }
}
