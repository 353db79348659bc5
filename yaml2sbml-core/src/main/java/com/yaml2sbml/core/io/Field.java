package com.yaml2sbml.core.io;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * A field of a block entry, known under a canonical name and optional aliases.
 *
 * <p>Aliases cover the older snake case and short forms, e.g. {@code initialValue}
 * is also accepted as {@code initial_value}.
 *
 * @param name canonical name, used in messages
 * @param aliases other accepted names, in lookup order
 */
public record Field(String name, List<String> aliases) {

    public Field {
        Objects.requireNonNull(name, "name must not be null");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public static Field of(String name, String... aliases) {
        return new Field(name, List.of(aliases));
    }

    /**
     * Returns the canonical name followed by the aliases.
     *
     * @return accepted names
     */
    public List<String> names() {
        return Stream.concat(Stream.of(name), aliases.stream()).toList();
    }
}
