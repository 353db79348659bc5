package com.yaml2sbml.core.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Names with a fixed meaning in every formula. They resolve without a declaration
 * and cannot be declared by a document.
 */
public enum ReservedConstant {
    /** Current simulation time, written as the SBML time csymbol. */
    TIME(List.of("time")),
    AVOGADRO(List.of("avogadro")),
    PI(List.of("pi")),
    EXPONENTIALE(List.of("exponentiale")),
    TRUE(List.of("true")),
    FALSE(List.of("false")),
    INFINITY(List.of("INF", "inf", "infinity")),
    NOT_A_NUMBER(List.of("NaN", "nan", "notanumber"));

    private static final Map<String, ReservedConstant> BY_NAME = indexByName();

    private final List<String> names;

    ReservedConstant(List<String> names) {
        this.names = names;
    }

    public static Optional<ReservedConstant> lookup(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static boolean isReserved(String name) {
        return BY_NAME.containsKey(name);
    }

    public List<String> names() {
        return names;
    }

    /**
     * Whether the constant depends on simulation state. Such constants are not
     * allowed inside a function definition body.
     *
     * @return true for {@link #TIME}
     */
    public boolean isTimeDependent() {
        return this == TIME;
    }

    private static Map<String, ReservedConstant> indexByName() {
        Map<String, ReservedConstant> index = new LinkedHashMap<>();
        Arrays.stream(values()).forEach(constant -> constant.names.forEach(name -> index.put(name, constant)));
        return Collections.unmodifiableMap(index);
    }
}
