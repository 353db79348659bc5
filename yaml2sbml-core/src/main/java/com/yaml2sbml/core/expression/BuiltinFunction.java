package com.yaml2sbml.core.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Functions every formula may call without declaring them.
 *
 * <p>The list mirrors the MathML subset of SBML Level 3 Version 1 core. Each entry
 * records the names it can be called by, its accepted argument count and the MathML
 * element it is written as. A few entries ({@link #LOG}, {@link #LOG10}, {@link #SQRT},
 * {@link #ROOT}, {@link #POW}, {@link #PIECEWISE}) need a special MathML shape; the
 * writer handles those explicitly.
 */
public enum BuiltinFunction {
    EXP("exp", 1, 1, List.of("exp")),
    LN("ln", 1, 1, List.of("ln")),
    /** One argument: base 10. Two arguments: {@code log(base, x)}. */
    LOG("log", 1, 2, List.of("log")),
    LOG10("log", 1, 1, List.of("log10")),
    SQRT("root", 1, 1, List.of("sqrt")),
    /** {@code root(degree, x)}. */
    ROOT("root", 2, 2, List.of("root")),
    POW("power", 2, 2, List.of("pow")),
    ABS("abs", 1, 1, List.of("abs")),
    FLOOR("floor", 1, 1, List.of("floor")),
    CEILING("ceiling", 1, 1, List.of("ceil", "ceiling")),
    FACTORIAL("factorial", 1, 1, List.of("factorial")),

    SIN("sin", 1, 1, List.of("sin")),
    COS("cos", 1, 1, List.of("cos")),
    TAN("tan", 1, 1, List.of("tan")),
    SEC("sec", 1, 1, List.of("sec")),
    CSC("csc", 1, 1, List.of("csc")),
    COT("cot", 1, 1, List.of("cot")),
    SINH("sinh", 1, 1, List.of("sinh")),
    COSH("cosh", 1, 1, List.of("cosh")),
    TANH("tanh", 1, 1, List.of("tanh")),
    SECH("sech", 1, 1, List.of("sech")),
    CSCH("csch", 1, 1, List.of("csch")),
    COTH("coth", 1, 1, List.of("coth")),
    ARCSIN("arcsin", 1, 1, List.of("arcsin", "asin")),
    ARCCOS("arccos", 1, 1, List.of("arccos", "acos")),
    ARCTAN("arctan", 1, 1, List.of("arctan", "atan")),
    ARCSEC("arcsec", 1, 1, List.of("arcsec")),
    ARCCSC("arccsc", 1, 1, List.of("arccsc")),
    ARCCOT("arccot", 1, 1, List.of("arccot")),
    ARCSINH("arcsinh", 1, 1, List.of("arcsinh")),
    ARCCOSH("arccosh", 1, 1, List.of("arccosh")),
    ARCTANH("arctanh", 1, 1, List.of("arctanh")),
    ARCSECH("arcsech", 1, 1, List.of("arcsech")),
    ARCCSCH("arccsch", 1, 1, List.of("arccsch")),
    ARCCOTH("arccoth", 1, 1, List.of("arccoth")),

    EQ("eq", 2, Integer.MAX_VALUE, List.of("eq")),
    NEQ("neq", 2, 2, List.of("neq")),
    GT("gt", 2, Integer.MAX_VALUE, List.of("gt")),
    LT("lt", 2, Integer.MAX_VALUE, List.of("lt")),
    GEQ("geq", 2, Integer.MAX_VALUE, List.of("geq")),
    LEQ("leq", 2, Integer.MAX_VALUE, List.of("leq")),
    AND("and", 1, Integer.MAX_VALUE, List.of("and")),
    OR("or", 1, Integer.MAX_VALUE, List.of("or")),
    XOR("xor", 1, Integer.MAX_VALUE, List.of("xor")),
    NOT("not", 1, 1, List.of("not")),
    /** {@code piecewise(value1, condition1, ..., otherwise)}. */
    PIECEWISE("piecewise", 1, Integer.MAX_VALUE, List.of("piecewise"));

    private static final Map<String, BuiltinFunction> BY_NAME = indexByName();

    private final String mathMlElement;
    private final int minArguments;
    private final int maxArguments;
    private final List<String> names;

    BuiltinFunction(String mathMlElement, int minArguments, int maxArguments, List<String> names) {
        this.mathMlElement = mathMlElement;
        this.minArguments = minArguments;
        this.maxArguments = maxArguments;
        this.names = names;
    }

    /**
     * Finds the builtin called by the given name.
     *
     * @param name function name as written in a formula (case sensitive)
     * @return the builtin, or empty if the name is not builtin
     */
    public static Optional<BuiltinFunction> lookup(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static boolean isBuiltin(String name) {
        return BY_NAME.containsKey(name);
    }

    /**
     * Returns every callable name, in declaration order.
     *
     * @return unmodifiable name to builtin map
     */
    public static Map<String, BuiltinFunction> byName() {
        return BY_NAME;
    }

    public String mathMlElement() {
        return mathMlElement;
    }

    public int minArguments() {
        return minArguments;
    }

    public int maxArguments() {
        return maxArguments;
    }

    public List<String> names() {
        return names;
    }

    public boolean acceptsArgumentCount(int count) {
        return count >= minArguments && count <= maxArguments;
    }

    /**
     * Describes the accepted argument count for error messages, e.g. "1", "1 to 2", "at least 2".
     *
     * @return human readable arity
     */
    public String describeArity() {
        if (minArguments == maxArguments) {
            return String.valueOf(minArguments);
        }
        if (maxArguments == Integer.MAX_VALUE) {
            return "at least " + minArguments;
        }
        return minArguments + " to " + maxArguments;
    }

    private static Map<String, BuiltinFunction> indexByName() {
        Map<String, BuiltinFunction> index = new LinkedHashMap<>();
        Arrays.stream(values()).forEach(function -> function.names.forEach(name -> index.put(name, function)));
        return Collections.unmodifiableMap(index);
    }
}
