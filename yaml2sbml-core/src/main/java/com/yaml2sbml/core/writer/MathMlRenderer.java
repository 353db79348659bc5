package com.yaml2sbml.core.writer;

import java.util.List;
import java.util.Objects;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.yaml2sbml.core.expression.BinaryOperation;
import com.yaml2sbml.core.expression.BuiltinFunction;
import com.yaml2sbml.core.expression.CompiledFormula;
import com.yaml2sbml.core.expression.Expression;
import com.yaml2sbml.core.expression.FunctionCall;
import com.yaml2sbml.core.expression.Identifier;
import com.yaml2sbml.core.expression.NumberFormats;
import com.yaml2sbml.core.expression.NumberLiteral;
import com.yaml2sbml.core.expression.ReservedConstant;
import com.yaml2sbml.core.expression.UnaryOperation;

/**
 * Writes expression trees as MathML content elements of an SBML document.
 *
 * <p>Every operator and builtin becomes an {@code <apply>}; identifiers become
 * {@code <ci>}, numbers {@code <cn>}. Reserved names map to MathML constants or, for
 * time and Avogadro's number, to SBML csymbols.
 */
public class MathMlRenderer {

    public static final String MATHML_NAMESPACE = "http://www.w3.org/1998/Math/MathML";
    static final String TIME_SYMBOL_URL = "http://www.sbml.org/sbml/symbols/time";
    static final String AVOGADRO_SYMBOL_URL = "http://www.sbml.org/sbml/symbols/avogadro";

    private final Document doc;

    public MathMlRenderer(Document doc) {
        this.doc = Objects.requireNonNull(doc, "doc must not be null");
    }

    /**
     * Creates a {@code <math>} element holding the formula.
     *
     * @param formula compiled formula
     * @return math element
     */
    public Element math(CompiledFormula formula) {
        Element math = mathElement();
        math.appendChild(render(formula.tree()));
        return math;
    }

    /**
     * Creates a {@code <math>} element holding a lambda with one {@code <bvar>} per argument.
     *
     * @param arguments argument names in order
     * @param body function body
     * @return math element
     */
    public Element lambda(List<String> arguments, CompiledFormula body) {
        Element lambda = doc.createElement("lambda");
        for (String argument : arguments) {
            Element bvar = doc.createElement("bvar");
            bvar.appendChild(ci(argument));
            lambda.appendChild(bvar);
        }
        lambda.appendChild(render(body.tree()));

        Element math = mathElement();
        math.appendChild(lambda);
        return math;
    }

    /**
     * Renders one expression node.
     *
     * @param node expression
     * @return content element
     */
    public Element render(Expression node) {
        if (node instanceof NumberLiteral number) {
            return cn(number.value());
        }
        if (node instanceof Identifier identifier) {
            return ReservedConstant.lookup(identifier.name())
                .map(this::constant)
                .orElseGet(() -> ci(identifier.name()));
        }
        if (node instanceof UnaryOperation unary) {
            return apply(unary.operator().mathMlElement(), render(unary.operand()));
        }
        if (node instanceof BinaryOperation binary) {
            return apply(binary.operator().mathMlElement(), render(binary.left()), render(binary.right()));
        }
        if (node instanceof FunctionCall call) {
            return call.builtin()
                .map(builtin -> builtinCall(builtin, call.arguments()))
                .orElseGet(() -> userCall(call));
        }
        throw new IllegalArgumentException("Unsupported expression node: " + node.getClass().getSimpleName());
    }

    // ==================== Calls ====================

    private Element builtinCall(BuiltinFunction builtin, List<Expression> arguments) {
        switch (builtin) {
            case LOG:
                if (arguments.size() == 2) {
                    return apply("log", qualifier("logbase", arguments.get(0)), render(arguments.get(1)));
                }
                return apply("log", render(arguments.get(0)));
            case SQRT:
                return apply("root", qualifier("degree", new NumberLiteral(2)), render(arguments.get(0)));
            case ROOT:
                return apply("root", qualifier("degree", arguments.get(0)), render(arguments.get(1)));
            case PIECEWISE:
                return piecewise(arguments);
            default:
                Element apply = doc.createElement("apply");
                apply.appendChild(doc.createElement(builtin.mathMlElement()));
                arguments.forEach(argument -> apply.appendChild(render(argument)));
                return apply;
        }
    }

    private Element userCall(FunctionCall call) {
        Element apply = doc.createElement("apply");
        apply.appendChild(ci(call.name()));
        call.arguments().forEach(argument -> apply.appendChild(render(argument)));
        return apply;
    }

    /**
     * {@code piecewise(v1, c1, v2, c2, ..., otherwise)}: pairs become pieces, a trailing
     * odd argument becomes the otherwise branch.
     */
    private Element piecewise(List<Expression> arguments) {
        Element piecewise = doc.createElement("piecewise");
        int i = 0;
        for (; i + 1 < arguments.size(); i += 2) {
            Element piece = doc.createElement("piece");
            piece.appendChild(render(arguments.get(i)));
            piece.appendChild(render(arguments.get(i + 1)));
            piecewise.appendChild(piece);
        }
        if (i < arguments.size()) {
            Element otherwise = doc.createElement("otherwise");
            otherwise.appendChild(render(arguments.get(i)));
            piecewise.appendChild(otherwise);
        }
        return piecewise;
    }

    // ==================== Leaves ====================

    private Element constant(ReservedConstant constant) {
        switch (constant) {
            case TIME:
                return csymbol(TIME_SYMBOL_URL, "time");
            case AVOGADRO:
                return csymbol(AVOGADRO_SYMBOL_URL, "avogadro");
            case PI:
                return doc.createElement("pi");
            case EXPONENTIALE:
                return doc.createElement("exponentiale");
            case TRUE:
                return doc.createElement("true");
            case FALSE:
                return doc.createElement("false");
            case INFINITY:
                return doc.createElement("infinity");
            case NOT_A_NUMBER:
                return doc.createElement("notanumber");
            default:
                throw new IllegalArgumentException("Unsupported constant: " + constant);
        }
    }

    private Element csymbol(String definitionUrl, String text) {
        Element csymbol = doc.createElement("csymbol");
        csymbol.setAttribute("encoding", "text");
        csymbol.setAttribute("definitionURL", definitionUrl);
        csymbol.setTextContent(" " + text + " ");
        return csymbol;
    }

    private Element ci(String name) {
        Element ci = doc.createElement("ci");
        ci.setTextContent(" " + name + " ");
        return ci;
    }

    private Element cn(double value) {
        Element cn = doc.createElement("cn");
        if (NumberFormats.isInteger(value)) {
            cn.setAttribute("type", "integer");
        }
        cn.setTextContent(" " + NumberFormats.format(value) + " ");
        return cn;
    }

    private Element qualifier(String name, Expression value) {
        Element qualifier = doc.createElement(name);
        qualifier.appendChild(render(value));
        return qualifier;
    }

    private Element apply(String operator, Element... operands) {
        Element apply = doc.createElement("apply");
        apply.appendChild(doc.createElement(operator));
        for (Element operand : operands) {
            apply.appendChild(operand);
        }
        return apply;
    }

    private Element mathElement() {
        Element math = doc.createElement("math");
        math.setAttribute("xmlns", MATHML_NAMESPACE);
        return math;
    }
}
