package com.yaml2sbml.core.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.yaml2sbml.core.exception.ExpressionSyntaxException;
import com.yaml2sbml.core.exception.UnknownFunctionException;
import com.yaml2sbml.parser.FormulaBaseVisitor;
import com.yaml2sbml.parser.FormulaLexer;
import com.yaml2sbml.parser.FormulaParser;

/**
 * Compiles infix formula text into an {@link Expression} tree.
 *
 * <p>Parsing uses the ANTLR {@code Formula} grammar. The first lexer or parser error
 * aborts compilation with an {@link ExpressionSyntaxException}; ANTLR's recovery is
 * never used to produce a partial tree.
 *
 * <p>The compiler checks call targets: builtins must be called with an accepted number
 * of arguments, and any other name must be accepted by the declared-function predicate
 * given at construction, otherwise {@link UnknownFunctionException} is thrown.
 * Identifiers are <em>not</em> resolved here; see
 * {@link com.yaml2sbml.core.registry.ReferenceValidator}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ExpressionCompiler compiler = new ExpressionCompiler(registry::isFunction);
 * CompiledFormula rhs = compiler.compile("alpha*prey - prey*predator", Set.of());
 * rhs.freeIdentifiers(); // [alpha, prey, predator]
 * }</pre>
 */
public class ExpressionCompiler {

    private static final Logger log = LoggerFactory.getLogger(ExpressionCompiler.class);

    /** Deepest parenthesis nesting a formula may use. */
    static final int MAX_NESTING_DEPTH = 256;

    private final Predicate<String> declaredFunctions;

    /**
     * Creates a compiler that accepts builtin calls only.
     */
    public ExpressionCompiler() {
        this(name -> false);
    }

    /**
     * Creates a compiler that also accepts calls to the given user functions.
     *
     * @param declaredFunctions tests whether a name is a declared function definition
     */
    public ExpressionCompiler(Predicate<String> declaredFunctions) {
        this.declaredFunctions = Objects.requireNonNull(declaredFunctions, "declaredFunctions must not be null");
    }

    public CompiledFormula compile(String formula) {
        return compile(formula, Set.of());
    }

    /**
     * Compiles a formula.
     *
     * @param formula infix formula text
     * @param boundNames names scoped to this formula (function arguments); recorded on the result
     * @return the compiled formula
     * @throws ExpressionSyntaxException if the text is not a well-formed formula
     * @throws UnknownFunctionException if a call target is neither builtin nor declared
     */
    public CompiledFormula compile(String formula, Set<String> boundNames) {
        Objects.requireNonNull(formula, "formula must not be null");
        if (formula.isBlank()) {
            throw new ExpressionSyntaxException(formula, 0, "Formula is empty");
        }

        checkNesting(formula);

        FailFastErrorListener errorListener = new FailFastErrorListener(formula);

        FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(formula));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        FormulaParser parser = new FormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        Expression tree;
        try {
            FormulaParser.FormulaContext parseTree = parser.formula();
            tree = new TreeBuilder(formula).visit(parseTree);
        } catch (StackOverflowError e) {
            // long chains of signs or powers recurse without parentheses
            throw new ExpressionSyntaxException(formula, -1, "Formula is nested too deeply");
        }

        log.debug("Compiled formula '{}' to '{}'", formula, tree.toInfix());
        return new CompiledFormula(formula, tree, boundNames);
    }

    private static void checkNesting(String formula) {
        int depth = 0;
        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (c == '(') {
                depth++;
                if (depth > MAX_NESTING_DEPTH) {
                    throw new ExpressionSyntaxException(formula, i,
                        "Parentheses are nested more than " + MAX_NESTING_DEPTH + " levels deep");
                }
            } else if (c == ')') {
                depth--;
            }
        }
    }

    /**
     * Turns the first syntax error into an exception.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        private final String formula;

        FailFastErrorListener(String formula) {
            this.formula = formula;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            int position = offendingSymbol instanceof Token token && token.getStartIndex() >= 0
                ? token.getStartIndex()
                : charPositionInLine;
            throw new ExpressionSyntaxException(formula, position, "Syntax error: " + msg);
        }
    }

    /**
     * Builds {@link Expression} records from the parse tree.
     */
    private final class TreeBuilder extends FormulaBaseVisitor<Expression> {

        private final String formula;

        TreeBuilder(String formula) {
            this.formula = formula;
        }

        @Override
        public Expression visitFormula(FormulaParser.FormulaContext ctx) {
            return visit(ctx.additive());
        }

        @Override
        public Expression visitAdditive(FormulaParser.AdditiveContext ctx) {
            Expression result = visit(ctx.multiplicative(0));
            for (int i = 1; i < ctx.multiplicative().size(); i++) {
                BinaryOperator operator = ctx.additiveOperator(i - 1).PLUS() != null
                    ? BinaryOperator.ADD
                    : BinaryOperator.SUBTRACT;
                result = new BinaryOperation(operator, result, visit(ctx.multiplicative(i)));
            }
            return result;
        }

        @Override
        public Expression visitMultiplicative(FormulaParser.MultiplicativeContext ctx) {
            Expression result = visit(ctx.power(0));
            for (int i = 1; i < ctx.power().size(); i++) {
                BinaryOperator operator = ctx.multiplicativeOperator(i - 1).STAR() != null
                    ? BinaryOperator.MULTIPLY
                    : BinaryOperator.DIVIDE;
                result = new BinaryOperation(operator, result, visit(ctx.power(i)));
            }
            return result;
        }

        @Override
        public Expression visitPower(FormulaParser.PowerContext ctx) {
            Expression base = visit(ctx.unary());
            if (ctx.power() == null) {
                return base;
            }
            return new BinaryOperation(BinaryOperator.POWER, base, visit(ctx.power()));
        }

        @Override
        public Expression visitSignedUnary(FormulaParser.SignedUnaryContext ctx) {
            Expression operand = visit(ctx.unary());
            if (ctx.MINUS() != null) {
                return new UnaryOperation(UnaryOperator.NEGATE, operand);
            }
            return operand;
        }

        @Override
        public Expression visitPrimaryUnary(FormulaParser.PrimaryUnaryContext ctx) {
            return visit(ctx.primary());
        }

        @Override
        public Expression visitNumberPrimary(FormulaParser.NumberPrimaryContext ctx) {
            TerminalNode number = ctx.NUMBER();
            double value = Double.parseDouble(number.getText());
            if (Double.isInfinite(value)) {
                throw new ExpressionSyntaxException(formula, number.getSymbol().getStartIndex(),
                    "Numeric literal '" + number.getText() + "' is out of range");
            }
            return new NumberLiteral(value);
        }

        @Override
        public Expression visitIdentifierPrimary(FormulaParser.IdentifierPrimaryContext ctx) {
            return new Identifier(ctx.IDENTIFIER().getText());
        }

        @Override
        public Expression visitGroupPrimary(FormulaParser.GroupPrimaryContext ctx) {
            return visit(ctx.additive());
        }

        @Override
        public Expression visitCallPrimary(FormulaParser.CallPrimaryContext ctx) {
            String name = ctx.IDENTIFIER().getText();
            List<Expression> arguments = new ArrayList<>();
            if (ctx.arguments() != null) {
                ctx.arguments().additive().forEach(argument -> arguments.add(visit(argument)));
            }

            BuiltinFunction builtin = BuiltinFunction.lookup(name).orElse(null);
            if (builtin != null) {
                if (!builtin.acceptsArgumentCount(arguments.size())) {
                    throw new ExpressionSyntaxException(formula, ctx.getStart().getStartIndex(),
                        "Function '" + name + "' expects " + builtin.describeArity()
                            + " argument(s) but got " + arguments.size());
                }
            } else if (!declaredFunctions.test(name)) {
                throw new UnknownFunctionException(name,
                    "Unknown function '" + name + "' in formula '" + formula + "'");
            }
            return new FunctionCall(name, arguments);
        }
    }
}
