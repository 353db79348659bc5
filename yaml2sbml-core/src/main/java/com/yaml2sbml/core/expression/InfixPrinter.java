package com.yaml2sbml.core.expression;

import java.util.stream.Collectors;

/**
 * Writes an expression tree back to infix text.
 *
 * <p>Parentheses are emitted only where precedence or associativity requires them,
 * so compiling the printed text yields a tree equal to the input tree.
 */
public final class InfixPrinter {

    private static final int ATOM_PRECEDENCE = Integer.MAX_VALUE;

    private InfixPrinter() {
    }

    public static String print(Expression expression) {
        StringBuilder sb = new StringBuilder();
        append(sb, expression);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Expression node) {
        if (node instanceof NumberLiteral number) {
            appendNumber(sb, number.value());
        } else if (node instanceof Identifier identifier) {
            sb.append(identifier.name());
        } else if (node instanceof UnaryOperation unary) {
            sb.append(unary.operator().symbol());
            appendOperand(sb, unary.operand(), precedenceOf(unary.operand()) < UnaryOperator.PRECEDENCE);
        } else if (node instanceof BinaryOperation binary) {
            appendBinary(sb, binary);
        } else if (node instanceof FunctionCall call) {
            sb.append(call.name()).append('(');
            sb.append(call.arguments().stream().map(InfixPrinter::print).collect(Collectors.joining(", ")));
            sb.append(')');
        } else {
            throw new IllegalArgumentException("Unsupported expression node: " + node);
        }
    }

    private static void appendBinary(StringBuilder sb, BinaryOperation binary) {
        BinaryOperator operator = binary.operator();
        int leftPrecedence = precedenceOf(binary.left());
        int rightPrecedence = precedenceOf(binary.right());

        boolean leftNeedsParens = operator.isRightAssociative()
            ? leftPrecedence <= operator.precedence()
            : leftPrecedence < operator.precedence();
        boolean rightNeedsParens = operator.isRightAssociative()
            ? rightPrecedence < operator.precedence()
            : rightPrecedence <= operator.precedence();

        appendOperand(sb, binary.left(), leftNeedsParens);
        sb.append(' ').append(operator.symbol()).append(' ');
        appendOperand(sb, binary.right(), rightNeedsParens);
    }

    private static void appendOperand(StringBuilder sb, Expression operand, boolean parenthesize) {
        if (parenthesize) {
            sb.append('(');
            append(sb, operand);
            sb.append(')');
        } else {
            append(sb, operand);
        }
    }

    private static void appendNumber(StringBuilder sb, double value) {
        // a negative literal only comes from hand-built trees; keep it a single operand
        if (value < 0 || (value == 0 && 1 / value < 0)) {
            sb.append('(').append(NumberFormats.format(value)).append(')');
        } else {
            sb.append(NumberFormats.format(value));
        }
    }

    private static int precedenceOf(Expression node) {
        if (node instanceof BinaryOperation binary) {
            return binary.operator().precedence();
        }
        if (node instanceof UnaryOperation) {
            return UnaryOperator.PRECEDENCE;
        }
        return ATOM_PRECEDENCE;
    }
}
