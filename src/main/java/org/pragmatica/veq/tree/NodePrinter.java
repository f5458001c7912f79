package org.pragmatica.veq.tree;

import java.math.BigDecimal;

/**
 * Renders a tree back into equation syntax, emitting only the parentheses
 * needed to reproduce the same tree when parsed again.
 */
public final class NodePrinter {
    private static final int DEFAULT_CAPACITY = 64;

    private final StringBuilder sb = new StringBuilder(DEFAULT_CAPACITY);

    private NodePrinter() {}

    public static String print(Node node) {
        var printer = new NodePrinter();
        printer.append(node);
        return printer.sb.toString();
    }

    private void append(Node node) {
        if (node instanceof Node.Literal literal) {
            appendLiteral(literal.value());
        } else if (node instanceof Node.VariableRef ref) {
            sb.append(ref.variable().keyword());
        } else if (node instanceof Node.Negate negate) {
            sb.append('-');
            appendOperand(negate.operand(), needsParensUnderNegate(negate.operand()));
        } else if (node instanceof Node.Binary binary) {
            appendBinary(binary);
        } else if (node instanceof Node.Call call) {
            sb.append(call.function().keyword()).append('(');
            append(call.argument());
            sb.append(')');
        }
    }

    private void appendBinary(Node.Binary binary) {
        var operator = binary.operator();
        appendOperand(binary.left(), needsParensOnLeft(operator, binary.left()));
        if (operator == BinaryOperator.POWER) {
            sb.append(operator.symbol());
        } else {
            sb.append(' ').append(operator.symbol()).append(' ');
        }
        appendOperand(binary.right(), needsParensOnRight(operator, binary.right()));
    }

    private void appendOperand(Node operand, boolean parenthesize) {
        if (parenthesize) {
            sb.append('(');
            append(operand);
            sb.append(')');
        } else {
            append(operand);
        }
    }

    private void appendLiteral(double value) {
        if (Double.isNaN(value)) {
            sb.append("(0/0)");
            return;
        }
        if (value == Double.POSITIVE_INFINITY) {
            sb.append("(1/0)");
            return;
        }
        if (value < 0 || (value == 0 && 1 / value < 0)) {
            sb.append("(-");
            appendLiteral(-value);
            sb.append(')');
            return;
        }
        var plain = BigDecimal.valueOf(value).toPlainString();
        if (plain.endsWith(".0")) {
            plain = plain.substring(0, plain.length() - 2);
        }
        sb.append(plain);
    }

    private static boolean needsParensUnderNegate(Node operand) {
        return operand instanceof Node.Binary binary && binary.operator() != BinaryOperator.POWER;
    }

    private static boolean needsParensOnLeft(BinaryOperator operator, Node left) {
        if (left instanceof Node.Negate) {
            // -a^b reads as -(a^b)
            return operator == BinaryOperator.POWER;
        }
        if (left instanceof Node.Binary binary) {
            var inner = binary.operator().precedence();
            return inner < operator.precedence()
                   || (inner == operator.precedence() && operator.isRightAssociative());
        }
        return false;
    }

    private static boolean needsParensOnRight(BinaryOperator operator, Node right) {
        if (right instanceof Node.Binary binary) {
            var inner = binary.operator().precedence();
            return inner < operator.precedence()
                   || (inner == operator.precedence() && !operator.isRightAssociative());
        }
        return false;
    }
}
