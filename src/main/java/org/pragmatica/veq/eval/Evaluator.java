package org.pragmatica.veq.eval;

import org.pragmatica.veq.tree.BinaryOperator;
import org.pragmatica.veq.tree.MathFunction;
import org.pragmatica.veq.tree.Node;

/**
 * Evaluates expression trees with IEEE-754 double semantics.
 *
 * <p>Evaluation is pure and total: domain errors and singularities produce
 * NaN or an infinity instead of an exception, and the same tree with the
 * same bindings always yields the same bits.
 */
public final class Evaluator {
    // Above this, sqrt(x^2 + 1) and sqrt(x^2 - 1) both round to x
    private static final double LARGE = 0x1p28;
    private static final double LN2 = Math.log(2);

    private Evaluator() {}

    public static double evaluate(Node node, Bindings bindings) {
        if (node instanceof Node.Literal literal) {
            return literal.value();
        }
        if (node instanceof Node.VariableRef ref) {
            return bindings.valueOf(ref.variable());
        }
        if (node instanceof Node.Negate negate) {
            return -evaluate(negate.operand(), bindings);
        }
        if (node instanceof Node.Binary binary) {
            return apply(binary.operator(),
                         evaluate(binary.left(), bindings),
                         evaluate(binary.right(), bindings));
        }
        var call = (Node.Call) node;
        return apply(call.function(), evaluate(call.argument(), bindings));
    }

    /**
     * Apply an infix operator. {@code %} keeps the sign of the dividend and
     * a negative base with a fractional exponent gives NaN.
     */
    public static double apply(BinaryOperator operator, double left, double right) {
        return switch (operator) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> left / right;
            case MODULO -> left % right;
            case POWER -> Math.pow(left, right);
        };
    }

    /**
     * Apply a function. {@code round} rounds half to even.
     */
    public static double apply(MathFunction function, double value) {
        return switch (function) {
            case SIN -> Math.sin(value);
            case COS -> Math.cos(value);
            case TAN -> Math.tan(value);
            case ASIN -> Math.asin(value);
            case ACOS -> Math.acos(value);
            case ATAN -> Math.atan(value);
            case SINH -> Math.sinh(value);
            case COSH -> Math.cosh(value);
            case TANH -> Math.tanh(value);
            case ASINH -> asinh(value);
            case ACOSH -> acosh(value);
            case ATANH -> atanh(value);
            case RAD -> Math.toRadians(value);
            case DEG -> Math.toDegrees(value);
            case LOG -> value > 0 ? Math.log(value) : Double.NaN;
            case ABS -> Math.abs(value);
            case ROUND -> Math.rint(value);
            case SIGN -> Math.signum(value);
        };
    }

    private static double asinh(double value) {
        var magnitude = Math.abs(value);
        double result;
        if (magnitude > LARGE) {
            result = Math.log(magnitude) + LN2;
        } else {
            var square = magnitude * magnitude;
            result = Math.log1p(magnitude + square / (1 + Math.sqrt(1 + square)));
        }
        return Math.copySign(result, value);
    }

    private static double acosh(double value) {
        if (!(value >= 1)) {
            return Double.NaN;
        }
        if (value > LARGE) {
            return Math.log(value) + LN2;
        }
        var excess = value - 1;
        return Math.log1p(excess + Math.sqrt(2 * excess + excess * excess));
    }

    private static double atanh(double value) {
        // +-Infinity at +-1, NaN outside [-1, 1]
        var magnitude = Math.abs(value);
        return Math.copySign(0.5 * Math.log1p(2 * magnitude / (1 - magnitude)), value);
    }
}
