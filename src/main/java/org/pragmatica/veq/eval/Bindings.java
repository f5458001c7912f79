package org.pragmatica.veq.eval;

import org.pragmatica.veq.tree.Variable;

/**
 * Values of the runtime variables for one evaluation.
 */
public record Bindings(double x, double t) {

    public static Bindings of(double x, double t) {
        return new Bindings(x, t);
    }

    public Bindings withX(double newX) {
        return new Bindings(newX, t);
    }

    public double valueOf(Variable variable) {
        return switch (variable) {
            case X -> x;
            case T -> t;
        };
    }
}
