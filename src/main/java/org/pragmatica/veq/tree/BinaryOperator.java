package org.pragmatica.veq.tree;

import java.util.Optional;

/**
 * Infix operators with their binding strength. Higher binds tighter.
 */
public enum BinaryOperator {
    ADD('+', 1),
    SUBTRACT('-', 1),
    MULTIPLY('*', 2),
    DIVIDE('/', 2),
    MODULO('%', 2),
    POWER('^', 3);

    private final char symbol;
    private final int precedence;

    BinaryOperator(char symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public char symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return this == POWER;
    }

    public static Optional<BinaryOperator> bySymbol(char symbol) {
        for (var operator : values()) {
            if (operator.symbol == symbol) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
