package org.pragmatica.veq.error;

/**
 * Reason an equation could not be turned into an expression.
 *
 * <p>Every error points at a 0-based column of the equation text.
 */
public sealed interface SyntaxError permits LexError, ParseError {

    int position();

    String message();
}
