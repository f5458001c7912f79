package org.pragmatica.veq.error;

/**
 * Character the lexer does not recognize.
 */
public record LexError(int position, char character) implements SyntaxError {

    @Override
    public String message() {
        return "Unexpected character '" + character + "' at position " + position;
    }
}
