package org.pragmatica.veq.error;

/**
 * Malformed token sequence.
 */
public sealed interface ParseError extends SyntaxError {

    /**
     * A token other than the one the grammar requires.
     */
    record UnexpectedToken(
    int position,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at position " + position + ", expected " + expected;
        }
    }

    /**
     * Input ended while the grammar still required something.
     */
    record UnexpectedEnd(
    int position,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at position " + position + ", expected " + expected;
        }
    }

    /**
     * Name that is neither a variable, a constant nor a function.
     */
    record UnknownIdentifier(
    int position,
    String name) implements ParseError {
        @Override
        public String message() {
            return "Unknown identifier '" + name + "' at position " + position;
        }
    }

    /**
     * Closing parenthesis without a matching opening one.
     */
    record UnmatchedParenthesis(int position) implements ParseError {
        @Override
        public String message() {
            return "Unexpected ')' at position " + position + " without matching '('";
        }
    }

    /**
     * Nesting deeper than {@link org.pragmatica.veq.parser.ParserConfig#maxDepth()}.
     */
    record TooDeeplyNested(
    int position,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "Expression too deeply nested at position " + position + " (limit " + limit + ")";
        }
    }

    /**
     * Equation text longer than {@link org.pragmatica.veq.parser.ParserConfig#maxInputLength()}.
     */
    record InputTooLong(
    int position,
    int length,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "Equation of " + length + " characters exceeds maximum of " + limit;
        }
    }
}
