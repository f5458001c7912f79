package org.pragmatica.veq.parser;

import org.pragmatica.veq.tree.SourceSpan;

/**
 * Token types for the equation lexer.
 */
public sealed interface Token {
    SourceSpan span();

    String text();

    default int position() {
        return span().start();
    }

    record Number(SourceSpan span, String text, double value) implements Token {}

    record Identifier(SourceSpan span, String text) implements Token {}

    // + - * / ^ %
    record Operator(SourceSpan span, char symbol) implements Token {
        @Override
        public String text() {
            return String.valueOf(symbol);
        }
    }

    // (
    record LParen(SourceSpan span) implements Token {
        @Override
        public String text() {
            return "(";
        }
    }

    // )
    record RParen(SourceSpan span) implements Token {
        @Override
        public String text() {
            return ")";
        }
    }

    // Special
    record Eof(SourceSpan span) implements Token {
        @Override
        public String text() {
            return "";
        }
    }

    record Error(SourceSpan span, char character) implements Token {
        @Override
        public String text() {
            return String.valueOf(character);
        }
    }
}
