package org.pragmatica.veq.parser;

import com.google.common.collect.ImmutableList;
import org.pragmatica.veq.tree.SourceSpan;

import java.util.List;

/**
 * Lexer for equation text.
 *
 * <p>The token list always ends with either {@link Token.Eof} or, when an
 * unrecognized character is met, a single {@link Token.Error} at which
 * scanning stopped.
 */
public final class ExpressionLexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    private final String input;
    private int pos;

    private ExpressionLexer(String input) {
        this.input = input;
        this.pos = 0;
    }

    public static List<Token> tokenize(String input) {
        return new ExpressionLexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        var tokens = ImmutableList.<Token>builder();
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                tokens.add(new Token.Eof(SourceSpan.at(pos)));
                break;
            }
            var token = nextToken();
            tokens.add(token);
            if (token instanceof Token.Error) {
                break;
            }
        }
        return tokens.build();
    }

    private Token nextToken() {
        int start = pos;
        char c = peek();
        if (isLetter(c)) {
            return scanIdentifier(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        return scanOperator(start);
    }

    private Token scanIdentifier(int start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isLetter(peek())) {
            sb.append(advance());
        }
        return new Token.Identifier(span(start), sb.toString());
    }

    private Token scanNumber(int start) {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        if (!isAtEnd() && peek() == '.') {
            advance();
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }
        var text = input.substring(start, pos);
        return new Token.Number(span(start), text, Double.parseDouble(text));
    }

    private Token scanOperator(int start) {
        char c = advance();
        return switch (c) {
            case '+', '-', '*', '/', '^', '%' -> new Token.Operator(span(start), c);
            case '(' -> new Token.LParen(span(start));
            case ')' -> new Token.RParen(span(start));
            default -> new Token.Error(span(start), c);
        };
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private SourceSpan span(int start) {
        return SourceSpan.of(start, pos);
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
