package org.pragmatica.veq.parser;

import org.pragmatica.veq.Expression;
import org.pragmatica.veq.error.LexError;
import org.pragmatica.veq.error.ParseError;
import org.pragmatica.veq.tree.BinaryOperator;
import org.pragmatica.veq.tree.Constant;
import org.pragmatica.veq.tree.MathFunction;
import org.pragmatica.veq.tree.Node;
import org.pragmatica.veq.tree.Variable;

import java.util.List;

/**
 * Recursive descent parser for equations.
 *
 * <p>Grammar, lowest precedence first:
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := unary (('*' | '/' | '%') unary)*
 * unary   := '-' unary | power
 * power   := primary ('^' unary)?
 * primary := NUMBER | CONSTANT | VARIABLE | FUNCTION '(' expr ')' | '(' expr ')'
 * </pre>
 * Negation applies to a whole power, so {@code -x^2} is {@code -(x^2)}, and
 * {@code ^} is right-associative. Nesting depth is counted against
 * {@link ParserConfig#maxDepth()} on every entry to {@code unary} and for every
 * chained infix operator, so the limit also bounds the depth of the built tree.
 */
public final class ExpressionParser {
    private static final String EXPRESSION = "expression";
    private static final String CLOSING_PAREN = "')'";

    private final List<Token> tokens;
    private final ParserConfig config;
    private int pos;
    private int depth;

    private ExpressionParser(List<Token> tokens, ParserConfig config) {
        this.tokens = tokens;
        this.config = config;
        this.pos = 0;
        this.depth = 0;
    }

    /**
     * Parse equation text with default limits.
     */
    public static ParseResult<Expression> parse(String text) {
        return parse(text, ParserConfig.DEFAULT);
    }

    /**
     * Parse equation text into an expression.
     */
    public static ParseResult<Expression> parse(String text, ParserConfig config) {
        if (text.length() > config.maxInputLength()) {
            return ParseResult.failure(new ParseError.InputTooLong(
                config.maxInputLength(),
                text.length(),
                config.maxInputLength()
            ));
        }

        var tokens = ExpressionLexer.tokenize(text);

        // The lexer stops at the first bad character
        if (tokens.get(tokens.size() - 1) instanceof Token.Error error) {
            return ParseResult.failure(new LexError(error.position(), error.character()));
        }

        return new ExpressionParser(tokens, config).parseEquation()
                                                   .map(root -> Expression.of(text, root));
    }

    private ParseResult<Node> parseEquation() {
        var result = parseExpr();
        if (result.isFailure()) {
            return result;
        }

        var token = peek();
        if (token instanceof Token.Eof) {
            return result;
        }
        if (token instanceof Token.RParen) {
            return ParseResult.failure(new ParseError.UnmatchedParenthesis(token.position()));
        }
        return ParseResult.failure(new ParseError.UnexpectedToken(
            token.position(),
            token.text(),
            "operator or end of input"
        ));
    }

    private ParseResult<Node> parseExpr() {
        var left = parseTerm();
        if (left.isFailure()) {
            return left;
        }
        var node = left.unwrap();

        int chained = 0;
        try {
            while (isOperator('+') || isOperator('-')) {
                // Each chained operator adds a tree level
                if (depth >= config.maxDepth()) {
                    return tooDeeplyNested();
                }
                depth++;
                chained++;
                var operator = operatorOf(advance());
                var right = parseTerm();
                if (right.isFailure()) {
                    return right;
                }
                node = new Node.Binary(operator, node, right.unwrap());
            }
            return ParseResult.success(node);
        } finally {
            depth -= chained;
        }
    }

    private ParseResult<Node> parseTerm() {
        var left = parseUnary();
        if (left.isFailure()) {
            return left;
        }
        var node = left.unwrap();

        int chained = 0;
        try {
            while (isOperator('*') || isOperator('/') || isOperator('%')) {
                if (depth >= config.maxDepth()) {
                    return tooDeeplyNested();
                }
                depth++;
                chained++;
                var operator = operatorOf(advance());
                var right = parseUnary();
                if (right.isFailure()) {
                    return right;
                }
                node = new Node.Binary(operator, node, right.unwrap());
            }
            return ParseResult.success(node);
        } finally {
            depth -= chained;
        }
    }

    private ParseResult<Node> parseUnary() {
        if (depth >= config.maxDepth()) {
            return tooDeeplyNested();
        }
        depth++;
        try {
            if (isOperator('-')) {
                advance();
                return parseUnary().map(Node.Negate::new);
            }
            return parsePower();
        } finally {
            depth--;
        }
    }

    private ParseResult<Node> parsePower() {
        var base = parsePrimary();
        if (base.isFailure() || !isOperator('^')) {
            return base;
        }
        advance();
        // Exponent recurses through unary: right-associative, and 2^-1 is allowed
        return parseUnary().map(exponent -> new Node.Binary(BinaryOperator.POWER, base.unwrap(), exponent));
    }

    private ParseResult<Node> parsePrimary() {
        var token = peek();

        if (token instanceof Token.Number number) {
            advance();
            return ParseResult.success(new Node.Literal(number.value()));
        }

        if (token instanceof Token.Identifier identifier) {
            advance();
            return parseIdentifier(identifier);
        }

        if (token instanceof Token.LParen) {
            advance();
            var inner = parseExpr();
            if (inner.isFailure()) {
                return inner;
            }
            return expectClosingParen().flatMap(closed -> inner);
        }

        return unexpected(token, EXPRESSION);
    }

    private ParseResult<Node> parseIdentifier(Token.Identifier identifier) {
        var name = identifier.text();

        var variable = Variable.byName(name);
        if (variable.isPresent()) {
            return ParseResult.success(new Node.VariableRef(variable.get()));
        }

        // Constants are folded here and never looked up again
        var constant = Constant.byName(name);
        if (constant.isPresent()) {
            return ParseResult.success(new Node.Literal(constant.get().value()));
        }

        var function = MathFunction.byName(name);
        if (function.isPresent()) {
            return parseCall(function.get());
        }

        return ParseResult.failure(new ParseError.UnknownIdentifier(identifier.position(), name));
    }

    private ParseResult<Node> parseCall(MathFunction function) {
        if (!(peek() instanceof Token.LParen)) {
            return unexpected(peek(), "'(' after '" + function.keyword() + "'");
        }
        advance();

        var argument = parseExpr();
        if (argument.isFailure()) {
            return argument;
        }
        return expectClosingParen().map(closed -> new Node.Call(function, argument.unwrap()));
    }

    private ParseResult<Token> expectClosingParen() {
        var token = peek();
        if (token instanceof Token.RParen) {
            advance();
            return ParseResult.success(token);
        }
        return unexpected(token, CLOSING_PAREN);
    }

    private <T> ParseResult<T> tooDeeplyNested() {
        return ParseResult.failure(new ParseError.TooDeeplyNested(peek().position(), config.maxDepth()));
    }

    private static <T> ParseResult<T> unexpected(Token token, String expected) {
        if (token instanceof Token.Eof) {
            return ParseResult.failure(new ParseError.UnexpectedEnd(token.position(), expected));
        }
        return ParseResult.failure(new ParseError.UnexpectedToken(token.position(), token.text(), expected));
    }

    private boolean isOperator(char symbol) {
        return peek() instanceof Token.Operator operator && operator.symbol() == symbol;
    }

    private static BinaryOperator operatorOf(Token token) {
        var symbol = ((Token.Operator) token).symbol();
        return BinaryOperator.bySymbol(symbol)
                             .orElseThrow(() -> new IllegalStateException("Not a binary operator: " + symbol));
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token advance() {
        var token = tokens.get(pos);
        if (!(token instanceof Token.Eof)) {
            pos++;
        }
        return token;
    }
}
