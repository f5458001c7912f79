package org.pragmatica.veq;

import org.pragmatica.veq.parser.ExpressionParser;
import org.pragmatica.veq.parser.ParseResult;
import org.pragmatica.veq.parser.Parser;
import org.pragmatica.veq.parser.ParserConfig;

/**
 * Entry point for turning equation text into expressions.
 *
 * <p>Example usage:
 * <pre>{@code
 * var curve = Veq.parse("sin(x - t) * e^(-x^2)").unwrap();
 *
 * double y = curve.evaluate(0.5, 0.0);
 * }</pre>
 */
public final class Veq {
    private Veq() {}

    /**
     * Parse equation text with default limits.
     */
    public static ParseResult<Expression> parse(String text) {
        return parse(text, ParserConfig.DEFAULT);
    }

    /**
     * Parse equation text with custom configuration.
     */
    public static ParseResult<Expression> parse(String text, ParserConfig config) {
        return ExpressionParser.parse(text, config);
    }

    /**
     * Create a parser with the given configuration.
     */
    public static Parser parser(ParserConfig config) {
        return text -> ExpressionParser.parse(text, config);
    }

    /**
     * Create a builder for parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDepth = ParserConfig.DEFAULT.maxDepth();
        private int maxInputLength = ParserConfig.DEFAULT.maxInputLength();

        private Builder() {}

        public Builder maxDepth(int depth) {
            this.maxDepth = depth;
            return this;
        }

        public Builder maxInputLength(int length) {
            this.maxInputLength = length;
            return this;
        }

        public Parser build() {
            return parser(new ParserConfig(maxDepth, maxInputLength));
        }
    }
}
