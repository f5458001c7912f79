package org.pragmatica.veq.parser;

import org.pragmatica.veq.Expression;

/**
 * Turns equation text into an evaluable expression.
 *
 * <p>Implementations hold only configuration and may be shared across threads.
 */
@FunctionalInterface
public interface Parser {

    /**
     * Parse equation text.
     */
    ParseResult<Expression> parse(String text);
}
