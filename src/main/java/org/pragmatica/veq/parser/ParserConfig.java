package org.pragmatica.veq.parser;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Parser configuration options.
 *
 * @param maxDepth       deepest allowed nesting of parentheses, negations and exponents
 * @param maxInputLength longest accepted equation text
 */
public record ParserConfig(
    int maxDepth,
    int maxInputLength
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        256,
        10_000
    );

    public ParserConfig {
        checkArgument(maxDepth > 0, "maxDepth must be positive, got %s", maxDepth);
        checkArgument(maxInputLength > 0, "maxInputLength must be positive, got %s", maxInputLength);
    }
}
