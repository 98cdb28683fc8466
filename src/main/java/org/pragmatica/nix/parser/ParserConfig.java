package org.pragmatica.nix.parser;

import com.google.common.base.Preconditions;

/**
 * Parser configuration options.
 *
 * @param recursionLimit maximum nesting the parser descends into before it reports
 *                       {@link org.pragmatica.nix.error.ParseError.RecursionLimitExceeded} and
 *                       skips the nested input
 */
public record ParserConfig(int recursionLimit) {
    public static final int DEFAULT_RECURSION_LIMIT = 512;

    public static final ParserConfig DEFAULT = new ParserConfig(DEFAULT_RECURSION_LIMIT);

    public ParserConfig {
        Preconditions.checkArgument(recursionLimit > 0, "recursion limit must be positive, got %s", recursionLimit);
    }
}
