package org.pragmatica.nix;

import org.pragmatica.nix.ast.Root;
import org.pragmatica.nix.parser.Parse;
import org.pragmatica.nix.parser.Parser;
import org.pragmatica.nix.parser.ParserConfig;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for parsing Nix expressions.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parse = NixParser.parse("let x = 1; in x + 2");
 * parse.errors().forEach(error -> System.err.println(error.message()));
 * var root = parse.tree();
 *
 * var strict = NixParser.builder()
 *                       .recursionLimit(128)
 *                       .build();
 * var deep = strict.parseRoot(source);
 * }</pre>
 *
 * <p>Parsing never fails: a tree covering the whole input is always produced and syntax errors
 * are reported alongside it.
 */
public final class NixParser {
    private static final Logger LOG = Logger.getLogger(NixParser.class.getName());

    private static final NixParser DEFAULT = new NixParser(ParserConfig.DEFAULT);

    private final ParserConfig config;

    private NixParser(ParserConfig config) {
        this.config = config;
    }

    /**
     * Parse with the default configuration.
     */
    public static Parse<Root> parse(String input) {
        return DEFAULT.parseRoot(input);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ParserConfig config() {
        return config;
    }

    public Parse<Root> parseRoot(String input) {
        var output = Parser.parse(input, config);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("parsed " + input.length() + " chars with " + output.errors().size() + " error(s)");
        }
        return new Parse<>(output.green(), output.errors(), Root.TYPE);
    }

    public static final class Builder {
        private int recursionLimit = ParserConfig.DEFAULT_RECURSION_LIMIT;

        private Builder() {}

        public Builder recursionLimit(int limit) {
            this.recursionLimit = limit;
            return this;
        }

        public NixParser build() {
            return new NixParser(new ParserConfig(recursionLimit));
        }
    }
}
