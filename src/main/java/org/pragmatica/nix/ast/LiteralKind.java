package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxToken;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Value of a literal token.
 */
public sealed interface LiteralKind {
    String text();

    record IntegerLiteral(String text) implements LiteralKind {
        /**
         * The value, empty when it does not fit a signed 64-bit integer.
         */
        public OptionalLong value() {
            try {
                return OptionalLong.of(Long.parseLong(text));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
    }

    record FloatLiteral(String text) implements LiteralKind {
        public double value() {
            return Double.parseDouble(text);
        }
    }

    record UriLiteral(String text) implements LiteralKind {}

    static Optional<LiteralKind> of(SyntaxToken token) {
        return switch (token.kind()) {
            case TOKEN_INTEGER -> Optional.of(new IntegerLiteral(token.text()));
            case TOKEN_FLOAT -> Optional.of(new FloatLiteral(token.text()));
            case TOKEN_URI -> Optional.of(new UriLiteral(token.text()));
            default -> Optional.empty();
        };
    }
}
