package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;

import java.util.Optional;

/**
 * Prefix operators: boolean {@code !} and arithmetic {@code -}.
 */
public enum UnaryOpKind {
    INVERT(SyntaxKind.TOKEN_INVERT),
    NEGATE(SyntaxKind.TOKEN_SUB);

    private final SyntaxKind token;

    UnaryOpKind(SyntaxKind token) {
        this.token = token;
    }

    public SyntaxKind token() {
        return token;
    }

    public static Optional<UnaryOpKind> fromToken(SyntaxKind kind) {
        if (kind == SyntaxKind.TOKEN_INVERT) {
            return Optional.of(INVERT);
        }
        if (kind == SyntaxKind.TOKEN_SUB) {
            return Optional.of(NEGATE);
        }
        return Optional.empty();
    }
}
