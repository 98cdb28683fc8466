package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;

import java.util.Optional;

/**
 * Binary operators.
 */
public enum BinOpKind {
    CONCAT(SyntaxKind.TOKEN_CONCAT),
    UPDATE(SyntaxKind.TOKEN_UPDATE),
    ADD(SyntaxKind.TOKEN_ADD),
    SUB(SyntaxKind.TOKEN_SUB),
    MUL(SyntaxKind.TOKEN_MUL),
    DIV(SyntaxKind.TOKEN_DIV),
    AND(SyntaxKind.TOKEN_AND_AND),
    EQUAL(SyntaxKind.TOKEN_EQUAL),
    IMPLICATION(SyntaxKind.TOKEN_IMPLICATION),
    LESS(SyntaxKind.TOKEN_LESS),
    LESS_OR_EQ(SyntaxKind.TOKEN_LESS_OR_EQ),
    MORE(SyntaxKind.TOKEN_MORE),
    MORE_OR_EQ(SyntaxKind.TOKEN_MORE_OR_EQ),
    NOT_EQUAL(SyntaxKind.TOKEN_NOT_EQUAL),
    OR(SyntaxKind.TOKEN_OR_OR);

    private final SyntaxKind token;

    BinOpKind(SyntaxKind token) {
        this.token = token;
    }

    public SyntaxKind token() {
        return token;
    }

    public String symbol() {
        return token.display();
    }

    public static Optional<BinOpKind> fromToken(SyntaxKind kind) {
        for (var op : values()) {
            if (op.token == kind) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
