package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * {@code ${expr}} inside a string or path.
 */
public record Interpol(SyntaxNode syntax) implements AstNode {
    public static final AstType<Interpol> TYPE = AstType.of("Interpol", SyntaxKind.NODE_INTERPOL, Interpol::new);

    public Interpol {
        Nodes.checkKind(syntax, SyntaxKind.NODE_INTERPOL);
    }

    public Optional<Expr> expr() {
        return child(Expr.TYPE);
    }
}
