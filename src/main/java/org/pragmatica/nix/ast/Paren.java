package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

public record Paren(SyntaxNode syntax) implements Expr {
    public static final AstType<Paren> TYPE = AstType.of("Paren", SyntaxKind.NODE_PAREN, Paren::new);

    public Paren {
        Nodes.checkKind(syntax, SyntaxKind.NODE_PAREN);
    }

    public Optional<Expr> expr() {
        return child(Expr.TYPE);
    }
}
