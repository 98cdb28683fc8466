package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

public record InheritFrom(SyntaxNode syntax) implements AstNode {
    public static final AstType<InheritFrom> TYPE =
        AstType.of("InheritFrom", SyntaxKind.NODE_INHERIT_FROM, InheritFrom::new);

    public InheritFrom {
        Nodes.checkKind(syntax, SyntaxKind.NODE_INHERIT_FROM);
    }

    public Optional<Expr> expr() {
        return child(Expr.TYPE);
    }
}
