package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * {@code with namespace; body}
 */
public record With(SyntaxNode syntax) implements Expr {
    public static final AstType<With> TYPE = AstType.of("With", SyntaxKind.NODE_WITH, With::new);

    public With {
        Nodes.checkKind(syntax, SyntaxKind.NODE_WITH);
    }

    public Optional<Expr> namespace() {
        return nthChild(Expr.TYPE, 0);
    }

    public Optional<Expr> body() {
        return nthChild(Expr.TYPE, 1);
    }
}
