package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * Function application {@code f x}.
 */
public record Apply(SyntaxNode syntax) implements Expr {
    public static final AstType<Apply> TYPE = AstType.of("Apply", SyntaxKind.NODE_APPLY, Apply::new);

    public Apply {
        Nodes.checkKind(syntax, SyntaxKind.NODE_APPLY);
    }

    public Optional<Expr> lambda() {
        return nthChild(Expr.TYPE, 0);
    }

    public Optional<Expr> argument() {
        return nthChild(Expr.TYPE, 1);
    }
}
