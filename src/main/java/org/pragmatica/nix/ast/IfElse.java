package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * {@code if condition then body else elseBody}
 */
public record IfElse(SyntaxNode syntax) implements Expr {
    public static final AstType<IfElse> TYPE = AstType.of("IfElse", SyntaxKind.NODE_IF_ELSE, IfElse::new);

    public IfElse {
        Nodes.checkKind(syntax, SyntaxKind.NODE_IF_ELSE);
    }

    public Optional<Expr> condition() {
        return nthChild(Expr.TYPE, 0);
    }

    public Optional<Expr> body() {
        return nthChild(Expr.TYPE, 1);
    }

    public Optional<Expr> elseBody() {
        return nthChild(Expr.TYPE, 2);
    }
}
