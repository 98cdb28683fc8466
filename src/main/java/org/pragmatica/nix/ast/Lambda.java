package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * Function {@code param: body}.
 */
public record Lambda(SyntaxNode syntax) implements Expr {
    public static final AstType<Lambda> TYPE = AstType.of("Lambda", SyntaxKind.NODE_LAMBDA, Lambda::new);

    public Lambda {
        Nodes.checkKind(syntax, SyntaxKind.NODE_LAMBDA);
    }

    public Optional<Param> param() {
        return child(Param.TYPE);
    }

    public Optional<Expr> body() {
        return child(Expr.TYPE);
    }
}
