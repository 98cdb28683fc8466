package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

/**
 * Input the parser could not make sense of. May be empty when an expression was missing.
 */
public record ErrorExpr(SyntaxNode syntax) implements Expr {
    public static final AstType<ErrorExpr> TYPE = AstType.of("Error", SyntaxKind.NODE_ERROR, ErrorExpr::new);

    public ErrorExpr {
        Nodes.checkKind(syntax, SyntaxKind.NODE_ERROR);
    }
}
