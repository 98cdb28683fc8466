package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.List;

public record ListExpr(SyntaxNode syntax) implements Expr {
    public static final AstType<ListExpr> TYPE = AstType.of("List", SyntaxKind.NODE_LIST, ListExpr::new);

    public ListExpr {
        Nodes.checkKind(syntax, SyntaxKind.NODE_LIST);
    }

    public List<Expr> items() {
        return childrenOf(Expr.TYPE);
    }
}
