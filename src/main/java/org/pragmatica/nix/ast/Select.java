package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * Attribute selection {@code e.a.b}, optionally with a default {@code e.a.b or d}.
 */
public record Select(SyntaxNode syntax) implements Expr {
    public static final AstType<Select> TYPE = AstType.of("Select", SyntaxKind.NODE_SELECT, Select::new);

    public Select {
        Nodes.checkKind(syntax, SyntaxKind.NODE_SELECT);
    }

    public Optional<Expr> expr() {
        return nthChild(Expr.TYPE, 0);
    }

    public Optional<Attrpath> attrpath() {
        return child(Attrpath.TYPE);
    }

    public Optional<Expr> defaultExpr() {
        return nthChild(Expr.TYPE, 1);
    }
}
