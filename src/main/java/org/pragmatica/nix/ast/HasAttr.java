package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * Attribute presence test {@code e ? a.b}.
 */
public record HasAttr(SyntaxNode syntax) implements Expr {
    public static final AstType<HasAttr> TYPE = AstType.of("HasAttr", SyntaxKind.NODE_HAS_ATTR, HasAttr::new);

    public HasAttr {
        Nodes.checkKind(syntax, SyntaxKind.NODE_HAS_ATTR);
    }

    public Optional<Expr> expr() {
        return child(Expr.TYPE);
    }

    public Optional<Attrpath> attrpath() {
        return child(Attrpath.TYPE);
    }
}
