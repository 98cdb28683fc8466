package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * Binding {@code a.b = value;}.
 */
public record AttrpathValue(SyntaxNode syntax) implements Entry {
    public static final AstType<AttrpathValue> TYPE =
        AstType.of("AttrpathValue", SyntaxKind.NODE_ATTRPATH_VALUE, AttrpathValue::new);

    public AttrpathValue {
        Nodes.checkKind(syntax, SyntaxKind.NODE_ATTRPATH_VALUE);
    }

    public Optional<Attrpath> attrpath() {
        return child(Attrpath.TYPE);
    }

    public Optional<Expr> value() {
        return child(Expr.TYPE);
    }
}
