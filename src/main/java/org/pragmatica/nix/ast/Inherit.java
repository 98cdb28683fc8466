package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * {@code inherit a b;} or {@code inherit (source) a b;}.
 */
public record Inherit(SyntaxNode syntax) implements Entry {
    public static final AstType<Inherit> TYPE = AstType.of("Inherit", SyntaxKind.NODE_INHERIT, Inherit::new);

    public Inherit {
        Nodes.checkKind(syntax, SyntaxKind.NODE_INHERIT);
    }

    public Optional<InheritFrom> from() {
        return child(InheritFrom.TYPE);
    }

    public List<Attr> attrs() {
        return childrenOf(Attr.TYPE);
    }
}
