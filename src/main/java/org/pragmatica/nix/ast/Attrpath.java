package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.List;

/**
 * Dotted attribute path {@code a."b".${c}}.
 */
public record Attrpath(SyntaxNode syntax) implements AstNode {
    public static final AstType<Attrpath> TYPE = AstType.of("Attrpath", SyntaxKind.NODE_ATTRPATH, Attrpath::new);

    public Attrpath {
        Nodes.checkKind(syntax, SyntaxKind.NODE_ATTRPATH);
    }

    public List<Attr> attrs() {
        return childrenOf(Attr.TYPE);
    }
}
