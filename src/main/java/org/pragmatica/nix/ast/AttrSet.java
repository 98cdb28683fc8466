package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

/**
 * Attribute set, optionally recursive.
 */
public record AttrSet(SyntaxNode syntax) implements Expr, HasEntry {
    public static final AstType<AttrSet> TYPE = AstType.of("AttrSet", SyntaxKind.NODE_ATTR_SET, AttrSet::new);

    public AttrSet {
        Nodes.checkKind(syntax, SyntaxKind.NODE_ATTR_SET);
    }

    public boolean isRec() {
        return token(SyntaxKind.TOKEN_REC).isPresent();
    }
}
