package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * Computed attribute name {@code ${e}}.
 */
public record Dynamic(SyntaxNode syntax) implements Attr {
    public static final AstType<Dynamic> TYPE = AstType.of("Dynamic", SyntaxKind.NODE_DYNAMIC, Dynamic::new);

    public Dynamic {
        Nodes.checkKind(syntax, SyntaxKind.NODE_DYNAMIC);
    }

    public Optional<Expr> expr() {
        return child(Expr.TYPE);
    }
}
