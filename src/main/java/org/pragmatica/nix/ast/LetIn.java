package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * {@code let bindings in body}
 */
public record LetIn(SyntaxNode syntax) implements Expr, HasEntry {
    public static final AstType<LetIn> TYPE = AstType.of("LetIn", SyntaxKind.NODE_LET_IN, LetIn::new);

    public LetIn {
        Nodes.checkKind(syntax, SyntaxKind.NODE_LET_IN);
    }

    public Optional<Expr> body() {
        return child(Expr.TYPE);
    }
}
