package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * {@code assert condition; body}
 */
public record Assert(SyntaxNode syntax) implements Expr {
    public static final AstType<Assert> TYPE = AstType.of("Assert", SyntaxKind.NODE_ASSERT, Assert::new);

    public Assert {
        Nodes.checkKind(syntax, SyntaxKind.NODE_ASSERT);
    }

    public Optional<Expr> condition() {
        return nthChild(Expr.TYPE, 0);
    }

    public Optional<Expr> body() {
        return nthChild(Expr.TYPE, 1);
    }
}
