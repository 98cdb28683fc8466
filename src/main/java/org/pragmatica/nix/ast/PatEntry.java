package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * Formal argument of a pattern with an optional {@code ? default}.
 */
public record PatEntry(SyntaxNode syntax) implements AstNode {
    public static final AstType<PatEntry> TYPE = AstType.of("PatEntry", SyntaxKind.NODE_PAT_ENTRY, PatEntry::new);

    public PatEntry {
        Nodes.checkKind(syntax, SyntaxKind.NODE_PAT_ENTRY);
    }

    public Optional<Ident> ident() {
        return child(Ident.TYPE);
    }

    public Optional<Expr> defaultExpr() {
        return nthChild(Expr.TYPE, 1);
    }
}
