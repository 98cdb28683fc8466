package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Destructuring parameter {@code { a, b ? 1, ... } @ args}. The bind may also lead.
 */
public record Pattern(SyntaxNode syntax) implements Param {
    public static final AstType<Pattern> TYPE = AstType.of("Pattern", SyntaxKind.NODE_PATTERN, Pattern::new);

    public Pattern {
        Nodes.checkKind(syntax, SyntaxKind.NODE_PATTERN);
    }

    public List<PatEntry> entries() {
        return childrenOf(PatEntry.TYPE);
    }

    public boolean hasEllipsis() {
        return token(SyntaxKind.TOKEN_ELLIPSIS).isPresent();
    }

    public Optional<PatBind> patBind() {
        return child(PatBind.TYPE);
    }
}
