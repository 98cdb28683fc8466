package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;
import org.pragmatica.nix.tree.SyntaxToken;
import org.pragmatica.nix.tree.TextRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed view over a {@link SyntaxNode}.
 *
 * <p>Accessors return empty results for parts missing from an erroneous tree instead of
 * failing.
 */
public interface AstNode {
    SyntaxNode syntax();

    default SyntaxKind syntaxKind() {
        return syntax().kind();
    }

    default TextRange textRange() {
        return syntax().textRange();
    }

    default String text() {
        return syntax().text();
    }

    // === Child lookup ===

    default <T extends AstNode> Optional<T> child(AstType<T> type) {
        return nthChild(type, 0);
    }

    default <T extends AstNode> Optional<T> nthChild(AstType<T> type, int n) {
        int seen = 0;
        for (var node : syntax().children()) {
            if (type.canCast(node.kind())) {
                if (seen == n) {
                    return type.cast(node);
                }
                seen++;
            }
        }
        return Optional.empty();
    }

    default <T extends AstNode> List<T> childrenOf(AstType<T> type) {
        var result = new ArrayList<T>();
        for (var node : syntax().children()) {
            type.cast(node).ifPresent(result::add);
        }
        return result;
    }

    default Optional<SyntaxToken> token(SyntaxKind kind) {
        for (var element : syntax().childrenWithTokens()) {
            if (element.kind() == kind) {
                return element.asToken();
            }
        }
        return Optional.empty();
    }
}
