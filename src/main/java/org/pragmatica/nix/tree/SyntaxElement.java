package org.pragmatica.nix.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Position-aware view of a tree element: either a {@link SyntaxNode} or a {@link SyntaxToken}.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {

    SyntaxKind kind();

    TextRange textRange();

    /**
     * Index of this element among the children of its parent.
     */
    int index();

    Optional<SyntaxNode> parent();

    GreenElement green();

    Optional<SyntaxElement> nextSiblingOrToken();

    Optional<SyntaxElement> prevSiblingOrToken();

    /**
     * The enclosing nodes, innermost first. For a node the list starts with the node itself.
     */
    default List<SyntaxNode> ancestors() {
        var result = new ArrayList<SyntaxNode>();
        var current = this instanceof SyntaxNode node
                      ? Optional.of(node)
                      : parent();
        while (current.isPresent()) {
            result.add(current.get());
            current = current.get()
                             .parent();
        }
        return result;
    }

    default Optional<SyntaxNode> asNode() {
        return this instanceof SyntaxNode node
               ? Optional.of(node)
               : Optional.empty();
    }

    default Optional<SyntaxToken> asToken() {
        return this instanceof SyntaxToken token
               ? Optional.of(token)
               : Optional.empty();
    }
}
