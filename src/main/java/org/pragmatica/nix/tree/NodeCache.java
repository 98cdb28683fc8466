package org.pragmatica.nix.tree;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interns tokens and small nodes so that identical subtrees of one tree are the same object.
 *
 * <p>Large nodes are rarely repeated and comparing them is expensive, so only nodes with at most
 * {@value #MAX_CACHED_CHILDREN} children are interned.
 */
public final class NodeCache {
    private static final int MAX_CACHED_CHILDREN = 3;

    private final Map<GreenToken, GreenToken> tokens = new HashMap<>();
    private final Map<GreenNode, GreenNode> nodes = new HashMap<>();

    public GreenToken token(SyntaxKind kind, String text) {
        var token = GreenToken.of(kind, text);
        return tokens.computeIfAbsent(token, t -> t);
    }

    public GreenNode node(int rawKind, List<GreenElement> children) {
        var node = GreenNode.ofRaw(rawKind, children);
        if (children.size() > MAX_CACHED_CHILDREN) {
            return node;
        }
        return nodes.computeIfAbsent(node, n -> n);
    }

    public int size() {
        return tokens.size() + nodes.size();
    }
}
