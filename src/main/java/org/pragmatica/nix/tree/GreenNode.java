package org.pragmatica.nix.tree;

import com.google.common.collect.ImmutableList;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Interior node of the immutable tree.
 *
 * <p>Owns its children and caches its text length. Equality is structural, which lets
 * {@link NodeCache} share identical subtrees.
 */
public final class GreenNode implements GreenElement {
    private final int rawKind;
    private final ImmutableList<GreenElement> children;
    private final int textLength;
    private final int hash;

    private GreenNode(int rawKind, ImmutableList<GreenElement> children) {
        this.rawKind = rawKind;
        this.children = children;
        int length = 0;
        for (var child : children) {
            length += child.textLength();
        }
        this.textLength = length;
        this.hash = 31 * rawKind + children.hashCode();
    }

    public static GreenNode of(SyntaxKind kind, List<? extends GreenElement> children) {
        return new GreenNode(kind.toRaw(), ImmutableList.copyOf(children));
    }

    static GreenNode ofRaw(int rawKind, List<? extends GreenElement> children) {
        return new GreenNode(rawKind, ImmutableList.copyOf(children));
    }

    @Override
    public int rawKind() {
        return rawKind;
    }

    @Override
    public int textLength() {
        return textLength;
    }

    public ImmutableList<GreenElement> children() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    public GreenElement child(int index) {
        return children.get(index);
    }

    /**
     * Full source text covered by this node.
     */
    public String text() {
        var sb = new StringBuilder(textLength);
        appendText(sb);
        return sb.toString();
    }

    /**
     * Walks with an explicit stack; operator chains nest as deep as the input is long.
     */
    @Override
    public void appendText(StringBuilder sb) {
        var pending = new ArrayDeque<GreenElement>();
        pushReversed(pending, children);
        while (!pending.isEmpty()) {
            var element = pending.pop();
            if (element instanceof GreenNode node) {
                pushReversed(pending, node.children);
            } else {
                element.appendText(sb);
            }
        }
    }

    private static void pushReversed(ArrayDeque<GreenElement> stack, List<GreenElement> elements) {
        for (int i = elements.size() - 1; i >= 0; i--) {
            stack.push(elements.get(i));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GreenNode other)) {
            return false;
        }
        var left = new ArrayDeque<GreenElement>();
        var right = new ArrayDeque<GreenElement>();
        left.push(this);
        right.push(other);
        while (!left.isEmpty()) {
            var a = left.pop();
            var b = right.pop();
            if (a == b) {
                continue;
            }
            if (!(a instanceof GreenNode x && b instanceof GreenNode y)) {
                if (!a.equals(b)) {
                    return false;
                }
                continue;
            }
            if (!x.sameShape(y)) {
                return false;
            }
            for (int i = 0; i < x.children.size(); i++) {
                left.push(x.children.get(i));
                right.push(y.children.get(i));
            }
        }
        return true;
    }

    private boolean sameShape(GreenNode other) {
        return rawKind == other.rawKind
               && hash == other.hash
               && textLength == other.textLength
               && children.size() == other.children.size();
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return kind() + "@" + textLength;
    }
}
