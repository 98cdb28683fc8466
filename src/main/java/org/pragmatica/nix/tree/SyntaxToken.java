package org.pragmatica.nix.tree;

import java.util.Optional;

/**
 * Navigable view of a {@link GreenToken}.
 */
public final class SyntaxToken implements SyntaxElement {
    private final GreenToken green;
    private final SyntaxNode parent;
    private final int index;
    private final int offset;

    SyntaxToken(GreenToken green, SyntaxNode parent, int index, int offset) {
        this.green = green;
        this.parent = parent;
        this.index = index;
        this.offset = offset;
    }

    @Override
    public SyntaxKind kind() {
        return green.kind();
    }

    @Override
    public GreenToken green() {
        return green;
    }

    public String text() {
        return green.text();
    }

    @Override
    public TextRange textRange() {
        return TextRange.ofLength(offset, green.textLength());
    }

    @Override
    public int index() {
        return index;
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return Optional.of(parent);
    }

    @Override
    public Optional<SyntaxElement> nextSiblingOrToken() {
        if (index + 1 >= parent.green().childCount()) {
            return Optional.empty();
        }
        return Optional.of(parent.element(index + 1, offset + green.textLength()));
    }

    @Override
    public Optional<SyntaxElement> prevSiblingOrToken() {
        if (index == 0) {
            return Optional.empty();
        }
        var previous = parent.green().child(index - 1);
        return Optional.of(parent.element(index - 1, offset - previous.textLength()));
    }

    /**
     * The token that follows this one in the whole tree.
     */
    public Optional<SyntaxToken> nextToken() {
        SyntaxElement current = this;
        while (true) {
            var sibling = current.nextSiblingOrToken();
            if (sibling.isPresent()) {
                var candidate = sibling.get();
                if (candidate instanceof SyntaxToken token) {
                    return Optional.of(token);
                }
                var first = ((SyntaxNode) candidate).firstToken();
                if (first.isPresent()) {
                    return first;
                }
                current = candidate;
                continue;
            }
            var up = current.parent();
            if (up.isEmpty()) {
                return Optional.empty();
            }
            current = up.get();
        }
    }

    /**
     * The token that precedes this one in the whole tree.
     */
    public Optional<SyntaxToken> prevToken() {
        SyntaxElement current = this;
        while (true) {
            var sibling = current.prevSiblingOrToken();
            if (sibling.isPresent()) {
                var candidate = sibling.get();
                if (candidate instanceof SyntaxToken token) {
                    return Optional.of(token);
                }
                var last = ((SyntaxNode) candidate).lastToken();
                if (last.isPresent()) {
                    return last;
                }
                current = candidate;
                continue;
            }
            var up = current.parent();
            if (up.isEmpty()) {
                return Optional.empty();
            }
            current = up.get();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SyntaxToken other
               && green == other.green
               && offset == other.offset
               && parent.equals(other.parent);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(green) + offset;
    }

    @Override
    public String toString() {
        return kind() + "@" + textRange() + " " + text();
    }
}
