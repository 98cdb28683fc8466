package org.pragmatica.nix.tree;

import com.google.common.base.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Navigable view of a {@link GreenNode}: adds the absolute offset and the parent.
 *
 * <p>Views are cheap and created on demand. A view only points upwards, children are
 * materialized when asked for, and the green tree is never modified, so any number of views
 * over one tree may coexist, also across threads.
 */
public final class SyntaxNode implements SyntaxElement {
    private final GreenNode green;
    private final SyntaxNode parent;
    private final int index;
    private final int offset;

    private SyntaxNode(GreenNode green, SyntaxNode parent, int index, int offset) {
        this.green = green;
        this.parent = parent;
        this.index = index;
        this.offset = offset;
    }

    public static SyntaxNode newRoot(GreenNode green) {
        return new SyntaxNode(green, null, 0, 0);
    }

    @Override
    public SyntaxKind kind() {
        return green.kind();
    }

    @Override
    public GreenNode green() {
        return green;
    }

    @Override
    public TextRange textRange() {
        return TextRange.ofLength(offset, green.textLength());
    }

    public String text() {
        return green.text();
    }

    @Override
    public int index() {
        return index;
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(parent);
    }

    // === Children ===

    public List<SyntaxElement> childrenWithTokens() {
        var result = new ArrayList<SyntaxElement>(green.childCount());
        int childOffset = offset;
        for (int i = 0; i < green.childCount(); i++) {
            var child = green.child(i);
            result.add(element(i, childOffset));
            childOffset += child.textLength();
        }
        return result;
    }

    public List<SyntaxNode> children() {
        var result = new ArrayList<SyntaxNode>();
        int childOffset = offset;
        for (int i = 0; i < green.childCount(); i++) {
            var child = green.child(i);
            if (child instanceof GreenNode node) {
                result.add(new SyntaxNode(node, this, i, childOffset));
            }
            childOffset += child.textLength();
        }
        return result;
    }

    public Optional<SyntaxElement> firstChildOrToken() {
        return green.childCount() == 0
               ? Optional.empty()
               : Optional.of(element(0, offset));
    }

    public Optional<SyntaxElement> lastChildOrToken() {
        if (green.childCount() == 0) {
            return Optional.empty();
        }
        int last = green.childCount() - 1;
        return Optional.of(element(last, offset + green.textLength() - green.child(last).textLength()));
    }

    public Optional<SyntaxNode> firstChild() {
        var current = firstChildOrToken();
        while (current.isPresent()) {
            if (current.get() instanceof SyntaxNode node) {
                return Optional.of(node);
            }
            current = current.get().nextSiblingOrToken();
        }
        return Optional.empty();
    }

    public Optional<SyntaxNode> lastChild() {
        var current = lastChildOrToken();
        while (current.isPresent()) {
            if (current.get() instanceof SyntaxNode node) {
                return Optional.of(node);
            }
            current = current.get().prevSiblingOrToken();
        }
        return Optional.empty();
    }

    /**
     * Create the view of the child at {@code childIndex} which starts at {@code childOffset}.
     */
    SyntaxElement element(int childIndex, int childOffset) {
        var child = green.child(childIndex);
        if (child instanceof GreenNode node) {
            return new SyntaxNode(node, this, childIndex, childOffset);
        }
        return new SyntaxToken((GreenToken) child, this, childIndex, childOffset);
    }

    // === Siblings ===

    @Override
    public Optional<SyntaxElement> nextSiblingOrToken() {
        if (parent == null || index + 1 >= parent.green.childCount()) {
            return Optional.empty();
        }
        return Optional.of(parent.element(index + 1, offset + green.textLength()));
    }

    @Override
    public Optional<SyntaxElement> prevSiblingOrToken() {
        if (parent == null || index == 0) {
            return Optional.empty();
        }
        var previous = parent.green.child(index - 1);
        return Optional.of(parent.element(index - 1, offset - previous.textLength()));
    }

    public Optional<SyntaxNode> nextSibling() {
        var current = nextSiblingOrToken();
        while (current.isPresent()) {
            if (current.get() instanceof SyntaxNode node) {
                return Optional.of(node);
            }
            current = current.get().nextSiblingOrToken();
        }
        return Optional.empty();
    }

    public Optional<SyntaxNode> prevSibling() {
        var current = prevSiblingOrToken();
        while (current.isPresent()) {
            if (current.get() instanceof SyntaxNode node) {
                return Optional.of(node);
            }
            current = current.get().prevSiblingOrToken();
        }
        return Optional.empty();
    }

    // === Tokens ===

    /**
     * First token of this subtree, skipping empty child nodes.
     */
    public Optional<SyntaxToken> firstToken() {
        return edgeToken(false);
    }

    /**
     * Last token of this subtree, skipping empty child nodes.
     */
    public Optional<SyntaxToken> lastToken() {
        return edgeToken(true);
    }

    private Optional<SyntaxToken> edgeToken(boolean last) {
        var pending = new ArrayDeque<SyntaxElement>();
        pushChildren(pending, this, last);
        while (!pending.isEmpty()) {
            var element = pending.pop();
            if (element instanceof SyntaxToken token) {
                return Optional.of(token);
            }
            pushChildren(pending, (SyntaxNode) element, last);
        }
        return Optional.empty();
    }

    /**
     * Push the children so that the one nearest the wanted edge is popped first.
     */
    private static void pushChildren(ArrayDeque<SyntaxElement> stack, SyntaxNode node, boolean last) {
        var children = node.childrenWithTokens();
        if (last) {
            children.forEach(stack::push);
        } else {
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    // === Traversal ===

    /**
     * Lazy preorder traversal of this subtree, tokens included.
     */
    public Iterable<WalkEvent<SyntaxElement>> preorderWithTokens() {
        return () -> new Preorder(this);
    }

    /**
     * This node and all nodes below it, in preorder.
     */
    public List<SyntaxNode> descendants() {
        var result = new ArrayList<SyntaxNode>();
        for (var event : preorderWithTokens()) {
            if (event instanceof WalkEvent.Enter && event.element() instanceof SyntaxNode node) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * All tokens of this subtree, in source order.
     */
    public List<SyntaxToken> descendantTokens() {
        var result = new ArrayList<SyntaxToken>();
        for (var event : preorderWithTokens()) {
            if (event instanceof WalkEvent.Enter && event.element() instanceof SyntaxToken token) {
                result.add(token);
            }
        }
        return result;
    }

    // === Offset lookup ===

    /**
     * Find the token covering the offset.
     *
     * @throws IllegalArgumentException if the offset lies outside this node
     */
    public TokenAtOffset tokenAtOffset(int offset) {
        var range = textRange();
        Preconditions.checkArgument(range.containsInclusive(offset), "offset %s is outside %s", offset, range);
        SyntaxElement current = this;
        while (current instanceof SyntaxNode node) {
            var candidates = node.childrenAround(offset);
            if (candidates.isEmpty()) {
                return new TokenAtOffset.None();
            }
            if (candidates.size() == 2) {
                var leftToken = descend(candidates.get(0), offset, true);
                var rightToken = descend(candidates.get(1), offset, false);
                if (leftToken.isPresent() && rightToken.isPresent()) {
                    return new TokenAtOffset.Between(leftToken.get(), rightToken.get());
                }
                return leftToken.or(() -> rightToken)
                                .<TokenAtOffset>map(TokenAtOffset.Single::new)
                                .orElseGet(TokenAtOffset.None::new);
            }
            current = candidates.get(0);
        }
        return new TokenAtOffset.Single((SyntaxToken) current);
    }

    /**
     * Non-empty children touching the offset: none, one, or the two meeting at it.
     */
    private List<SyntaxElement> childrenAround(int offset) {
        var result = new ArrayList<SyntaxElement>(2);
        for (var child : childrenWithTokens()) {
            var childRange = child.textRange();
            if (childRange.isEmpty() || !childRange.containsInclusive(offset)) {
                continue;
            }
            result.add(child);
            if (result.size() == 2) {
                break;
            }
        }
        return result;
    }

    private static Optional<SyntaxToken> descend(SyntaxElement element, int offset, boolean preferRight) {
        var current = element;
        while (current instanceof SyntaxNode node) {
            var candidates = node.childrenAround(offset);
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            current = candidates.get(preferRight ? candidates.size() - 1 : 0);
        }
        return Optional.of((SyntaxToken) current);
    }

    /**
     * Find the deepest element whose range contains the given range.
     *
     * @throws IllegalArgumentException if the range is not inside this node
     */
    public SyntaxElement coveringElement(TextRange range) {
        Preconditions.checkArgument(textRange().containsRange(range), "range %s is outside %s", range, textRange());
        SyntaxElement result = this;
        while (result instanceof SyntaxNode node) {
            var next = node.childCovering(range);
            if (next.isEmpty()) {
                return result;
            }
            result = next.get();
        }
        return result;
    }

    private Optional<SyntaxElement> childCovering(TextRange range) {
        for (var child : childrenWithTokens()) {
            var childRange = child.textRange();
            if (!childRange.isEmpty() && childRange.containsRange(range)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    // === Identity ===

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntaxNode other)) {
            return false;
        }
        SyntaxNode left = this;
        SyntaxNode right = other;
        while (left != null && right != null) {
            if (left == right) {
                return true;
            }
            if (left.green != right.green || left.offset != right.offset || left.index != right.index) {
                return false;
            }
            left = left.parent;
            right = right.parent;
        }
        return left == right;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(green) + offset;
    }

    @Override
    public String toString() {
        return kind() + "@" + textRange();
    }

    /**
     * Indented dump of the subtree, one element per line, for debugging and tests.
     */
    public String debugDump() {
        var sb = new StringBuilder();
        int depth = 0;
        for (var event : preorderWithTokens()) {
            if (event instanceof WalkEvent.Leave) {
                depth--;
                continue;
            }
            var element = event.element();
            sb.append("  ".repeat(depth));
            if (element instanceof SyntaxToken token) {
                sb.append(token.kind())
                  .append('@')
                  .append(token.textRange())
                  .append(' ')
                  .append(quote(token.text()));
            } else {
                sb.append(element.kind())
                  .append('@')
                  .append(element.textRange());
            }
            sb.append('\n');
            depth++;
        }
        return sb.toString();
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\")
                         .replace("\n", "\\n")
                         .replace("\t", "\\t")
                         .replace("\"", "\\\"") + '"';
    }

    private static final class Preorder implements Iterator<WalkEvent<SyntaxElement>> {
        private final SyntaxNode start;
        private WalkEvent<SyntaxElement> next;

        private Preorder(SyntaxNode start) {
            this.start = start;
            this.next = new WalkEvent.Enter<SyntaxElement>(start);
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public WalkEvent<SyntaxElement> next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            var current = next;
            next = successor(current);
            return current;
        }

        private WalkEvent<SyntaxElement> successor(WalkEvent<SyntaxElement> event) {
            var element = event.element();
            if (event instanceof WalkEvent.Enter) {
                if (element instanceof SyntaxNode node) {
                    return node.firstChildOrToken()
                               .<WalkEvent<SyntaxElement>>map(child -> new WalkEvent.Enter<SyntaxElement>(child))
                               .orElseGet(() -> new WalkEvent.Leave<SyntaxElement>(node));
                }
                return new WalkEvent.Leave<SyntaxElement>(element);
            }
            if (element == start) {
                return null;
            }
            var sibling = element.nextSiblingOrToken();
            if (sibling.isPresent()) {
                return new WalkEvent.Enter<SyntaxElement>(sibling.get());
            }
            return element.parent()
                          .<WalkEvent<SyntaxElement>>map(parent -> new WalkEvent.Leave<SyntaxElement>(parent))
                          .orElse(null);
        }
    }
}
