package org.pragmatica.nix.tree;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;

import java.util.ArrayList;
import java.util.List;

/**
 * Stack-based builder for the immutable tree.
 *
 * <p>Consumes start-node / token / finish-node events. A {@link Checkpoint} remembers a position
 * in the event stream; {@link #startNodeAt(Checkpoint, SyntaxKind)} later wraps everything
 * emitted since that position into a new node, which is how the parser restructures a prefix
 * once it knows what it was.
 */
public final class GreenNodeBuilder {

    /**
     * Position in the child list of the currently open node.
     */
    public record Checkpoint(int position) {}

    private record Frame(int rawKind, int firstChild) {}

    private final NodeCache cache;
    private final List<Frame> parents = new ArrayList<>();
    private final List<GreenElement> children = new ArrayList<>();

    public GreenNodeBuilder() {
        this(new NodeCache());
    }

    public GreenNodeBuilder(NodeCache cache) {
        this.cache = cache;
    }

    public void startNode(SyntaxKind kind) {
        parents.add(new Frame(kind.toRaw(), children.size()));
    }

    public void token(SyntaxKind kind, String text) {
        children.add(cache.token(kind, text));
    }

    public void finishNode() {
        Preconditions.checkState(!parents.isEmpty(), "finishNode() without a matching startNode()");
        var frame = parents.remove(parents.size() - 1);
        var nodeChildren = children.subList(frame.firstChild(), children.size());
        var node = cache.node(frame.rawKind(), nodeChildren);
        nodeChildren.clear();
        children.add(node);
    }

    public Checkpoint checkpoint() {
        return new Checkpoint(children.size());
    }

    /**
     * Open a node that starts at the checkpoint, adopting every child emitted after it.
     */
    public void startNodeAt(Checkpoint checkpoint, SyntaxKind kind) {
        Preconditions.checkArgument(checkpoint.position() <= children.size(),
                                    "checkpoint %s is past the end of the current node", checkpoint);
        if (!parents.isEmpty()) {
            var open = parents.get(parents.size() - 1);
            Preconditions.checkArgument(checkpoint.position() >= open.firstChild(),
                                        "checkpoint %s belongs to an already finished node", checkpoint);
        }
        parents.add(new Frame(kind.toRaw(), checkpoint.position()));
    }

    /**
     * Depth of currently open nodes.
     */
    public int depth() {
        return parents.size();
    }

    public GreenNode finish() {
        Preconditions.checkState(parents.isEmpty(), "%s node(s) still open", parents.size());
        Preconditions.checkState(children.size() == 1, "expected exactly one root, found %s", children.size());
        var root = children.get(0);
        Verify.verify(root instanceof GreenNode, "root element must be a node, found %s", root);
        return (GreenNode) root;
    }
}
