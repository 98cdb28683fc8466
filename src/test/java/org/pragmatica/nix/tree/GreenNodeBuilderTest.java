package org.pragmatica.nix.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.nix.tree.SyntaxKind.*;

class GreenNodeBuilderTest {

    @Test
    void finish_nestedNodes_buildsTreeWithText() {
        var builder = new GreenNodeBuilder();
        builder.startNode(NODE_ROOT);
        builder.startNode(NODE_LITERAL);
        builder.token(TOKEN_INTEGER, "42");
        builder.finishNode();
        builder.token(TOKEN_WHITESPACE, " ");
        builder.finishNode();

        var root = builder.finish();
        assertEquals(NODE_ROOT, root.kind());
        assertEquals("42 ", root.text());
        assertEquals(3, root.textLength());
        assertEquals(2, root.childCount());
        assertThat(root.child(0)).isInstanceOf(GreenNode.class);
    }

    @Test
    void startNodeAt_wrapsChildrenSinceCheckpoint() {
        var builder = new GreenNodeBuilder();
        builder.startNode(NODE_ROOT);
        var checkpoint = builder.checkpoint();
        builder.token(TOKEN_INTEGER, "1");
        builder.token(TOKEN_ADD, "+");
        builder.startNodeAt(checkpoint, NODE_BIN_OP);
        builder.token(TOKEN_INTEGER, "2");
        builder.finishNode();
        builder.finishNode();

        var root = builder.finish();
        assertEquals(1, root.childCount());
        var binOp = (GreenNode) root.child(0);
        assertEquals(NODE_BIN_OP, binOp.kind());
        assertEquals(3, binOp.childCount());
        assertEquals("1+2", binOp.text());
    }

    @Test
    void startNodeAt_sameCheckpointTwice_nestsNodes() {
        var builder = new GreenNodeBuilder();
        builder.startNode(NODE_ROOT);
        var checkpoint = builder.checkpoint();
        builder.startNode(NODE_IDENT);
        builder.token(TOKEN_IDENT, "x");
        builder.finishNode();
        builder.startNodeAt(checkpoint, NODE_LAMBDA);
        builder.startNodeAt(checkpoint, NODE_IDENT_PARAM);
        builder.finishNode();
        builder.token(TOKEN_COLON, ":");
        builder.finishNode();
        builder.finishNode();

        var lambda = (GreenNode) builder.finish().child(0);
        assertEquals(NODE_LAMBDA, lambda.kind());
        assertEquals(NODE_IDENT_PARAM, lambda.child(0).kind());
        assertEquals(TOKEN_COLON, lambda.child(1).kind());
    }

    @Test
    void startNodeAt_checkpointOfFinishedNode_isRejected() {
        var builder = new GreenNodeBuilder();
        builder.startNode(NODE_ROOT);
        builder.startNode(NODE_LIST);
        builder.token(TOKEN_L_BRACK, "[");
        builder.token(TOKEN_R_BRACK, "]");
        var checkpoint = builder.checkpoint();
        builder.finishNode();

        assertThatThrownBy(() -> builder.startNodeAt(checkpoint, NODE_BIN_OP))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void finish_withOpenNode_isRejected() {
        var builder = new GreenNodeBuilder();
        builder.startNode(NODE_ROOT);

        assertThatThrownBy(builder::finish).isInstanceOf(IllegalStateException.class);
        assertEquals(1, builder.depth());
    }

    @Test
    void finishNode_withoutStart_isRejected() {
        assertThrows(IllegalStateException.class, () -> new GreenNodeBuilder().finishNode());
    }

    @Test
    void nodeCache_sharesIdenticalTokensAndSmallNodes() {
        var cache = new NodeCache();
        var builder = new GreenNodeBuilder(cache);
        builder.startNode(NODE_LIST);
        for (int i = 0; i < 2; i++) {
            builder.startNode(NODE_IDENT);
            builder.token(TOKEN_IDENT, "a");
            builder.finishNode();
        }
        builder.finishNode();

        var list = builder.finish();
        assertSame(list.child(0), list.child(1));
        assertSame(((GreenNode) list.child(0)).child(0), ((GreenNode) list.child(1)).child(0));
    }

    @Test
    void equals_isStructural() {
        var left = GreenNode.of(NODE_LITERAL, List.of(GreenToken.of(TOKEN_INTEGER, "1")));
        var right = GreenNode.of(NODE_LITERAL, List.of(GreenToken.of(TOKEN_INTEGER, "1")));
        var other = GreenNode.of(NODE_LITERAL, List.of(GreenToken.of(TOKEN_INTEGER, "2")));

        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());
        assertNotEquals(left, other);
    }
}
