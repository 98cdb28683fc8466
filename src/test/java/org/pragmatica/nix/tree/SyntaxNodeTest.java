package org.pragmatica.nix.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.nix.NixParser;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.nix.tree.SyntaxKind.*;

class SyntaxNodeTest {

    private static final String SOURCE = "let a = 1; in a + b";

    private static SyntaxNode root() {
        return NixParser.parse(SOURCE).syntax();
    }

    @Test
    void root_coversWholeInput() {
        var root = root();
        assertEquals(NODE_ROOT, root.kind());
        assertEquals(TextRange.of(0, SOURCE.length()), root.textRange());
        assertEquals(SOURCE, root.text());
        assertTrue(root.parent().isEmpty());
    }

    @Test
    void children_skipTokens_whileChildrenWithTokensKeepThem() {
        var letIn = root().firstChild().orElseThrow();
        assertEquals(NODE_LET_IN, letIn.kind());
        assertThat(letIn.children()).extracting(SyntaxNode::kind)
                                    .containsExactly(NODE_ATTRPATH_VALUE, NODE_BIN_OP);
        assertThat(letIn.childrenWithTokens()).extracting(SyntaxElement::kind)
                                              .containsExactly(TOKEN_LET, TOKEN_WHITESPACE, NODE_ATTRPATH_VALUE,
                                                               TOKEN_WHITESPACE, TOKEN_IN, TOKEN_WHITESPACE,
                                                               NODE_BIN_OP);
    }

    @Test
    void siblings_navigateBothWays() {
        var letIn = root().firstChild().orElseThrow();
        var binding = letIn.firstChild().orElseThrow();
        var body = binding.nextSibling().orElseThrow();

        assertEquals(NODE_BIN_OP, body.kind());
        assertEquals(binding, body.prevSibling().orElseThrow());
        assertEquals(TOKEN_WHITESPACE, binding.nextSiblingOrToken().orElseThrow().kind());
        assertTrue(body.nextSibling().isEmpty());
        assertEquals(body, letIn.lastChild().orElseThrow());
    }

    @Test
    void tokens_firstLastAndAcrossTree() {
        var root = root();
        var first = root.firstToken().orElseThrow();
        var last = root.lastToken().orElseThrow();

        assertEquals("let", first.text());
        assertEquals("b", last.text());
        assertEquals(TOKEN_WHITESPACE, first.nextToken().orElseThrow().kind());
        assertEquals(TOKEN_WHITESPACE, last.prevToken().orElseThrow().kind());
        assertTrue(last.nextToken().isEmpty());
    }

    @Test
    void ancestors_ofToken_leadToRoot() {
        var last = root().lastToken().orElseThrow();
        assertThat(last.ancestors()).extracting(SyntaxNode::kind)
                                    .containsExactly(NODE_IDENT, NODE_BIN_OP, NODE_LET_IN, NODE_ROOT);
    }

    @Test
    void descendants_listNodesInPreorder() {
        var idents = root().descendants()
                           .stream()
                           .filter(node -> node.kind() == NODE_IDENT)
                           .map(SyntaxNode::text)
                           .toList();
        assertThat(idents).containsExactly("a", "a", "b");
    }

    @Test
    void descendantTokens_concatenateToSource() {
        var sb = new StringBuilder();
        root().descendantTokens()
              .forEach(token -> sb.append(token.text()));
        assertEquals(SOURCE, sb.toString());
    }

    @Test
    void preorderWithTokens_balancesEnterAndLeave() {
        var events = new ArrayList<WalkEvent<SyntaxElement>>();
        root().preorderWithTokens()
              .forEach(events::add);

        long enters = events.stream()
                            .filter(event -> event instanceof WalkEvent.Enter)
                            .count();
        assertEquals(events.size(), enters * 2);
        assertThat(events.get(0)).isInstanceOf(WalkEvent.Enter.class);
        assertThat(events.get(events.size() - 1)).isInstanceOf(WalkEvent.Leave.class);
        assertEquals(NODE_ROOT, events.get(events.size() - 1).element().kind());
    }

    @Test
    void tokenAtOffset_insideToken_isSingle() {
        var result = root().tokenAtOffset(1);
        assertThat(result).isInstanceOf(TokenAtOffset.Single.class);
        assertEquals("let", result.leftBiased().orElseThrow().text());
    }

    @Test
    void tokenAtOffset_onBoundary_isBetween() {
        var result = root().tokenAtOffset(5);
        assertThat(result).isInstanceOf(TokenAtOffset.Between.class);
        assertEquals("a", result.leftBiased().orElseThrow().text());
        assertEquals(" ", result.rightBiased().orElseThrow().text());
    }

    @Test
    void tokenAtOffset_emptyTree_isNone() {
        var root = NixParser.parse("").syntax();
        assertThat(root.tokenAtOffset(0)).isInstanceOf(TokenAtOffset.None.class);
    }

    @Test
    void tokenAtOffset_outsideNode_isRejected() {
        assertThatThrownBy(() -> root().tokenAtOffset(SOURCE.length() + 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void coveringElement_findsDeepestElement() {
        var root = root();
        assertEquals(NODE_BIN_OP, root.coveringElement(TextRange.of(14, 19)).kind());
        assertEquals(TOKEN_INTEGER, root.coveringElement(TextRange.of(8, 9)).kind());
        assertEquals(NODE_ATTRPATH_VALUE, root.coveringElement(TextRange.of(4, 9)).kind());
    }

    @Test
    void equals_sameElementFromDifferentWalks() {
        var root = root();
        var viaChildren = root.firstChild().orElseThrow();
        var viaDescendants = root.descendants().get(1);
        assertEquals(viaChildren, viaDescendants);
        assertEquals(viaChildren.hashCode(), viaDescendants.hashCode());
    }

    @Test
    void equals_sharedGreenUnderDifferentParents_differs() {
        var empty = GreenNode.of(NODE_ERROR, List.of());
        var paren = GreenNode.of(NODE_PAREN, List.of(empty, GreenToken.of(TOKEN_IDENT, "a")));
        var root = SyntaxNode.newRoot(GreenNode.of(NODE_ROOT, List.of(empty, paren)));

        var outer = root.firstChild().orElseThrow();
        var inner = root.children().get(1).firstChild().orElseThrow();

        assertSame(outer.green(), inner.green());
        assertEquals(outer.textRange(), inner.textRange());
        assertNotEquals(outer, inner);
        assertEquals(outer, root.descendants().get(1));
    }

    // === Deep trees ===

    @Test
    void deepTree_walksWithoutRecursion() {
        var input = "f" + " a".repeat(100_000);
        var root = NixParser.parse(input).syntax();

        assertEquals(input, root.text());
        assertEquals("f", root.firstToken().orElseThrow().text());
        assertEquals("a", root.lastToken().orElseThrow().text());
        assertEquals(" ", root.firstToken().orElseThrow().nextToken().orElseThrow().text());
        assertEquals("f", ((TokenAtOffset.Single) root.tokenAtOffset(0)).token().text());
        var between = (TokenAtOffset.Between) root.tokenAtOffset(1);
        assertEquals("f", between.left().text());
        assertEquals(" ", between.right().text());
    }

    @Test
    void debugDump_showsKindsRangesAndText() {
        var dump = NixParser.parse("a").syntax().debugDump();
        assertEquals("""
                     NODE_ROOT@0..1
                       NODE_IDENT@0..1
                         TOKEN_IDENT@0..1 "a"
                     """, dump);
    }
}
