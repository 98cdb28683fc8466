package org.pragmatica.nix.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AstMatchTest {

    private static String shape(String input) {
        var expr = Root.parse(input)
                       .tree()
                       .expr()
                       .orElseThrow();
        return AstMatch.<String>on(expr)
                       .when(Lambda.TYPE, lambda -> "function")
                       .when(AttrSet.TYPE, set -> set.isRec() ? "rec set" : "set")
                       .when(Expr.TYPE, other -> "expr")
                       .otherwise(node -> "other");
    }

    @Test
    void firstMatchingArmWins() {
        assertEquals("function", shape("x: x"));
        assertEquals("rec set", shape("rec { }"));
        assertEquals("set", shape("{ a = 1; }"));
        assertEquals("expr", shape("1"));
    }

    @Test
    void otherwise_appliesWhenNoArmMatches() {
        var root = Root.parse("a").tree();
        var match = AstMatch.<String>on(root)
                            .when(Lambda.TYPE, lambda -> "function");

        assertFalse(match.matched());
        assertTrue(match.result().isEmpty());
        assertEquals("NODE_ROOT", match.otherwise(node -> node.kind().name()));
    }

    @Test
    void nullResult_stillCountsAsMatched() {
        var root = Root.parse("a").tree();
        var match = AstMatch.<String>on(root)
                            .when(Root.TYPE, r -> null)
                            .when(Root.TYPE, r -> "second");

        assertTrue(match.matched());
        assertNull(match.otherwise(node -> "fallback"));
    }
}
