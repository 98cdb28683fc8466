package org.pragmatica.nix.ast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BindingsTest {

    private static Expr parseOk(String input) {
        var parse = Root.parse(input);
        assertThat(parse.errors()).as("errors for %s", input)
                                  .isEmpty();
        return parse.tree()
                    .expr()
                    .orElseThrow();
    }

    @Test
    void attrSet_bindingsAndRec() {
        var set = (AttrSet) parseOk("rec { a.b = 1; c = a; }");

        assertTrue(set.isRec());
        assertThat(set.entries()).hasSize(2);
        var first = set.attrpathValues().get(0);
        assertThat(first.attrpath().orElseThrow().attrs()).extracting(AstNode::text)
                                                          .containsExactly("a", "b");
        assertEquals("1", first.value().orElseThrow().text());
        assertFalse(((AttrSet) parseOk("{ }")).isRec());
    }

    @Test
    void inherit_plainAndFromSource() {
        var set = (AttrSet) parseOk("{ inherit a \"b\"; inherit (pkgs) c; }");
        var inherits = set.inherits();

        assertThat(inherits).hasSize(2);
        assertTrue(inherits.get(0).from().isEmpty());
        assertThat(inherits.get(0).attrs()).hasSize(2);
        assertThat(inherits.get(0).attrs().get(1)).isInstanceOf(Str.class);
        assertEquals("pkgs", inherits.get(1).from().orElseThrow().expr().orElseThrow().text());
        assertThat(inherits.get(1).attrs()).extracting(AstNode::text)
                                           .containsExactly("c");
    }

    @Test
    void entries_keepSourceOrder() {
        var set = (AttrSet) parseOk("{ a = 1; inherit b; c = 2; }");
        assertThat(set.entries()).extracting(entry -> entry.getClass().getSimpleName())
                                 .containsExactly("AttrpathValue", "Inherit", "AttrpathValue");
    }

    @Test
    void attributeNames_identStringAndDynamic() {
        var set = (AttrSet) parseOk("{ a.\"b c\".${d} = 1; }");
        var attrs = set.attrpathValues().get(0).attrpath().orElseThrow().attrs();

        assertThat(attrs.get(0)).isInstanceOf(Ident.class);
        assertThat(attrs.get(1)).isInstanceOf(Str.class);
        var dynamic = (Dynamic) attrs.get(2);
        assertEquals("d", dynamic.expr().orElseThrow().text());
    }

    @Test
    void letIn_bindingsAndBody() {
        var let = (LetIn) parseOk("let a = 1; b = a; in a + b");
        assertThat(let.attrpathValues()).hasSize(2);
        assertThat(let.body().orElseThrow()).isInstanceOf(BinOp.class);
    }

    @Test
    void legacyLet_isRecognized() {
        var let = (LegacyLet) parseOk("let { x = 1; body = x; }");
        assertThat(let.attrpathValues()).hasSize(2);
    }

    @Test
    void with_namespaceAndBody() {
        var with = (With) parseOk("with pkgs; [ hello ]");
        assertEquals("pkgs", with.namespace().orElseThrow().text());
        assertThat(with.body().orElseThrow()).isInstanceOf(ListExpr.class);
    }

    @Test
    void assert_conditionAndBody() {
        var assertion = (Assert) parseOk("assert a != null; a");
        assertThat(assertion.condition().orElseThrow()).isInstanceOf(BinOp.class);
        assertEquals("a", assertion.body().orElseThrow().text());
    }

    @Test
    void ifElse_threeBranches() {
        var ifElse = (IfElse) parseOk("if a then b else c");
        assertEquals("a", ifElse.condition().orElseThrow().text());
        assertEquals("b", ifElse.body().orElseThrow().text());
        assertEquals("c", ifElse.elseBody().orElseThrow().text());
    }

    @Test
    void hasAttr_pathAfterQuestionMark() {
        var has = (HasAttr) parseOk("a ? b.c");
        assertEquals("a", has.expr().orElseThrow().text());
        assertThat(has.attrpath().orElseThrow().attrs()).hasSize(2);
    }
}
