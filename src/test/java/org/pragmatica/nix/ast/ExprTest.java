package org.pragmatica.nix.ast;

import org.junit.jupiter.api.Test;
import org.pragmatica.nix.error.ParseException;
import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxToken;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class ExprTest {

    private static Expr parseOk(String input) {
        var parse = Root.parse(input);
        assertThat(parse.errors()).as("errors for %s", input)
                                  .isEmpty();
        return parse.tree()
                    .expr()
                    .orElseThrow();
    }

    @Test
    void literal_kinds() {
        var integer = (LiteralKind.IntegerLiteral) ((Literal) parseOk("42")).kind().orElseThrow();
        assertEquals(42L, integer.value().getAsLong());

        var floating = (LiteralKind.FloatLiteral) ((Literal) parseOk("1.5e2")).kind().orElseThrow();
        assertEquals(150.0, floating.value());

        var uri = (LiteralKind.UriLiteral) ((Literal) parseOk("https://nixos.org/x?y=1")).kind().orElseThrow();
        assertEquals("https://nixos.org/x?y=1", uri.text());
    }

    @Test
    void integerLiteral_overflowHasNoValue() {
        var literal = (LiteralKind.IntegerLiteral) ((Literal) parseOk("99999999999999999999")).kind().orElseThrow();
        assertTrue(literal.value().isEmpty());
    }

    @Test
    void binOp_operandsAndOperator() {
        var op = (BinOp) parseOk("a ++ b");
        assertEquals("a", op.lhs().orElseThrow().text());
        assertEquals("b", op.rhs().orElseThrow().text());
        assertEquals(BinOpKind.CONCAT, op.operator().orElseThrow());
        assertEquals("++", op.operatorToken().orElseThrow().text());
    }

    @Test
    void unaryOp_operatorAndOperand() {
        var invert = (UnaryOp) parseOk("!a");
        assertEquals(UnaryOpKind.INVERT, invert.operator().orElseThrow());
        assertEquals("a", invert.expr().orElseThrow().text());

        var negate = (UnaryOp) parseOk("-1");
        assertEquals(UnaryOpKind.NEGATE, negate.operator().orElseThrow());
    }

    @Test
    void select_withDefault() {
        var select = (Select) parseOk("a.b or c");
        assertEquals("a", select.expr().orElseThrow().text());
        assertThat(select.attrpath().orElseThrow().attrs()).hasSize(1);
        assertEquals("c", select.defaultExpr().orElseThrow().text());
        assertTrue(((Select) parseOk("a.b")).defaultExpr().isEmpty());
    }

    @Test
    void apply_isLeftNested() {
        var apply = (Apply) parseOk("f a b");
        assertEquals("b", apply.argument().orElseThrow().text());
        var inner = (Apply) apply.lambda().orElseThrow();
        assertEquals("f", inner.lambda().orElseThrow().text());
        assertEquals("a", inner.argument().orElseThrow().text());
    }

    @Test
    void list_items() {
        var list = (ListExpr) parseOk("[ 1 \"two\" (3) ./four ]");
        assertThat(list.items()).extracting(item -> item.getClass().getSimpleName())
                                .containsExactly("Literal", "Str", "Paren", "Path");
    }

    @Test
    void path_partsWithInterpolation() {
        var path = (Path) parseOk("./pkgs/${name}.nix");
        var parts = path.parts();

        assertTrue(path.isInterpolated());
        assertThat(parts).hasSize(3);
        assertEquals("./pkgs/", ((InterpolPart.Text<SyntaxToken>) parts.get(0)).value().text());
        var interpolation = (InterpolPart.Interpolation<SyntaxToken>) parts.get(1);
        assertEquals("name", interpolation.interpol().expr().orElseThrow().text());
        assertEquals(".nix", ((InterpolPart.Text<SyntaxToken>) parts.get(2)).value().text());
        assertFalse(((Path) parseOk("/etc/nixos")).isInterpolated());
    }

    @Test
    void paren_wrapsInner() {
        var paren = (Paren) parseOk("(a)");
        assertEquals("a", paren.expr().orElseThrow().text());
    }

    @Test
    void errorNode_occupiesExpressionSlot() {
        var parse = Root.parse("(1 + )");
        var paren = (Paren) parse.tree().expr().orElseThrow();
        var op = (BinOp) paren.expr().orElseThrow();
        assertThat(op.rhs().orElseThrow()).isInstanceOf(ErrorExpr.class);
    }

    @Test
    void cast_rejectsNonExpressionNodes() {
        var set = (AttrSet) parseOk("{ a = 1; }");
        var binding = set.syntax()
                         .firstChild()
                         .orElseThrow();

        assertEquals(SyntaxKind.NODE_ATTRPATH_VALUE, binding.kind());
        assertTrue(Expr.cast(binding).isEmpty());
        assertTrue(Expr.TYPE.cast(binding).isEmpty());
        assertTrue(AttrpathValue.TYPE.cast(binding).isPresent());
    }

    @Test
    void constructor_rejectsWrongKind() {
        var root = Root.parse("a").tree();
        assertThrows(IllegalArgumentException.class, () -> new Lambda(root.syntax()));
    }

    @Test
    void ok_returnsTreeOrThrowsFirstError() throws ParseException {
        assertThat(Root.parse("1 + 2").ok().expr()).isPresent();

        assertThatThrownBy(() -> Root.parse("1 +").ok())
            .isInstanceOf(ParseException.class);
    }
}
