package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.EnumSet;
import java.util.Optional;

import static org.pragmatica.nix.tree.SyntaxKind.*;

/**
 * Any expression node. Error nodes are expressions too, so a broken subexpression still
 * occupies its slot.
 */
public sealed interface Expr extends AstNode
    permits Apply, Assert, AttrSet, BinOp, ErrorExpr, HasAttr, Ident, IfElse, Lambda, LegacyLet, LetIn, ListExpr,
            Literal, Paren, Path, Select, Str, UnaryOp, With {

    AstType<Expr> TYPE = AstType.of("Expr",
                                    EnumSet.of(NODE_APPLY, NODE_ASSERT, NODE_ATTR_SET, NODE_BIN_OP, NODE_ERROR,
                                               NODE_HAS_ATTR, NODE_IDENT, NODE_IF_ELSE, NODE_LAMBDA, NODE_LEGACY_LET,
                                               NODE_LET_IN, NODE_LIST, NODE_LITERAL, NODE_PAREN, NODE_PATH,
                                               NODE_SELECT, NODE_STRING, NODE_UNARY_OP, NODE_WITH),
                                    node -> cast(node).orElseThrow());

    static Optional<Expr> cast(SyntaxNode node) {
        return Optional.ofNullable(wrap(node.kind(), node));
    }

    private static Expr wrap(SyntaxKind kind, SyntaxNode node) {
        return switch (kind) {
            case NODE_APPLY -> new Apply(node);
            case NODE_ASSERT -> new Assert(node);
            case NODE_ATTR_SET -> new AttrSet(node);
            case NODE_BIN_OP -> new BinOp(node);
            case NODE_ERROR -> new ErrorExpr(node);
            case NODE_HAS_ATTR -> new HasAttr(node);
            case NODE_IDENT -> new Ident(node);
            case NODE_IF_ELSE -> new IfElse(node);
            case NODE_LAMBDA -> new Lambda(node);
            case NODE_LEGACY_LET -> new LegacyLet(node);
            case NODE_LET_IN -> new LetIn(node);
            case NODE_LIST -> new ListExpr(node);
            case NODE_LITERAL -> new Literal(node);
            case NODE_PAREN -> new Paren(node);
            case NODE_PATH -> new Path(node);
            case NODE_SELECT -> new Select(node);
            case NODE_STRING -> new Str(node);
            case NODE_UNARY_OP -> new UnaryOp(node);
            case NODE_WITH -> new With(node);
            default -> null;
        };
    }
}
