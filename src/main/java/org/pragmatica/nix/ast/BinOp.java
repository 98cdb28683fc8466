package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;
import org.pragmatica.nix.tree.SyntaxToken;

import java.util.Optional;

/**
 * Binary operation.
 */
public record BinOp(SyntaxNode syntax) implements Expr {
    public static final AstType<BinOp> TYPE = AstType.of("BinOp", SyntaxKind.NODE_BIN_OP, BinOp::new);

    public BinOp {
        Nodes.checkKind(syntax, SyntaxKind.NODE_BIN_OP);
    }

    public Optional<Expr> lhs() {
        return nthChild(Expr.TYPE, 0);
    }

    public Optional<Expr> rhs() {
        return nthChild(Expr.TYPE, 1);
    }

    public Optional<SyntaxToken> operatorToken() {
        for (var element : syntax.childrenWithTokens()) {
            if (BinOpKind.fromToken(element.kind()).isPresent()) {
                return element.asToken();
            }
        }
        return Optional.empty();
    }

    public Optional<BinOpKind> operator() {
        return operatorToken().flatMap(token -> BinOpKind.fromToken(token.kind()));
    }
}
