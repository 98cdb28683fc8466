package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;
import org.pragmatica.nix.tree.SyntaxToken;

import java.util.Optional;

public record UnaryOp(SyntaxNode syntax) implements Expr {
    public static final AstType<UnaryOp> TYPE = AstType.of("UnaryOp", SyntaxKind.NODE_UNARY_OP, UnaryOp::new);

    public UnaryOp {
        Nodes.checkKind(syntax, SyntaxKind.NODE_UNARY_OP);
    }

    public Optional<SyntaxToken> operatorToken() {
        return syntax.firstToken();
    }

    public Optional<UnaryOpKind> operator() {
        return operatorToken().flatMap(token -> UnaryOpKind.fromToken(token.kind()));
    }

    public Optional<Expr> expr() {
        return child(Expr.TYPE);
    }
}
