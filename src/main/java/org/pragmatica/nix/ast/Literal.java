package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * Integer, float or URI literal.
 */
public record Literal(SyntaxNode syntax) implements Expr {
    public static final AstType<Literal> TYPE = AstType.of("Literal", SyntaxKind.NODE_LITERAL, Literal::new);

    public Literal {
        Nodes.checkKind(syntax, SyntaxKind.NODE_LITERAL);
    }

    public Optional<LiteralKind> kind() {
        for (var token : syntax.descendantTokens()) {
            var kind = LiteralKind.of(token);
            if (kind.isPresent()) {
                return kind;
            }
        }
        return Optional.empty();
    }
}
