package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;
import org.pragmatica.nix.tree.SyntaxToken;

import java.util.Optional;

/**
 * Identifier, used as a variable reference and as an attribute name.
 */
public record Ident(SyntaxNode syntax) implements Expr, Attr {
    public static final AstType<Ident> TYPE = AstType.of("Ident", SyntaxKind.NODE_IDENT, Ident::new);

    public Ident {
        Nodes.checkKind(syntax, SyntaxKind.NODE_IDENT);
    }

    public Optional<SyntaxToken> identToken() {
        return token(SyntaxKind.TOKEN_IDENT);
    }

    public String name() {
        return identToken().map(SyntaxToken::text)
                           .orElse("");
    }
}
