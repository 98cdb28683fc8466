package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

public record IdentParam(SyntaxNode syntax) implements Param {
    public static final AstType<IdentParam> TYPE =
        AstType.of("IdentParam", SyntaxKind.NODE_IDENT_PARAM, IdentParam::new);

    public IdentParam {
        Nodes.checkKind(syntax, SyntaxKind.NODE_IDENT_PARAM);
    }

    public Optional<Ident> ident() {
        return child(Ident.TYPE);
    }
}
