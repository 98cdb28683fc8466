package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

public record PatBind(SyntaxNode syntax) implements AstNode {
    public static final AstType<PatBind> TYPE = AstType.of("PatBind", SyntaxKind.NODE_PAT_BIND, PatBind::new);

    public PatBind {
        Nodes.checkKind(syntax, SyntaxKind.NODE_PAT_BIND);
    }

    public Optional<Ident> ident() {
        return child(Ident.TYPE);
    }
}
