package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

/**
 * Deprecated {@code let { ...; body = e; }} form; evaluates to its {@code body} binding.
 */
public record LegacyLet(SyntaxNode syntax) implements Expr, HasEntry {
    public static final AstType<LegacyLet> TYPE = AstType.of("LegacyLet", SyntaxKind.NODE_LEGACY_LET, LegacyLet::new);

    public LegacyLet {
        Nodes.checkKind(syntax, SyntaxKind.NODE_LEGACY_LET);
    }
}
