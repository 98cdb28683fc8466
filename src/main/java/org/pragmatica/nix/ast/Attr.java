package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxNode;

import java.util.EnumSet;
import java.util.Optional;

import static org.pragmatica.nix.tree.SyntaxKind.*;

/**
 * One component of an attribute path: a name, a string or a {@code ${...}} splice.
 */
public sealed interface Attr extends AstNode permits Ident, Dynamic, Str {
    AstType<Attr> TYPE = AstType.of("Attr",
                                    EnumSet.of(NODE_IDENT, NODE_DYNAMIC, NODE_STRING),
                                    node -> cast(node).orElseThrow());

    static Optional<Attr> cast(SyntaxNode node) {
        return switch (node.kind()) {
            case NODE_IDENT -> Optional.of(new Ident(node));
            case NODE_DYNAMIC -> Optional.of(new Dynamic(node));
            case NODE_STRING -> Optional.of(new Str(node));
            default -> Optional.empty();
        };
    }
}
