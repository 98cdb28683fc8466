package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxNode;

import java.util.EnumSet;
import java.util.Optional;

import static org.pragmatica.nix.tree.SyntaxKind.*;

/**
 * Binding inside an attribute set or a {@code let}.
 */
public sealed interface Entry extends AstNode permits AttrpathValue, Inherit {
    AstType<Entry> TYPE = AstType.of("Entry",
                                     EnumSet.of(NODE_ATTRPATH_VALUE, NODE_INHERIT),
                                     node -> cast(node).orElseThrow());

    static Optional<Entry> cast(SyntaxNode node) {
        return switch (node.kind()) {
            case NODE_ATTRPATH_VALUE -> Optional.of(new AttrpathValue(node));
            case NODE_INHERIT -> Optional.of(new Inherit(node));
            default -> Optional.empty();
        };
    }
}
