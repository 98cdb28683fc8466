package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxNode;

import java.util.EnumSet;
import java.util.Optional;

import static org.pragmatica.nix.tree.SyntaxKind.*;

/**
 * Lambda parameter: a single name or a destructuring pattern.
 */
public sealed interface Param extends AstNode permits IdentParam, Pattern {
    AstType<Param> TYPE = AstType.of("Param",
                                     EnumSet.of(NODE_IDENT_PARAM, NODE_PATTERN),
                                     node -> cast(node).orElseThrow());

    static Optional<Param> cast(SyntaxNode node) {
        return switch (node.kind()) {
            case NODE_IDENT_PARAM -> Optional.of(new IdentParam(node));
            case NODE_PATTERN -> Optional.of(new Pattern(node));
            default -> Optional.empty();
        };
    }
}
