package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Cast descriptor of a typed wrapper: the node kinds it accepts and how to wrap them.
 *
 * @param name    wrapper name used in messages
 * @param kinds   accepted node kinds
 * @param factory wraps a node of an accepted kind
 */
public record AstType<T extends AstNode>(String name, Set<SyntaxKind> kinds, Function<SyntaxNode, T> factory) {
    public AstType {
        kinds = Set.copyOf(kinds);
    }

    public static <T extends AstNode> AstType<T> of(String name, SyntaxKind kind, Function<SyntaxNode, T> factory) {
        return new AstType<>(name, EnumSet.of(kind), factory);
    }

    public static <T extends AstNode> AstType<T> of(String name,
                                                    Set<SyntaxKind> kinds,
                                                    Function<SyntaxNode, T> factory) {
        return new AstType<>(name, kinds, factory);
    }

    public boolean canCast(SyntaxKind kind) {
        return kinds.contains(kind);
    }

    public Optional<T> cast(SyntaxNode node) {
        return canCast(node.kind())
               ? Optional.of(factory.apply(node))
               : Optional.empty();
    }

    @Override
    public String toString() {
        return name;
    }
}
