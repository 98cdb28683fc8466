package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered dispatch over node types. The first matching arm wins.
 *
 * <pre>{@code
 * String shape = AstMatch.<String>on(node)
 *                        .when(Lambda.TYPE, lambda -> "function")
 *                        .when(AttrSet.TYPE, set -> "set")
 *                        .otherwise(other -> "value");
 * }</pre>
 */
public final class AstMatch<R> {
    private final SyntaxNode node;
    private boolean matched;
    private R result;

    private AstMatch(SyntaxNode node) {
        this.node = node;
    }

    public static <R> AstMatch<R> on(SyntaxNode node) {
        return new AstMatch<>(node);
    }

    public static <R> AstMatch<R> on(AstNode node) {
        return new AstMatch<>(node.syntax());
    }

    public <T extends AstNode> AstMatch<R> when(AstType<T> type, Function<? super T, ? extends R> arm) {
        if (!matched && type.canCast(node.kind())) {
            matched = true;
            result = arm.apply(type.factory().apply(node));
        }
        return this;
    }

    public boolean matched() {
        return matched;
    }

    public Optional<R> result() {
        return Optional.ofNullable(result);
    }

    public R otherwise(Function<SyntaxNode, ? extends R> fallback) {
        return matched
               ? result
               : fallback.apply(node);
    }
}
