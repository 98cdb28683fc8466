package org.pragmatica.nix.tree;

/**
 * Event of a preorder traversal: entering or leaving an element.
 */
public sealed interface WalkEvent<T> {
    T element();

    record Enter<T>(T element) implements WalkEvent<T> {}

    record Leave<T>(T element) implements WalkEvent<T> {}
}
