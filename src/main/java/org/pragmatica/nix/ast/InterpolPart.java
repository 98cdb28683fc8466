package org.pragmatica.nix.ast;

/**
 * Piece of a string or path: literal text or an interpolated expression.
 *
 * @param <T> representation of the literal text
 */
public sealed interface InterpolPart<T> {
    record Text<T>(T value) implements InterpolPart<T> {}

    record Interpolation<T>(Interpol interpol) implements InterpolPart<T> {}
}
