package org.pragmatica.nix.tree;

import java.util.List;
import java.util.Optional;

/**
 * Result of looking up the token at an offset.
 *
 * <p>An offset inside a token yields {@link Single}; an offset on the boundary of two tokens yields
 * {@link Between} with both of them, leaving the choice to the caller.
 */
public sealed interface TokenAtOffset {

    /**
     * All tokens touching the offset, left to right.
     */
    List<SyntaxToken> tokens();

    default Optional<SyntaxToken> leftBiased() {
        var tokens = tokens();
        return tokens.isEmpty()
               ? Optional.empty()
               : Optional.of(tokens.get(0));
    }

    default Optional<SyntaxToken> rightBiased() {
        var tokens = tokens();
        return tokens.isEmpty()
               ? Optional.empty()
               : Optional.of(tokens.get(tokens.size() - 1));
    }

    /**
     * The tree has no text.
     */
    record None() implements TokenAtOffset {
        @Override
        public List<SyntaxToken> tokens() {
            return List.of();
        }
    }

    record Single(SyntaxToken token) implements TokenAtOffset {
        @Override
        public List<SyntaxToken> tokens() {
            return List.of(token);
        }
    }

    record Between(SyntaxToken left, SyntaxToken right) implements TokenAtOffset {
        @Override
        public List<SyntaxToken> tokens() {
            return List.of(left, right);
        }
    }
}
