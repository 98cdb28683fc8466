package org.pragmatica.nix.tokenizer;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.TextRange;

/**
 * A lexical token: its kind and the range of source text it covers.
 */
public record Token(SyntaxKind kind, TextRange range) {

    public static Token of(SyntaxKind kind, int start, int end) {
        return new Token(kind, TextRange.of(start, end));
    }

    public String text(String source) {
        return range.extract(source);
    }

    public boolean isTrivia() {
        return kind.isTrivia();
    }

    @Override
    public String toString() {
        return kind + "@" + range;
    }
}
