package org.pragmatica.nix.tree;

/**
 * Leaf of the immutable tree.
 */
public record GreenToken(int rawKind, String text) implements GreenElement {

    public static GreenToken of(SyntaxKind kind, String text) {
        return new GreenToken(kind.toRaw(), text);
    }

    @Override
    public int textLength() {
        return text.length();
    }

    @Override
    public void appendText(StringBuilder sb) {
        sb.append(text);
    }

    @Override
    public String toString() {
        return kind() + "@" + text;
    }
}
