package org.pragmatica.nix.tree;

/**
 * Element of the immutable tree: either a node or a token.
 *
 * <p>Green elements carry no position and no parent, so equal subtrees are interchangeable.
 */
public sealed interface GreenElement permits GreenNode, GreenToken {

    /**
     * Raw kind tag, see {@link SyntaxKind#fromRaw(int)}.
     */
    int rawKind();

    int textLength();

    default SyntaxKind kind() {
        return SyntaxKind.fromRaw(rawKind());
    }

    /**
     * Append the text of this element to the builder.
     */
    void appendText(StringBuilder sb);
}
