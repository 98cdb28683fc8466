package org.pragmatica.nix.ast;

import com.google.common.base.Preconditions;
import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

final class Nodes {
    private Nodes() {}

    static void checkKind(SyntaxNode node, SyntaxKind kind) {
        Preconditions.checkArgument(node.kind() == kind, "expected %s, got %s", kind, node.kind());
    }
}
