package org.pragmatica.nix.ast;

import org.pragmatica.nix.NixParser;
import org.pragmatica.nix.parser.Parse;
import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.Optional;

/**
 * Top of every parse: one expression plus surrounding trivia.
 */
public record Root(SyntaxNode syntax) implements AstNode {
    public static final AstType<Root> TYPE = AstType.of("Root", SyntaxKind.NODE_ROOT, Root::new);

    public Root {
        Nodes.checkKind(syntax, SyntaxKind.NODE_ROOT);
    }

    public static Parse<Root> parse(String input) {
        return NixParser.parse(input);
    }

    public Optional<Expr> expr() {
        return child(Expr.TYPE);
    }
}
