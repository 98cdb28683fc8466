package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;
import org.pragmatica.nix.tree.SyntaxToken;

import java.util.ArrayList;
import java.util.List;

/**
 * String literal, {@code "..."} or indented {@code ''...''}.
 */
public record Str(SyntaxNode syntax) implements Expr, Attr {
    public static final AstType<Str> TYPE = AstType.of("Str", SyntaxKind.NODE_STRING, Str::new);

    public Str {
        Nodes.checkKind(syntax, SyntaxKind.NODE_STRING);
    }

    public boolean isIndented() {
        return token(SyntaxKind.TOKEN_STRING_START).map(token -> token.text().equals("''"))
                                                   .orElse(false);
    }

    /**
     * Content tokens and interpolations as written, escapes and indentation untouched.
     */
    public List<InterpolPart<SyntaxToken>> parts() {
        var parts = new ArrayList<InterpolPart<SyntaxToken>>();
        for (var element : syntax.childrenWithTokens()) {
            if (element.kind() == SyntaxKind.TOKEN_STRING_CONTENT) {
                element.asToken()
                       .ifPresent(token -> parts.add(new InterpolPart.Text<>(token)));
            } else if (element.kind() == SyntaxKind.NODE_INTERPOL) {
                element.asNode()
                       .ifPresent(node -> parts.add(new InterpolPart.Interpolation<>(new Interpol(node))));
            }
        }
        return parts;
    }

    /**
     * The string's value: indented strings are dedented, then escapes are decoded. Empty text
     * parts are dropped.
     */
    public List<InterpolPart<String>> normalizedParts() {
        return StrNormalizer.normalize(parts(), isIndented());
    }
}
