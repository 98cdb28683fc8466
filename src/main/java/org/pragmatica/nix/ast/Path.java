package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.SyntaxNode;
import org.pragmatica.nix.tree.SyntaxToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Path literal, possibly with interpolations such as {@code ./pkgs/${name}.nix}.
 */
public record Path(SyntaxNode syntax) implements Expr {
    public static final AstType<Path> TYPE = AstType.of("Path", SyntaxKind.NODE_PATH, Path::new);

    public Path {
        Nodes.checkKind(syntax, SyntaxKind.NODE_PATH);
    }

    public List<InterpolPart<SyntaxToken>> parts() {
        var parts = new ArrayList<InterpolPart<SyntaxToken>>();
        for (var element : syntax.childrenWithTokens()) {
            if (element.kind() == SyntaxKind.TOKEN_PATH) {
                element.asToken()
                       .ifPresent(token -> parts.add(new InterpolPart.Text<>(token)));
            } else if (element.kind() == SyntaxKind.NODE_INTERPOL) {
                element.asNode()
                       .ifPresent(node -> parts.add(new InterpolPart.Interpolation<>(new Interpol(node))));
            }
        }
        return parts;
    }

    public boolean isInterpolated() {
        return parts().stream()
                      .anyMatch(part -> part instanceof InterpolPart.Interpolation);
    }
}
