package org.pragmatica.nix.parser;

import com.google.common.base.VerifyException;
import org.pragmatica.nix.ast.AstNode;
import org.pragmatica.nix.ast.AstType;
import org.pragmatica.nix.error.ParseError;
import org.pragmatica.nix.error.ParseException;
import org.pragmatica.nix.tree.GreenNode;
import org.pragmatica.nix.tree.SyntaxNode;

import java.util.List;

/**
 * Outcome of a parse: the tree, always present, and the errors found while building it.
 *
 * @param green  green root
 * @param errors errors in the order they were found
 * @param type   typed view of the root
 */
public record Parse<T extends AstNode>(GreenNode green, List<ParseError> errors, AstType<T> type) {
    public Parse {
        errors = List.copyOf(errors);
    }

    public SyntaxNode syntax() {
        return SyntaxNode.newRoot(green);
    }

    /**
     * Typed root regardless of errors.
     */
    public T tree() {
        var root = syntax();
        return type.cast(root)
                   .orElseThrow(() -> new VerifyException("root " + root.kind() + " is not a " + type.name()));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Typed root of an error-free parse.
     *
     * @throws ParseException carrying the first error when there are any
     */
    public T ok() throws ParseException {
        if (hasErrors()) {
            throw new ParseException(errors.get(0));
        }
        return tree();
    }
}
