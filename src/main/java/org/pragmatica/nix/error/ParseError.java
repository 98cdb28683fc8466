package org.pragmatica.nix.error;

import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.TextRange;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recoverable syntax error with its source range.
 *
 * <p>Errors never stop the parser; they are collected in the order they are found while the tree
 * is still built.
 */
public sealed interface ParseError {
    TextRange range();

    String message();

    /**
     * A token the parser could not make sense of; it was wrapped in an error node.
     */
    record Unexpected(SyntaxKind found, TextRange range) implements ParseError {
        @Override
        public String message() {
            return "unexpected " + found.display() + " at " + range;
        }
    }

    /**
     * An expression is required but absent; an empty error node stands in for it.
     */
    record MissingExpression(TextRange range) implements ParseError {
        @Override
        public String message() {
            return "expected an expression at " + range.start();
        }
    }

    /**
     * Input left over after the root expression.
     */
    record UnexpectedExtra(TextRange range) implements ParseError {
        @Override
        public String message() {
            return "unexpected token at " + range + ", expected end of input";
        }
    }

    /**
     * A token other than the wanted ones; the offending span was skipped.
     */
    record UnexpectedWanted(SyntaxKind found, TextRange range, Set<SyntaxKind> expected) implements ParseError {
        public UnexpectedWanted {
            expected = Set.copyOf(expected);
        }

        @Override
        public String message() {
            return "unexpected " + found.display() + " at " + range + ", wanted any of " + describe(expected);
        }
    }

    /**
     * A wanted token is absent; nothing was consumed.
     */
    record Missing(TextRange range, Set<SyntaxKind> expected) implements ParseError {
        public Missing {
            expected = Set.copyOf(expected);
        }

        @Override
        public String message() {
            return "missing " + describe(expected) + " at " + range.start();
        }
    }

    /**
     * Input ended where something else was wanted.
     */
    record UnexpectedEof(TextRange range, Set<SyntaxKind> expected) implements ParseError {
        public UnexpectedEof {
            expected = Set.copyOf(expected);
        }

        @Override
        public String message() {
            return expected.isEmpty()
                   ? "unexpected end of input"
                   : "unexpected end of input, wanted any of " + describe(expected);
        }
    }

    /**
     * A pattern bound with {@code @} on both sides.
     */
    record UnexpectedDoubleBind(TextRange range) implements ParseError {
        @Override
        public String message() {
            return "unexpected double bind at " + range;
        }
    }

    /**
     * The same formal argument appears twice in a pattern.
     */
    record DuplicatedArgs(TextRange range, String name) implements ParseError {
        @Override
        public String message() {
            return "argument '" + name + "' is duplicated in " + range;
        }
    }

    /**
     * Two non-associative operators chained without parentheses, such as {@code a == b == c}.
     */
    record NonAssociative(TextRange range, SyntaxKind previous, SyntaxKind operator) implements ParseError {
        @Override
        public String message() {
            return "operator " + operator.display() + " is not associative with operator " + previous.display()
                   + " at " + range + ", use parentheses";
        }
    }

    /**
     * Nesting is too deep; the rest of the input was skipped.
     */
    record RecursionLimitExceeded(TextRange range) implements ParseError {
        @Override
        public String message() {
            return "recursion limit exceeded at " + range.start();
        }
    }

    private static String describe(Set<SyntaxKind> kinds) {
        return kinds.stream()
                    .sorted()
                    .map(SyntaxKind::display)
                    .distinct()
                    .collect(Collectors.joining(", ", "[", "]"));
    }
}
