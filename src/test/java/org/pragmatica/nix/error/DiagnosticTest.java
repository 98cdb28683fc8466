package org.pragmatica.nix.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.nix.NixParser;
import org.pragmatica.nix.tree.LineIndex;
import org.pragmatica.nix.tree.TextRange;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.nix.tree.SyntaxKind.TOKEN_SEMICOLON;

class DiagnosticTest {
    private static final String SOURCE = "{ a = 1 b = 2; }";

    @Test
    void format_rendersCodeLocationAndLabel() {
        var errors = NixParser.parse(SOURCE).errors();
        assertThat(errors).hasSize(1);

        var rendered = Diagnostic.of(errors.get(0), LineIndex.of(SOURCE))
                                 .format(SOURCE, "default.nix");

        assertEquals("""
                     error[E0004]: missing [';'] at 7
                       --> default.nix:1:8
                       |
                     1 | { a = 1 b = 2; }
                       |        ^ expected ';'
                       |
                     """, rendered);
    }

    @Test
    void formatSimple_singleLine() {
        var error = new ParseError.Missing(TextRange.at(7), Set.of(TOKEN_SEMICOLON));
        var diagnostic = Diagnostic.of(error, LineIndex.of(SOURCE));

        assertEquals("default.nix:1:8: error: missing [';'] at 7", diagnostic.formatSimple("default.nix"));
    }

    @Test
    void format_withoutFilename_secondLine() {
        var source = "let\n  a = ;\nin a";
        var errors = NixParser.parse(source).errors();
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0)).isInstanceOf(ParseError.MissingExpression.class);

        var rendered = Diagnostic.of(errors.get(0), LineIndex.of(source))
                                 .format(source, null);

        assertThat(rendered).startsWith("error[E0010]: expected an expression at 9\n  --> 2:6\n")
                            .contains("2 |   a = ;\n")
                            .contains("^ expected an expression");
    }

    @Test
    void recursionLimit_carriesNote() {
        var source = "(".repeat(20) + "1" + ")".repeat(20);
        var errors = NixParser.builder()
                              .recursionLimit(8)
                              .build()
                              .parseRoot(source)
                              .errors();
        var diagnostic = Diagnostic.of(errors.get(0), LineIndex.of(source));

        assertEquals("E0009", diagnostic.code());
        assertThat(diagnostic.notes()).containsExactly("the remaining input was not parsed");
        assertThat(diagnostic.format(source, "deep.nix")).contains("= the remaining input was not parsed");
    }

    @Test
    void nonAssociative_carriesHelp() {
        var source = "a == b == c";
        var diagnostic = Diagnostic.of(NixParser.parse(source).errors().get(0), LineIndex.of(source));

        assertEquals("E0008", diagnostic.code());
        assertThat(diagnostic.notes()).containsExactly("help: add parentheses to make the grouping explicit");
    }

    @Test
    void formatAll_rendersEveryError() {
        var source = "{ a = 1 b = 2 c = 3; }";
        var errors = NixParser.parse(source).errors();
        assertThat(errors).hasSize(2);

        var rendered = Diagnostic.formatAll(errors, source, "x.nix");

        assertEquals(2, rendered.split("error\\[E0004]", -1).length - 1);
    }

    @Test
    void secondaryLabel_usesDashes() {
        var lines = LineIndex.of(SOURCE);
        var diagnostic = Diagnostic.error("E0001", "demo", lines.span(TextRange.of(2, 3)))
                                   .withLabel("here")
                                   .withSecondaryLabel(lines.span(TextRange.of(6, 7)), "and here");

        assertThat(diagnostic.labels()).extracting(Diagnostic.Label::primary)
                                       .containsExactly(true, false);
        assertThat(diagnostic.format(SOURCE, null)).contains("^ here   - and here");
    }

    @Test
    void codes_areDistinctPerErrorKind() {
        var range = TextRange.of(0, 1);
        var errors = List.<ParseError>of(new ParseError.Unexpected(TOKEN_SEMICOLON, range),
                                         new ParseError.UnexpectedExtra(range),
                                         new ParseError.UnexpectedWanted(TOKEN_SEMICOLON, range, Set.of()),
                                         new ParseError.Missing(range, Set.of(TOKEN_SEMICOLON)),
                                         new ParseError.UnexpectedEof(range, Set.of()),
                                         new ParseError.UnexpectedDoubleBind(range),
                                         new ParseError.DuplicatedArgs(range, "a"),
                                         new ParseError.NonAssociative(range, TOKEN_SEMICOLON, TOKEN_SEMICOLON),
                                         new ParseError.RecursionLimitExceeded(range),
                                         new ParseError.MissingExpression(range));
        var lines = LineIndex.of(SOURCE);

        assertThat(errors).extracting(error -> Diagnostic.of(error, lines).code())
                          .doesNotHaveDuplicates()
                          .endsWith("E0010");
    }
}
