package org.pragmatica.nix.error;

import com.google.common.base.VerifyException;
import org.pragmatica.nix.tree.LineIndex;
import org.pragmatica.nix.tree.SourceSpan;
import org.pragmatica.nix.tree.SyntaxKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Parse error rendered for humans, Rust style.
 *
 * <p>Example output:
 * <pre>
 * error[E0004]: missing [';'] at 9
 *   --> default.nix:1:10
 *   |
 * 1 | { a = 1 b = 2; }
 *   |          ^ expected ';'
 *   |
 * </pre>
 *
 * @param severity severity level
 * @param code     error code derived from the error variant
 * @param message  primary message
 * @param span     line/column span of the error
 * @param labels   labeled spans
 * @param notes    additional notes
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public enum Severity {
        ERROR("error");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span. Primary labels are underlined with {@code ^}, secondary ones with {@code -}.
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, code, message, span, List.of(), List.of());
    }

    /**
     * Build the diagnostic for a parse error, resolving its range against the source lines.
     */
    public static Diagnostic of(ParseError error, LineIndex lines) {
        var span = lines.span(error.range());
        var diagnostic = error(codeOf(error), error.message(), span);
        if (error instanceof ParseError.Missing missing) {
            return diagnostic.withLabel("expected " + String.join(" or ", displayNames(missing)));
        }
        if (error instanceof ParseError.UnexpectedWanted wanted) {
            return diagnostic.withLabel("unexpected " + wanted.found().display());
        }
        if (error instanceof ParseError.MissingExpression) {
            return diagnostic.withLabel("expected an expression");
        }
        if (error instanceof ParseError.NonAssociative) {
            return diagnostic.withHelp("add parentheses to make the grouping explicit");
        }
        if (error instanceof ParseError.RecursionLimitExceeded) {
            return diagnostic.withNote("the remaining input was not parsed");
        }
        return diagnostic.withLabel("");
    }

    /**
     * Render all errors of a parse against its source.
     */
    public static String formatAll(List<ParseError> errors, String source, String filename) {
        var lines = LineIndex.of(source);
        var sb = new StringBuilder();
        for (var error : errors) {
            sb.append(of(error, lines).format(source, filename))
              .append("\n");
        }
        return sb.toString();
    }

    private static List<String> displayNames(ParseError.Missing missing) {
        return missing.expected()
                      .stream()
                      .sorted()
                      .map(SyntaxKind::display)
                      .toList();
    }

    private static String codeOf(ParseError error) {
        if (error instanceof ParseError.Unexpected) {
            return "E0001";
        }
        if (error instanceof ParseError.UnexpectedExtra) {
            return "E0002";
        }
        if (error instanceof ParseError.UnexpectedWanted) {
            return "E0003";
        }
        if (error instanceof ParseError.Missing) {
            return "E0004";
        }
        if (error instanceof ParseError.UnexpectedEof) {
            return "E0005";
        }
        if (error instanceof ParseError.UnexpectedDoubleBind) {
            return "E0006";
        }
        if (error instanceof ParseError.DuplicatedArgs) {
            return "E0007";
        }
        if (error instanceof ParseError.NonAssociative) {
            return "E0008";
        }
        if (error instanceof ParseError.RecursionLimitExceeded) {
            return "E0009";
        }
        if (error instanceof ParseError.MissingExpression) {
            return "E0010";
        }
        throw new VerifyException("no code for " + error.getClass().getSimpleName());
    }

    public Diagnostic withLabel(String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, message));
        return new Diagnostic(severity, code, this.message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, message));
        return new Diagnostic(severity, code, this.message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, span, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with the affected source lines.
     *
     * @param source   the source text
     * @param filename file name shown in the location line, may be null
     */
    public String format(String source, String filename) {
        var out = new StringBuilder();
        appendHeader(out, filename);

        int firstLine = labels.stream()
                              .mapToInt(label -> label.span().start().line())
                              .reduce(span.start().line(), Math::min);
        int lastLine = labels.stream()
                             .mapToInt(label -> label.span().end().line())
                             .reduce(span.end().line(), Math::max);
        var gutter = " ".repeat(String.valueOf(lastLine).length());
        var lines = source.split("\n", -1);

        out.append(gutter).append(" |\n");
        for (int line = Math.max(1, firstLine); line <= Math.min(lastLine, lines.length); line++) {
            appendSourceLine(out, gutter, line, lines[line - 1]);
        }
        out.append(gutter).append(" |\n");
        notes.forEach(note -> out.append(gutter).append(" = ").append(note).append("\n"));
        return out.toString();
    }

    /**
     * Single-line form, {@code file:line:column: severity: message}.
     */
    public String formatSimple(String filename) {
        var location = span.start();
        return String.format("%s:%d:%d: %s: %s",
                             filename, location.line(), location.column(), severity.display(), message);
    }

    private void appendHeader(StringBuilder out, String filename) {
        out.append(severity.display());
        if (code != null) {
            out.append('[').append(code).append(']');
        }
        out.append(": ").append(message).append('\n');
        var location = span.start();
        out.append("  --> ")
           .append(filename == null ? "" : filename + ":")
           .append(location.line())
           .append(':')
           .append(location.column())
           .append('\n');
    }

    private void appendSourceLine(StringBuilder out, String gutter, int line, String content) {
        var number = String.valueOf(line);
        out.append(" ".repeat(gutter.length() - number.length()))
           .append(number)
           .append(" | ")
           .append(content)
           .append('\n');
        var onLine = labelsOnLine(line);
        if (!onLine.isEmpty()) {
            out.append(gutter).append(" | ").append(markers(line, content, onLine)).append('\n');
        }
    }

    private List<Label> labelsOnLine(int line) {
        var all = labels.isEmpty()
                  ? List.of(Label.primary(span, ""))
                  : labels;
        return all.stream()
                  .filter(label -> label.span().start().line() <= line && line <= label.span().end().line())
                  .sorted(Comparator.comparingInt(label -> label.span().start().column()))
                  .toList();
    }

    /**
     * Marker row under a source line: {@code ^^^} for primary labels, {@code ---} for secondary ones.
     */
    private static String markers(int line, String content, List<Label> onLine) {
        var row = new StringBuilder();
        int column = 1;
        for (var label : onLine) {
            var labelSpan = label.span();
            int from = labelSpan.start().line() == line ? labelSpan.start().column() : 1;
            int to = labelSpan.end().line() == line ? labelSpan.end().column() : content.length() + 1;
            if (column < from) {
                row.append(" ".repeat(from - column));
                column = from;
            }
            int width = Math.max(1, to - from);
            row.append(String.valueOf(label.primary() ? '^' : '-').repeat(width));
            column += width;
            if (!label.message().isEmpty()) {
                row.append(' ').append(label.message());
            }
        }
        return row.toString();
    }
}
