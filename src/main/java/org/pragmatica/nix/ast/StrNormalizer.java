package org.pragmatica.nix.ast;

import org.pragmatica.nix.tree.SyntaxToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes string values: indentation stripping for {@code ''} strings and escape decoding.
 *
 * <p>Only spaces count as indentation. Lines holding nothing but spaces do not take part in
 * the minimum, an interpolation at the start of a line does, and text after an interpolation
 * is never a line start. A first line made of spaces only is dropped, and so are the spaces
 * before the closing quotes. Escapes are decoded after dedenting.
 */
final class StrNormalizer {
    private StrNormalizer() {}

    static List<InterpolPart<String>> normalize(List<InterpolPart<SyntaxToken>> raw, boolean indented) {
        var parts = merge(raw);
        if (indented) {
            parts = dedent(parts);
        }
        var result = new ArrayList<InterpolPart<String>>(parts.size());
        for (var part : parts) {
            if (part instanceof InterpolPart.Text<String> text) {
                var value = indented
                            ? unescapeIndented(text.value())
                            : unescape(text.value());
                if (!value.isEmpty()) {
                    result.add(new InterpolPart.Text<>(value));
                }
            } else {
                result.add(part);
            }
        }
        return result;
    }

    private static List<InterpolPart<String>> merge(List<InterpolPart<SyntaxToken>> raw) {
        var parts = new ArrayList<InterpolPart<String>>();
        var pending = new StringBuilder();
        for (var part : raw) {
            if (part instanceof InterpolPart.Text<SyntaxToken> text) {
                pending.append(text.value().text());
            } else if (part instanceof InterpolPart.Interpolation<SyntaxToken> interpolation) {
                if (pending.length() > 0) {
                    parts.add(new InterpolPart.Text<>(pending.toString()));
                    pending.setLength(0);
                }
                parts.add(new InterpolPart.Interpolation<>(interpolation.interpol()));
            }
        }
        if (pending.length() > 0) {
            parts.add(new InterpolPart.Text<>(pending.toString()));
        }
        return parts;
    }

    // === Dedent ===

    private static List<InterpolPart<String>> dedent(List<InterpolPart<String>> input) {
        var parts = new ArrayList<>(input);
        if (!parts.isEmpty() && parts.get(0) instanceof InterpolPart.Text<String> first) {
            var text = first.value();
            int newline = text.indexOf('\n');
            if (newline >= 0 && isSpaces(text, 0, newline)) {
                parts.set(0, new InterpolPart.Text<>(text.substring(newline + 1)));
            }
        }
        int indent = minIndent(parts);
        var stripped = strip(parts, indent);
        int lastIndex = stripped.size() - 1;
        if (lastIndex >= 0 && stripped.get(lastIndex) instanceof InterpolPart.Text<String> last) {
            var text = last.value();
            int newline = text.lastIndexOf('\n');
            if (newline >= 0 && isSpaces(text, newline + 1, text.length())) {
                stripped.set(lastIndex, new InterpolPart.Text<>(text.substring(0, newline + 1)));
            }
        }
        return stripped;
    }

    private static int minIndent(List<InterpolPart<String>> parts) {
        int min = Integer.MAX_VALUE;
        boolean atLineStart = true;
        int current = 0;
        for (var part : parts) {
            if (!(part instanceof InterpolPart.Text<String> text)) {
                if (atLineStart) {
                    min = Math.min(min, current);
                    atLineStart = false;
                }
                continue;
            }
            var value = text.value();
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                if (c == '\n') {
                    atLineStart = true;
                    current = 0;
                } else if (atLineStart) {
                    if (c == ' ') {
                        current++;
                    } else {
                        min = Math.min(min, current);
                        atLineStart = false;
                    }
                }
            }
        }
        return min;
    }

    private static List<InterpolPart<String>> strip(List<InterpolPart<String>> parts, int indent) {
        var result = new ArrayList<InterpolPart<String>>(parts.size());
        boolean atLineStart = true;
        int removed = 0;
        for (var part : parts) {
            if (!(part instanceof InterpolPart.Text<String> text)) {
                atLineStart = false;
                result.add(part);
                continue;
            }
            var value = text.value();
            var sb = new StringBuilder(value.length());
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                if (c == '\n') {
                    sb.append(c);
                    atLineStart = true;
                    removed = 0;
                } else if (atLineStart && c == ' ' && removed < indent) {
                    removed++;
                } else {
                    atLineStart = false;
                    sb.append(c);
                }
            }
            result.add(new InterpolPart.Text<>(sb.toString()));
        }
        return result;
    }

    private static boolean isSpaces(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            if (text.charAt(i) != ' ') {
                return false;
            }
        }
        return true;
    }

    // === Escapes ===

    static String unescape(String text) {
        var sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                sb.append(decode(text.charAt(++i)));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String unescapeIndented(String text) {
        var sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            if (text.startsWith("''", i) && i + 2 < text.length()) {
                char next = text.charAt(i + 2);
                if (next == '\'') {
                    sb.append("''");
                    i += 3;
                    continue;
                }
                if (next == '$') {
                    sb.append('$');
                    i += 3;
                    continue;
                }
                if (next == '\\' && i + 3 < text.length()) {
                    sb.append(decode(text.charAt(i + 3)));
                    i += 4;
                    continue;
                }
            }
            sb.append(text.charAt(i));
            i++;
        }
        return sb.toString();
    }

    private static char decode(char escaped) {
        return switch (escaped) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            default -> escaped;
        };
    }
}
