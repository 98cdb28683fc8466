package org.pragmatica.nix.tokenizer;

import org.pragmatica.nix.tree.SyntaxKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.pragmatica.nix.tree.SyntaxKind.*;

/**
 * Pull-based scanner for Nix source text.
 *
 * <p>The scanner is contextual: string bodies, interpolations and interpolated paths are tracked
 * on a mode stack, so that a {@code "} or {@code }} is interpreted according to where it appears.
 * Whitespace and comments are produced as tokens. Any character that starts no token becomes a
 * one-character {@link SyntaxKind#TOKEN_ERROR}, so every step consumes input and scanning always
 * terminates. The end of input is signalled by the iterator running out of tokens.
 */
public final class Tokenizer implements Iterator<Token> {
    private static final Map<String, SyntaxKind> KEYWORDS = Map.of("assert", TOKEN_ASSERT,
                                                                    "else", TOKEN_ELSE,
                                                                    "if", TOKEN_IF,
                                                                    "in", TOKEN_IN,
                                                                    "inherit", TOKEN_INHERIT,
                                                                    "let", TOKEN_LET,
                                                                    "or", TOKEN_OR,
                                                                    "rec", TOKEN_REC,
                                                                    "then", TOKEN_THEN,
                                                                    "with", TOKEN_WITH);

    private sealed interface Mode permits StringBody, StringEnd, Interpol, InterpolStart, PathContinuation {}

    /**
     * Inside string content.
     */
    private record StringBody(boolean multiline) implements Mode {}

    /**
     * The closing delimiter of a string is next.
     */
    private record StringEnd(boolean multiline) implements Mode {}

    /**
     * Inside {@code ${ }}; counts the braces opened within so the matching one closes the splice.
     */
    private record Interpol(int brackets) implements Mode {}

    /**
     * The {@code ${} of a splice is next.
     */
    private record InterpolStart() implements Mode {}

    /**
     * Between the pieces of a path that contains splices.
     */
    private record PathContinuation() implements Mode {}

    private final String input;
    private final Deque<Mode> modes = new ArrayDeque<>();
    private int pos;
    // Ends of the last character runs that failed to form a path or a URI. Any later start
    // inside such a run reaches the same end and fails the same way.
    private int failedPathRunEnd = -1;
    private int failedUriRunEnd = -1;
    private Token pending;
    private boolean finished;

    public Tokenizer(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * Scan the whole input.
     */
    public static List<Token> tokenize(String input) {
        var tokens = new ArrayList<Token>();
        new Tokenizer(input).forEachRemaining(tokens::add);
        return tokens;
    }

    public String input() {
        return input;
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !finished) {
            pending = scan();
            finished = pending == null;
        }
        return pending != null;
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("end of input");
        }
        var token = pending;
        pending = null;
        return token;
    }

    private Token scan() {
        while (true) {
            int start = pos;
            var mode = modes.peek();
            if (mode instanceof InterpolStart) {
                modes.pop();
                modes.push(new Interpol(0));
                pos += 2;
                return token(TOKEN_INTERPOL_START, start);
            }
            if (mode instanceof StringBody body) {
                scanStringBody(body.multiline());
                if (pos == start) {
                    // nothing consumed: either the mode changed or the input ended inside the string
                    if (isAtEnd() && modes.peek() == body) {
                        modes.pop();
                    }
                    continue;
                }
                return token(TOKEN_STRING_CONTENT, start);
            }
            if (mode instanceof StringEnd end) {
                modes.pop();
                pos += end.multiline() ? 2 : 1;
                return token(TOKEN_STRING_END, start);
            }
            if (mode instanceof PathContinuation) {
                pos = scanPathPieces(pos);
                if (startsWith("${", pos)) {
                    modes.push(new InterpolStart());
                } else {
                    modes.pop();
                }
                if (pos == start) {
                    continue;
                }
                return token(TOKEN_PATH, start);
            }
            break;
        }
        if (isAtEnd()) {
            return null;
        }
        return scanToken();
    }

    private Token scanToken() {
        int start = pos;
        char c = peek();
        if (isWhitespace(c)) {
            while (!isAtEnd() && isWhitespace(peek())) {
                pos++;
            }
            return token(TOKEN_WHITESPACE, start);
        }
        if (c == '#') {
            while (!isAtEnd() && peek() != '\n') {
                pos++;
            }
            return token(TOKEN_COMMENT, start);
        }
        if (c == '/' && charAt(pos + 1) == '*') {
            return scanBlockComment(start);
        }
        var path = scanPath(start);
        if (path != null) {
            return path;
        }
        if (isAsciiLetter(c)) {
            int uriEnd = matchUri(start);
            if (uriEnd > 0) {
                pos = uriEnd;
                return token(TOKEN_URI, start);
            }
        }
        if (isIdentStart(c)) {
            while (!isAtEnd() && isIdentPart(peek())) {
                pos++;
            }
            var keyword = KEYWORDS.get(input.substring(start, pos));
            return token(keyword == null
                         ? TOKEN_IDENT
                         : keyword, start);
        }
        if (isDigit(c) || (c == '.' && isDigit(charAt(pos + 1)))) {
            return scanNumber(start);
        }
        if (c == '"') {
            pos++;
            modes.push(new StringBody(false));
            return token(TOKEN_STRING_START, start);
        }
        if (c == '\'' && charAt(pos + 1) == '\'') {
            pos += 2;
            modes.push(new StringBody(true));
            return token(TOKEN_STRING_START, start);
        }
        return scanOperator(start);
    }

    private Token scanBlockComment(int start) {
        int close = input.indexOf("*/", start + 2);
        if (close < 0) {
            pos = input.length();
            return token(TOKEN_ERROR, start);
        }
        pos = close + 2;
        return token(TOKEN_COMMENT, start);
    }

    private Token scanNumber(int start) {
        boolean isFloat = false;
        while (isDigit(charAt(pos))) {
            pos++;
        }
        if (charAt(pos) == '.' && (isDigit(charAt(pos + 1)) || pos > start)) {
            isFloat = true;
            pos++;
            while (isDigit(charAt(pos))) {
                pos++;
            }
            int exponent = exponentEnd(pos);
            if (exponent > 0) {
                pos = exponent;
            }
        }
        return token(isFloat
                     ? TOKEN_FLOAT
                     : TOKEN_INTEGER, start);
    }

    private int exponentEnd(int at) {
        char c = charAt(at);
        if (c != 'e' && c != 'E') {
            return -1;
        }
        int i = at + 1;
        if (charAt(i) == '+' || charAt(i) == '-') {
            i++;
        }
        if (!isDigit(charAt(i))) {
            return -1;
        }
        while (isDigit(charAt(i))) {
            i++;
        }
        return i;
    }

    private Token scanOperator(int start) {
        char c = advance();
        var kind = switch (c) {
            case '{' -> openBrace();
            case '}' -> closeBrace();
            case '[' -> TOKEN_L_BRACK;
            case ']' -> TOKEN_R_BRACK;
            case '(' -> TOKEN_L_PAREN;
            case ')' -> TOKEN_R_PAREN;
            case '@' -> TOKEN_AT;
            case ':' -> TOKEN_COLON;
            case ',' -> TOKEN_COMMA;
            case ';' -> TOKEN_SEMICOLON;
            case '?' -> TOKEN_QUESTION;
            case '*' -> TOKEN_MUL;
            case '=' -> match('=')
                        ? TOKEN_EQUAL
                        : TOKEN_ASSIGN;
            case '!' -> match('=')
                        ? TOKEN_NOT_EQUAL
                        : TOKEN_INVERT;
            case '+' -> match('+')
                        ? TOKEN_CONCAT
                        : TOKEN_ADD;
            case '-' -> match('>')
                        ? TOKEN_IMPLICATION
                        : TOKEN_SUB;
            case '/' -> match('/')
                        ? TOKEN_UPDATE
                        : TOKEN_DIV;
            case '<' -> match('=')
                        ? TOKEN_LESS_OR_EQ
                        : TOKEN_LESS;
            case '>' -> match('=')
                        ? TOKEN_MORE_OR_EQ
                        : TOKEN_MORE;
            case '&' -> match('&')
                        ? TOKEN_AND_AND
                        : TOKEN_ERROR;
            case '|' -> match('|')
                        ? TOKEN_OR_OR
                        : TOKEN_ERROR;
            case '.' -> dots();
            case '$' -> dollar();
            default -> error(c);
        };
        return token(kind, start);
    }

    private SyntaxKind openBrace() {
        if (modes.peek() instanceof Interpol interpol) {
            modes.pop();
            modes.push(new Interpol(interpol.brackets() + 1));
        }
        return TOKEN_L_BRACE;
    }

    private SyntaxKind closeBrace() {
        if (modes.peek() instanceof Interpol interpol) {
            modes.pop();
            if (interpol.brackets() == 0) {
                return TOKEN_INTERPOL_END;
            }
            modes.push(new Interpol(interpol.brackets() - 1));
        }
        return TOKEN_R_BRACE;
    }

    private SyntaxKind dots() {
        if (charAt(pos) == '.' && charAt(pos + 1) == '.') {
            pos += 2;
            return TOKEN_ELLIPSIS;
        }
        return TOKEN_DOT;
    }

    private SyntaxKind dollar() {
        if (match('{')) {
            modes.push(new Interpol(0));
            return TOKEN_INTERPOL_START;
        }
        return TOKEN_ERROR;
    }

    private SyntaxKind error(char c) {
        // keep surrogate pairs together
        if (Character.isHighSurrogate(c) && Character.isLowSurrogate(charAt(pos))) {
            pos++;
        }
        return TOKEN_ERROR;
    }

    // === Strings ===

    /**
     * Consume string content up to the closing delimiter, a splice or the end of input.
     */
    private void scanStringBody(boolean multiline) {
        while (!isAtEnd()) {
            char c = peek();
            if (multiline) {
                if (c == '\'' && charAt(pos + 1) == '\'') {
                    char escaped = charAt(pos + 2);
                    if (escaped == '\'' || escaped == '$') {
                        pos += 3;
                        continue;
                    }
                    if (escaped == '\\') {
                        pos = Math.min(pos + 4, input.length());
                        continue;
                    }
                    modes.pop();
                    modes.push(new StringEnd(true));
                    return;
                }
            } else {
                if (c == '"') {
                    modes.pop();
                    modes.push(new StringEnd(false));
                    return;
                }
                if (c == '\\') {
                    pos = Math.min(pos + 2, input.length());
                    continue;
                }
            }
            if (c == '$') {
                if (charAt(pos + 1) == '$') {
                    pos += 2;
                    continue;
                }
                if (charAt(pos + 1) == '{') {
                    modes.push(new InterpolStart());
                    return;
                }
            }
            pos++;
        }
    }

    // === Paths and URIs ===

    private Token scanPath(int start) {
        if (peek() == '<') {
            int end = matchSearchPath(start);
            if (end < 0) {
                return null;
            }
            pos = end;
            return token(TOKEN_PATH, start);
        }
        int end = matchPath(start);
        if (end < 0) {
            return null;
        }
        pos = end;
        if (startsWith("${", pos)) {
            modes.push(new PathContinuation());
            modes.push(new InterpolStart());
        }
        return token(TOKEN_PATH, start);
    }

    /**
     * Match {@code ~/a}, {@code ./a}, {@code /a}, {@code a/b} and paths that continue with a splice.
     *
     * @return end offset, or -1 if no path starts here
     */
    private int matchPath(int start) {
        int i = start;
        if (charAt(i) == '~') {
            i++;
            if (charAt(i) != '/') {
                return -1;
            }
        } else {
            if (start <= failedPathRunEnd) {
                return -1;
            }
            while (isPathChar(charAt(i))) {
                i++;
            }
        }
        boolean segment = false;
        while (charAt(i) == '/' && (isPathChar(charAt(i + 1)) || startsWith("${", i + 1))) {
            segment = true;
            i++;
            while (isPathChar(charAt(i))) {
                i++;
            }
        }
        if (!segment && charAt(start) != '~') {
            failedPathRunEnd = i;
        }
        return segment
               ? i
               : -1;
    }

    private int matchSearchPath(int start) {
        int i = start + 1;
        if (!isPathChar(charAt(i))) {
            return -1;
        }
        while (isPathChar(charAt(i)) || (charAt(i) == '/' && isPathChar(charAt(i + 1)))) {
            i++;
        }
        return charAt(i) == '>'
               ? i + 1
               : -1;
    }

    /**
     * Consume the literal pieces of a path between splices.
     */
    private int scanPathPieces(int start) {
        int i = start;
        while (isPathChar(charAt(i)) || (charAt(i) == '/' && (isPathChar(charAt(i + 1)) || startsWith("${", i + 1)))) {
            i++;
        }
        return i;
    }

    private int matchUri(int start) {
        if (start <= failedUriRunEnd) {
            return -1;
        }
        int i = start + 1;
        while (isAsciiLetter(charAt(i)) || isDigit(charAt(i)) || charAt(i) == '+' || charAt(i) == '-' || charAt(i) == '.') {
            i++;
        }
        if (charAt(i) != ':' || !isUriChar(charAt(i + 1))) {
            failedUriRunEnd = i;
            return -1;
        }
        i++;
        while (isUriChar(charAt(i))) {
            i++;
        }
        return i;
    }

    // === Character access ===

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    /**
     * Character at the offset, or {@code '\0'} past the end.
     */
    private char charAt(int offset) {
        return offset < input.length()
               ? input.charAt(offset)
               : '\0';
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean startsWith(String prefix, int offset) {
        return input.startsWith(prefix, offset);
    }

    private Token token(SyntaxKind kind, int start) {
        return Token.of(kind, start, pos);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return isAsciiLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c) || c == '\'' || c == '-';
    }

    private static boolean isPathChar(char c) {
        return isAsciiLetter(c) || isDigit(c) || c == '.' || c == '_' || c == '-' || c == '+';
    }

    private static boolean isUriChar(char c) {
        return isAsciiLetter(c) || isDigit(c) || "%/?:@&=+$,-_.!~*'".indexOf(c) >= 0;
    }
}
