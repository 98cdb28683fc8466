package org.pragmatica.nix.parser;

import org.pragmatica.nix.error.ParseError;
import org.pragmatica.nix.tokenizer.Token;
import org.pragmatica.nix.tokenizer.Tokenizer;
import org.pragmatica.nix.tree.GreenNode;
import org.pragmatica.nix.tree.GreenNodeBuilder;
import org.pragmatica.nix.tree.GreenNodeBuilder.Checkpoint;
import org.pragmatica.nix.tree.NodeCache;
import org.pragmatica.nix.tree.SyntaxKind;
import org.pragmatica.nix.tree.TextRange;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static org.pragmatica.nix.tree.SyntaxKind.*;

/**
 * Error-tolerant recursive descent parser for Nix expressions.
 *
 * <p>Consumes the token stream and emits a lossless green tree: every token, trivia included,
 * ends up in the tree exactly once and in source order. Binary operators are parsed by precedence
 * climbing over builder checkpoints, so the left operand is wrapped after the operator is seen.
 *
 * <p>Syntax errors never abort the parse. Missing tokens are recorded without consuming input,
 * stray tokens are wrapped in {@link SyntaxKind#NODE_ERROR} nodes. Every loop over repeated
 * elements either consumes a token or stops, so parsing always terminates.
 */
public final class Parser {
    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    /**
     * Result of a raw parse: the green root and the errors in discovery order.
     */
    public record Output(GreenNode green, List<ParseError> errors) {
        public Output {
            errors = List.copyOf(errors);
        }
    }

    private enum Assoc {
        LEFT,
        RIGHT,
        NONE
    }

    private record Operator(int precedence, Assoc assoc) {}

    // === Precedence table (higher binds tighter) ===
    private static final int NOT_PRECEDENCE = 7;

    private static final Map<SyntaxKind, Operator> OPERATORS = Map.ofEntries(
        Map.entry(TOKEN_IMPLICATION, new Operator(1, Assoc.RIGHT)),
        Map.entry(TOKEN_OR_OR, new Operator(2, Assoc.LEFT)),
        Map.entry(TOKEN_AND_AND, new Operator(3, Assoc.LEFT)),
        Map.entry(TOKEN_EQUAL, new Operator(4, Assoc.NONE)),
        Map.entry(TOKEN_NOT_EQUAL, new Operator(4, Assoc.NONE)),
        Map.entry(TOKEN_LESS, new Operator(5, Assoc.NONE)),
        Map.entry(TOKEN_LESS_OR_EQ, new Operator(5, Assoc.NONE)),
        Map.entry(TOKEN_MORE, new Operator(5, Assoc.NONE)),
        Map.entry(TOKEN_MORE_OR_EQ, new Operator(5, Assoc.NONE)),
        Map.entry(TOKEN_UPDATE, new Operator(6, Assoc.RIGHT)),
        Map.entry(TOKEN_ADD, new Operator(8, Assoc.LEFT)),
        Map.entry(TOKEN_SUB, new Operator(8, Assoc.LEFT)),
        Map.entry(TOKEN_MUL, new Operator(9, Assoc.LEFT)),
        Map.entry(TOKEN_DIV, new Operator(9, Assoc.LEFT)),
        Map.entry(TOKEN_CONCAT, new Operator(10, Assoc.RIGHT)));

    // === Recovery sets ===
    private static final Set<SyntaxKind> RECOVERY = EnumSet.of(
        TOKEN_SEMICOLON, TOKEN_R_BRACE, TOKEN_R_BRACK, TOKEN_R_PAREN, TOKEN_INTERPOL_END,
        TOKEN_IN, TOKEN_THEN, TOKEN_ELSE);

    private static final Set<SyntaxKind> CLOSERS = EnumSet.of(
        TOKEN_R_BRACE, TOKEN_R_BRACK, TOKEN_R_PAREN, TOKEN_INTERPOL_END);

    private static final Set<SyntaxKind> OPENERS = EnumSet.of(
        TOKEN_L_BRACE, TOKEN_L_BRACK, TOKEN_L_PAREN, TOKEN_INTERPOL_START, TOKEN_STRING_START);

    private static final Set<SyntaxKind> BINDING_START = EnumSet.of(
        TOKEN_IDENT, TOKEN_OR, TOKEN_STRING_START, TOKEN_INTERPOL_START, TOKEN_INHERIT);

    private static final Set<SyntaxKind> ATTR_START = EnumSet.of(
        TOKEN_IDENT, TOKEN_STRING_START, TOKEN_INTERPOL_START);

    private static final Set<SyntaxKind> PATTERN_ENTRY_START = EnumSet.of(
        TOKEN_IDENT, TOKEN_ELLIPSIS, TOKEN_R_BRACE);

    private static final Set<SyntaxKind> NONE = EnumSet.noneOf(SyntaxKind.class);

    private final String input;
    private final Iterator<Token> tokens;
    private final ParserConfig config;
    private final GreenNodeBuilder builder;
    private final List<Token> buffer = new ArrayList<>();
    private final List<Token> trivia = new ArrayList<>();
    private final List<ParseError> errors = new ArrayList<>();

    private int consumed;
    private int bumped;
    private int depth;

    private Parser(String input, ParserConfig config, NodeCache cache) {
        this.input = input;
        this.tokens = new Tokenizer(input);
        this.config = config;
        this.builder = new GreenNodeBuilder(cache);
    }

    public static Output parse(String input) {
        return parse(input, ParserConfig.DEFAULT);
    }

    public static Output parse(String input, ParserConfig config) {
        return parse(input, config, new NodeCache());
    }

    public static Output parse(String input, ParserConfig config, NodeCache cache) {
        return new Parser(input, config, cache).parseRoot();
    }

    private Output parseRoot() {
        // Leading trivia belongs to the root, so the node starts before anything is peeked.
        builder.startNode(NODE_ROOT);
        parseExpr();
        if (peek() != null) {
            int start = startErrorNode();
            while (peek() != null) {
                bump();
            }
            int end = finishErrorNode();
            errors.add(new ParseError.UnexpectedExtra(TextRange.of(start, end)));
        }
        drainTrivia();
        builder.finishNode();
        return new Output(builder.finish(), errors);
    }

    // === Token stream ===

    private Token peekRawToken() {
        if (buffer.isEmpty()) {
            if (!tokens.hasNext()) {
                return null;
            }
            buffer.add(tokens.next());
        }
        return buffer.get(0);
    }

    private SyntaxKind peekRaw() {
        var token = peekRawToken();
        return token == null
               ? null
               : token.kind();
    }

    /**
     * Next significant token. Trivia in front of it is moved aside and emitted before whatever is
     * bumped or started next.
     */
    private Token peekToken() {
        var token = peekRawToken();
        while (token != null && token.isTrivia()) {
            trivia.add(buffer.remove(0));
            token = peekRawToken();
        }
        return token;
    }

    private SyntaxKind peek() {
        var token = peekToken();
        return token == null
               ? null
               : token.kind();
    }

    /**
     * Kind of the n-th significant token ahead, 0 being the current one.
     */
    private SyntaxKind peekNth(int n) {
        peekToken();
        int seen = 0;
        for (int i = 0; ; i++) {
            while (i >= buffer.size()) {
                if (!tokens.hasNext()) {
                    return null;
                }
                buffer.add(tokens.next());
            }
            var token = buffer.get(i);
            if (token.isTrivia()) {
                continue;
            }
            if (seen == n) {
                return token.kind();
            }
            seen++;
        }
    }

    private void drainTrivia() {
        for (var token : trivia) {
            builder.token(token.kind(), token.text(input));
        }
        trivia.clear();
    }

    private void bump() {
        var token = peekToken();
        if (token == null) {
            errors.add(new ParseError.UnexpectedEof(TextRange.at(input.length()), NONE));
            return;
        }
        bumpAs(token.kind());
    }

    /**
     * Consume the current token, re-tagging it with the given kind. Used for {@code or} in
     * attribute name positions.
     */
    private void bumpAs(SyntaxKind kind) {
        var token = peekToken();
        drainTrivia();
        buffer.remove(0);
        builder.token(kind, token.text(input));
        consumed = token.range().end();
        bumped++;
    }

    private int position() {
        var token = peekToken();
        return token == null
               ? input.length()
               : token.range().start();
    }

    // === Node helpers ===

    private void startNode(SyntaxKind kind) {
        peekToken();
        drainTrivia();
        builder.startNode(kind);
    }

    private Checkpoint checkpoint() {
        peekToken();
        drainTrivia();
        return builder.checkpoint();
    }

    private void startNodeAt(Checkpoint checkpoint, SyntaxKind kind) {
        builder.startNodeAt(checkpoint, kind);
    }

    private void finishNode() {
        builder.finishNode();
    }

    private int startErrorNode() {
        startNode(NODE_ERROR);
        return position();
    }

    private int finishErrorNode() {
        finishNode();
        return consumed;
    }

    private TextRange errorRange(int start, int end) {
        return TextRange.of(start, Math.max(start, end));
    }

    // === Recovery ===

    private boolean expect(SyntaxKind wanted) {
        return expect(wanted, NONE);
    }

    /**
     * Consume the wanted token. When it is absent and the current token is a recovery point or in
     * {@code follow}, the token is reported missing and nothing is consumed. Otherwise tokens are
     * skipped into an error node up to the wanted token or a recovery point.
     */
    private boolean expect(SyntaxKind wanted, Set<SyntaxKind> follow) {
        var kind = peek();
        if (kind == wanted) {
            bump();
            return true;
        }
        if (kind == null) {
            errors.add(new ParseError.UnexpectedEof(TextRange.at(input.length()), EnumSet.of(wanted)));
            return false;
        }
        if (RECOVERY.contains(kind) || follow.contains(kind)) {
            errors.add(new ParseError.Missing(TextRange.at(consumed), EnumSet.of(wanted)));
            return false;
        }
        var found = kind;
        int start = startErrorNode();
        do {
            bump();
            kind = peek();
        } while (kind != null && kind != wanted && !RECOVERY.contains(kind) && !follow.contains(kind));
        int end = finishErrorNode();
        errors.add(new ParseError.UnexpectedWanted(found, errorRange(start, end), EnumSet.of(wanted)));
        if (kind == wanted) {
            bump();
            return true;
        }
        return false;
    }

    /**
     * Consume the closing {@code }} of an interpolation. The tokenizer guarantees it follows, so
     * anything before it is skipped regardless of recovery points.
     */
    private void expectInterpolEnd() {
        var kind = peek();
        if (kind == TOKEN_INTERPOL_END) {
            bump();
            return;
        }
        if (kind == null) {
            errors.add(new ParseError.UnexpectedEof(TextRange.at(input.length()), EnumSet.of(TOKEN_INTERPOL_END)));
            return;
        }
        var found = kind;
        int start = startErrorNode();
        int nested = 0;
        while (kind != null && (kind != TOKEN_INTERPOL_END || nested > 0)) {
            if (kind == TOKEN_INTERPOL_START) {
                nested++;
            } else if (kind == TOKEN_INTERPOL_END) {
                nested--;
            }
            bump();
            kind = peek();
        }
        int end = finishErrorNode();
        errors.add(new ParseError.UnexpectedWanted(found,
                                                   errorRange(start, end),
                                                   EnumSet.of(TOKEN_INTERPOL_END)));
        if (kind == TOKEN_INTERPOL_END) {
            bump();
        }
    }

    /**
     * Report one misplaced token. Recovery points and tokens in {@code keep} are left in place.
     */
    private void recoverOne(Set<SyntaxKind> wanted, Set<SyntaxKind> keep) {
        var kind = peek();
        if (kind == null) {
            errors.add(new ParseError.UnexpectedEof(TextRange.at(input.length()), wanted));
            return;
        }
        if (RECOVERY.contains(kind) || keep.contains(kind)) {
            errors.add(new ParseError.Missing(TextRange.at(consumed), wanted));
            return;
        }
        int start = startErrorNode();
        bump();
        int end = finishErrorNode();
        errors.add(new ParseError.UnexpectedWanted(kind, errorRange(start, end), wanted));
    }

    /**
     * Wrap the current token in an error node when the loop iteration started at {@code before}
     * consumed nothing.
     */
    private void ensureProgress(int before) {
        if (bumped != before) {
            return;
        }
        var kind = peek();
        if (kind == null) {
            return;
        }
        int start = startErrorNode();
        bump();
        int end = finishErrorNode();
        errors.add(new ParseError.Unexpected(kind, errorRange(start, end)));
    }

    private boolean enter() {
        if (depth < config.recursionLimit()) {
            depth++;
            return true;
        }
        skipNested();
        return false;
    }

    private void exit() {
        depth--;
    }

    /**
     * Skip the rest of the innermost bracketed region. Closing tokens of enclosing regions are
     * left for their owners.
     */
    private void skipNested() {
        int start = startErrorNode();
        int balance = 0;
        var kind = peek();
        while (kind != null) {
            if (OPENERS.contains(kind)) {
                balance++;
            } else if (CLOSERS.contains(kind) || kind == TOKEN_STRING_END) {
                if (balance == 0) {
                    break;
                }
                balance--;
            } else if (balance == 0 && RECOVERY.contains(kind)) {
                break;
            }
            bump();
            kind = peek();
        }
        int end = finishErrorNode();
        errors.add(new ParseError.RecursionLimitExceeded(errorRange(start, end)));
        LOG.fine(() -> "recursion limit " + config.recursionLimit() + " reached at offset " + start);
    }

    // === Expressions ===

    private Checkpoint parseExpr() {
        var checkpoint = checkpoint();
        if (!enter()) {
            return checkpoint;
        }
        try {
            var kind = peek();
            if (kind == TOKEN_LET) {
                if (peekNth(1) == TOKEN_L_BRACE) {
                    parseLegacyLet();
                } else {
                    parseLetIn();
                }
            } else if (kind == TOKEN_WITH) {
                parseKeywordBody(NODE_WITH);
            } else if (kind == TOKEN_ASSERT) {
                parseKeywordBody(NODE_ASSERT);
            } else if (kind == TOKEN_IF) {
                parseIfElse();
            } else {
                parseBinary(1);
            }
        } finally {
            exit();
        }
        return checkpoint;
    }

    private void parseLetIn() {
        startNode(NODE_LET_IN);
        bump();
        parseBindings(TOKEN_IN);
        expect(TOKEN_IN);
        parseExpr();
        finishNode();
    }

    private void parseLegacyLet() {
        startNode(NODE_LEGACY_LET);
        bump();
        bump();
        parseBindings(TOKEN_R_BRACE);
        expect(TOKEN_R_BRACE);
        finishNode();
    }

    // with e; body  and  assert e; body
    private void parseKeywordBody(SyntaxKind kind) {
        startNode(kind);
        bump();
        parseExpr();
        expect(TOKEN_SEMICOLON);
        parseExpr();
        finishNode();
    }

    private void parseIfElse() {
        startNode(NODE_IF_ELSE);
        bump();
        parseExpr();
        expect(TOKEN_THEN);
        parseExpr();
        expect(TOKEN_ELSE);
        parseExpr();
        finishNode();
    }

    private Checkpoint parseBinary(int minPrecedence) {
        var checkpoint = parseOperand();
        SyntaxKind previous = null;
        int previousPrecedence = -1;
        while (true) {
            var kind = peek();
            var operator = kind == null
                           ? null
                           : OPERATORS.get(kind);
            if (operator == null || operator.precedence() < minPrecedence) {
                break;
            }
            if (operator.assoc() == Assoc.NONE && previous != null && previousPrecedence == operator.precedence()) {
                errors.add(new ParseError.NonAssociative(peekToken().range(), previous, kind));
            }
            startNodeAt(checkpoint, NODE_BIN_OP);
            bump();
            int next = operator.assoc() == Assoc.RIGHT
                       ? operator.precedence()
                       : operator.precedence() + 1;
            if (enter()) {
                try {
                    parseBinary(next);
                } finally {
                    exit();
                }
            }
            finishNode();
            previous = kind;
            previousPrecedence = operator.precedence();
        }
        return checkpoint;
    }

    private Checkpoint parseOperand() {
        if (peek() != TOKEN_INVERT) {
            return parseHasAttr();
        }
        var checkpoint = checkpoint();
        startNode(NODE_UNARY_OP);
        bump();
        if (enter()) {
            try {
                parseBinary(NOT_PRECEDENCE);
            } finally {
                exit();
            }
        }
        finishNode();
        return checkpoint;
    }

    private Checkpoint parseHasAttr() {
        var checkpoint = parseNegation();
        while (peek() == TOKEN_QUESTION) {
            startNodeAt(checkpoint, NODE_HAS_ATTR);
            bump();
            parseAttrpath();
            finishNode();
        }
        return checkpoint;
    }

    private Checkpoint parseNegation() {
        if (peek() != TOKEN_SUB) {
            return parseApplication();
        }
        var checkpoint = checkpoint();
        startNode(NODE_UNARY_OP);
        bump();
        if (enter()) {
            try {
                parseNegation();
            } finally {
                exit();
            }
        }
        finishNode();
        return checkpoint;
    }

    private Checkpoint parseApplication() {
        var checkpoint = parseValue();
        while (true) {
            var kind = peek();
            if (kind == null || !kind.isFnArg() || looksLikeBinding()) {
                break;
            }
            startNodeAt(checkpoint, NODE_APPLY);
            parseValue();
            finishNode();
        }
        return checkpoint;
    }

    /**
     * Whether the upcoming tokens read {@code name(.name)* =}. An application stops there, so a
     * binding after a forgotten {@code ;} is still parsed as a binding.
     */
    private boolean looksLikeBinding() {
        if (!isName(peekNth(0))) {
            return false;
        }
        int n = 0;
        while (peekNth(n + 1) == TOKEN_DOT && isName(peekNth(n + 2))) {
            n += 2;
        }
        return peekNth(n + 1) == TOKEN_ASSIGN;
    }

    private static boolean isName(SyntaxKind kind) {
        return kind == TOKEN_IDENT || kind == TOKEN_OR;
    }

    private Checkpoint parseValue() {
        var checkpoint = checkpoint();
        if (!enter()) {
            return checkpoint;
        }
        try {
            parseValueBody(checkpoint);
            if (peek() == TOKEN_DOT) {
                startNodeAt(checkpoint, NODE_SELECT);
                bump();
                parseAttrpath();
                if (peek() == TOKEN_OR) {
                    bump();
                    parseValue();
                }
                finishNode();
            }
        } finally {
            exit();
        }
        return checkpoint;
    }

    private void parseValueBody(Checkpoint checkpoint) {
        var kind = peek();
        if (kind == null) {
            startNode(NODE_ERROR);
            finishNode();
            errors.add(new ParseError.UnexpectedEof(TextRange.at(input.length()), NONE));
            return;
        }
        switch (kind) {
            case TOKEN_L_PAREN -> {
                startNode(NODE_PAREN);
                bump();
                parseExpr();
                expect(TOKEN_R_PAREN);
                finishNode();
            }
            case TOKEN_REC -> {
                startNode(NODE_ATTR_SET);
                bump();
                expect(TOKEN_L_BRACE);
                parseBindings(TOKEN_R_BRACE);
                expect(TOKEN_R_BRACE);
                finishNode();
            }
            case TOKEN_L_BRACE -> {
                if (looksLikePattern()) {
                    parsePatternLambda();
                } else {
                    startNode(NODE_ATTR_SET);
                    bump();
                    parseBindings(TOKEN_R_BRACE);
                    expect(TOKEN_R_BRACE);
                    finishNode();
                }
            }
            case TOKEN_L_BRACK -> parseList();
            case TOKEN_STRING_START -> parseString();
            case TOKEN_PATH -> parsePath();
            case TOKEN_IDENT, TOKEN_OR -> parseIdentOrLambda(checkpoint);
            case TOKEN_INTEGER, TOKEN_FLOAT, TOKEN_URI -> {
                startNode(NODE_LITERAL);
                bump();
                finishNode();
            }
            default -> parseMissingValue(kind);
        }
    }

    private void parseMissingValue(SyntaxKind kind) {
        if (RECOVERY.contains(kind)) {
            startNode(NODE_ERROR);
            finishNode();
            errors.add(new ParseError.MissingExpression(TextRange.at(consumed)));
            return;
        }
        int start = startErrorNode();
        bump();
        int end = finishErrorNode();
        errors.add(new ParseError.Unexpected(kind, errorRange(start, end)));
    }

    private void parseIdentOrLambda(Checkpoint checkpoint) {
        parseIdent();
        var next = peek();
        if (next == TOKEN_COLON) {
            startNodeAt(checkpoint, NODE_LAMBDA);
            startNodeAt(checkpoint, NODE_IDENT_PARAM);
            finishNode();
            bump();
            parseExpr();
            finishNode();
        } else if (next == TOKEN_AT) {
            startNodeAt(checkpoint, NODE_LAMBDA);
            startNodeAt(checkpoint, NODE_PATTERN);
            startNodeAt(checkpoint, NODE_PAT_BIND);
            bump();
            finishNode();
            if (expect(TOKEN_L_BRACE)) {
                parsePatternBody(true);
            }
            finishNode();
            expect(TOKEN_COLON);
            parseExpr();
            finishNode();
        }
    }

    private void parseIdent() {
        startNode(NODE_IDENT);
        bumpAs(TOKEN_IDENT);
        finishNode();
    }

    private boolean expectIdent() {
        if (isName(peek())) {
            parseIdent();
            return true;
        }
        recoverOne(EnumSet.of(TOKEN_IDENT), NONE);
        return false;
    }

    private void parseList() {
        startNode(NODE_LIST);
        bump();
        while (true) {
            var kind = peek();
            if (kind == null || CLOSERS.contains(kind)) {
                break;
            }
            int before = bumped;
            parseValue();
            ensureProgress(before);
        }
        expect(TOKEN_R_BRACK);
        finishNode();
    }

    // === Strings and paths ===

    private void parseString() {
        startNode(NODE_STRING);
        bump();
        while (true) {
            var kind = peekRaw();
            if (kind == TOKEN_STRING_CONTENT) {
                bump();
            } else if (kind == TOKEN_INTERPOL_START) {
                parseInterpolation();
            } else {
                break;
            }
        }
        expect(TOKEN_STRING_END);
        finishNode();
    }

    private void parseInterpolation() {
        startNode(NODE_INTERPOL);
        bump();
        parseExpr();
        expectInterpolEnd();
        finishNode();
    }

    private void parsePath() {
        startNode(NODE_PATH);
        bump();
        while (true) {
            // Path fragments are adjacent; any trivia ends the path.
            var kind = peekRaw();
            if (kind == TOKEN_PATH) {
                bump();
            } else if (kind == TOKEN_INTERPOL_START) {
                parseInterpolation();
            } else {
                break;
            }
        }
        finishNode();
    }

    // === Attribute sets and bindings ===

    private void parseBindings(SyntaxKind until) {
        while (true) {
            var kind = peek();
            if (kind == null || kind == until || CLOSERS.contains(kind)) {
                break;
            }
            int before = bumped;
            if (kind == TOKEN_INHERIT) {
                parseInherit();
            } else {
                parseBinding();
            }
            ensureProgress(before);
        }
    }

    private void parseBinding() {
        startNode(NODE_ATTRPATH_VALUE);
        parseAttrpath();
        expect(TOKEN_ASSIGN);
        parseExpr();
        expect(TOKEN_SEMICOLON, BINDING_START);
        finishNode();
    }

    private void parseInherit() {
        startNode(NODE_INHERIT);
        bump();
        if (peek() == TOKEN_L_PAREN) {
            startNode(NODE_INHERIT_FROM);
            bump();
            parseExpr();
            expect(TOKEN_R_PAREN);
            finishNode();
        }
        while (true) {
            var kind = peek();
            if (kind == TOKEN_IDENT || kind == TOKEN_OR || kind == TOKEN_STRING_START || kind == TOKEN_INTERPOL_START) {
                parseAttr();
            } else {
                break;
            }
        }
        expect(TOKEN_SEMICOLON, BINDING_START);
        finishNode();
    }

    private void parseAttrpath() {
        startNode(NODE_ATTRPATH);
        parseAttr();
        while (peek() == TOKEN_DOT) {
            bump();
            parseAttr();
        }
        finishNode();
    }

    private void parseAttr() {
        var kind = peek();
        if (kind == TOKEN_IDENT || kind == TOKEN_OR) {
            parseIdent();
        } else if (kind == TOKEN_STRING_START) {
            parseString();
        } else if (kind == TOKEN_INTERPOL_START) {
            startNode(NODE_DYNAMIC);
            bump();
            parseExpr();
            expectInterpolEnd();
            finishNode();
        } else {
            recoverOne(ATTR_START, EnumSet.of(TOKEN_ASSIGN, TOKEN_DOT));
        }
    }

    // === Lambdas with patterns ===

    /**
     * Two tokens of lookahead after {@code {} decide between a pattern and an attribute set.
     */
    private boolean looksLikePattern() {
        var first = peekNth(1);
        var second = peekNth(2);
        if (first == TOKEN_IDENT) {
            return second == TOKEN_COMMA || second == TOKEN_QUESTION || second == TOKEN_R_BRACE;
        }
        if (first == TOKEN_ELLIPSIS) {
            return second == TOKEN_R_BRACE;
        }
        if (first == TOKEN_R_BRACE) {
            return second == TOKEN_COLON || second == TOKEN_AT;
        }
        return false;
    }

    private void parsePatternLambda() {
        startNode(NODE_LAMBDA);
        startNode(NODE_PATTERN);
        bump();
        parsePatternBody(false);
        finishNode();
        expect(TOKEN_COLON);
        parseExpr();
        finishNode();
    }

    /**
     * Entries of a pattern after its opening brace, the closing brace and a trailing bind.
     *
     * @param bound whether the pattern already has a leading {@code name @} bind
     */
    private void parsePatternBody(boolean bound) {
        var names = new HashSet<String>();
        while (true) {
            var kind = peek();
            if (kind == TOKEN_R_BRACE) {
                bump();
                break;
            }
            if (kind == TOKEN_ELLIPSIS) {
                bump();
                expect(TOKEN_R_BRACE);
                break;
            }
            if (isName(kind)) {
                parsePatternEntry(names);
                if (peek() == TOKEN_COMMA) {
                    bump();
                    continue;
                }
                expect(TOKEN_R_BRACE, EnumSet.of(TOKEN_COLON, TOKEN_AT));
                break;
            }
            if (kind == null || kind == TOKEN_COLON || kind == TOKEN_AT || RECOVERY.contains(kind)) {
                recoverOne(PATTERN_ENTRY_START, EnumSet.of(TOKEN_COLON, TOKEN_AT));
                break;
            }
            recoverOne(PATTERN_ENTRY_START, NONE);
        }
        if (peek() == TOKEN_AT) {
            if (bound) {
                int start = startErrorNode();
                bump();
                if (isName(peek())) {
                    parseIdent();
                }
                int end = finishErrorNode();
                errors.add(new ParseError.UnexpectedDoubleBind(errorRange(start, end)));
            } else {
                startNode(NODE_PAT_BIND);
                bump();
                expectIdent();
                finishNode();
            }
        }
    }

    private void parsePatternEntry(Set<String> names) {
        var token = peekToken();
        var name = token.text(input);
        if (!names.add(name)) {
            errors.add(new ParseError.DuplicatedArgs(token.range(), name));
        }
        startNode(NODE_PAT_ENTRY);
        parseIdent();
        if (peek() == TOKEN_QUESTION) {
            bump();
            parseExpr();
        }
        finishNode();
    }
}
