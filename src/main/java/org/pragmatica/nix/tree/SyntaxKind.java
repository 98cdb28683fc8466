package org.pragmatica.nix.tree;

import com.google.common.base.Verify;

/**
 * Closed set of token and node kinds.
 *
 * <p>Green elements store the ordinal as a raw tag; {@link #fromRaw(int)} converts it back and
 * treats an out-of-range tag as a corrupted tree.
 */
public enum SyntaxKind {
    // Trivia and error tokens
    TOKEN_COMMENT("comment"),
    TOKEN_ERROR("error"),
    TOKEN_WHITESPACE("whitespace"),

    // Keywords
    TOKEN_ASSERT("'assert'"),
    TOKEN_ELSE("'else'"),
    TOKEN_IF("'if'"),
    TOKEN_IN("'in'"),
    TOKEN_INHERIT("'inherit'"),
    TOKEN_LET("'let'"),
    TOKEN_OR("'or'"),
    TOKEN_REC("'rec'"),
    TOKEN_THEN("'then'"),
    TOKEN_WITH("'with'"),

    // Punctuation
    TOKEN_L_BRACE("'{'"),
    TOKEN_R_BRACE("'}'"),
    TOKEN_L_BRACK("'['"),
    TOKEN_R_BRACK("']'"),
    TOKEN_ASSIGN("'='"),
    TOKEN_AT("'@'"),
    TOKEN_COLON("':'"),
    TOKEN_COMMA("','"),
    TOKEN_DOT("'.'"),
    TOKEN_ELLIPSIS("'...'"),
    TOKEN_QUESTION("'?'"),
    TOKEN_SEMICOLON("';'"),

    // Operators
    TOKEN_L_PAREN("'('"),
    TOKEN_R_PAREN("')'"),
    TOKEN_CONCAT("'++'"),
    TOKEN_INVERT("'!'"),
    TOKEN_UPDATE("'//'"),
    TOKEN_ADD("'+'"),
    TOKEN_SUB("'-'"),
    TOKEN_MUL("'*'"),
    TOKEN_DIV("'/'"),
    TOKEN_AND_AND("'&&'"),
    TOKEN_EQUAL("'=='"),
    TOKEN_IMPLICATION("'->'"),
    TOKEN_LESS("'<'"),
    TOKEN_LESS_OR_EQ("'<='"),
    TOKEN_MORE("'>'"),
    TOKEN_MORE_OR_EQ("'>='"),
    TOKEN_NOT_EQUAL("'!='"),
    TOKEN_OR_OR("'||'"),

    // Values and string pieces
    TOKEN_FLOAT("float"),
    TOKEN_IDENT("identifier"),
    TOKEN_INTEGER("integer"),
    TOKEN_INTERPOL_END("'}'"),
    TOKEN_INTERPOL_START("'${'"),
    TOKEN_PATH("path"),
    TOKEN_URI("uri"),
    TOKEN_STRING_CONTENT("string content"),
    TOKEN_STRING_END("string end"),
    TOKEN_STRING_START("string start"),

    // Nodes
    NODE_APPLY("application"),
    NODE_ASSERT("assertion"),
    NODE_ATTRPATH("attribute path"),
    NODE_DYNAMIC("dynamic attribute"),
    NODE_ERROR("error"),
    NODE_IDENT("identifier"),
    NODE_IF_ELSE("if-else"),
    NODE_SELECT("selection"),
    NODE_INHERIT("inherit"),
    NODE_INHERIT_FROM("inherit source"),
    NODE_STRING("string"),
    NODE_INTERPOL("interpolation"),
    NODE_LAMBDA("lambda"),
    NODE_IDENT_PARAM("identifier parameter"),
    NODE_LEGACY_LET("legacy let"),
    NODE_LET_IN("let-in"),
    NODE_LIST("list"),
    NODE_BIN_OP("binary operation"),
    NODE_PAREN("parenthesized expression"),
    NODE_PATTERN("pattern"),
    NODE_PAT_BIND("pattern binding"),
    NODE_PAT_ENTRY("pattern entry"),
    NODE_PATH("path"),
    NODE_LITERAL("literal"),
    NODE_ATTR_SET("attribute set"),
    NODE_ATTRPATH_VALUE("binding"),
    NODE_ROOT("root"),
    NODE_UNARY_OP("unary operation"),
    NODE_WITH("with"),
    NODE_HAS_ATTR("has-attribute test");

    /**
     * Highest valid raw tag.
     */
    public static final int LAST = NODE_HAS_ATTR.ordinal();

    private static final SyntaxKind[] VALUES = values();

    private final String display;

    SyntaxKind(String display) {
        this.display = display;
    }

    /**
     * Human-readable name used in error messages.
     */
    public String display() {
        return display;
    }

    public int toRaw() {
        return ordinal();
    }

    /**
     * Convert a stored raw tag back into a kind.
     *
     * @throws com.google.common.base.VerifyException if the tag is outside {@code [0, LAST]}
     */
    public static SyntaxKind fromRaw(int raw) {
        Verify.verify(raw >= 0 && raw <= LAST, "corrupted syntax tree: kind tag %s is outside [0, %s]", raw, LAST);
        return VALUES[raw];
    }

    public boolean isToken() {
        return ordinal() < NODE_APPLY.ordinal();
    }

    public boolean isNode() {
        return !isToken();
    }

    public boolean isTrivia() {
        return this == TOKEN_COMMENT || this == TOKEN_WHITESPACE;
    }

    public boolean isKeyword() {
        return ordinal() >= TOKEN_ASSERT.ordinal() && ordinal() <= TOKEN_WITH.ordinal();
    }

    /**
     * Tokens that form a {@link #NODE_LITERAL} on their own.
     */
    public boolean isLiteral() {
        return this == TOKEN_FLOAT || this == TOKEN_INTEGER || this == TOKEN_URI;
    }

    /**
     * Tokens that may start an argument of a function application.
     */
    public boolean isFnArg() {
        return switch (this) {
            case TOKEN_REC, TOKEN_L_BRACE, TOKEN_L_BRACK, TOKEN_L_PAREN,
                 TOKEN_STRING_START, TOKEN_IDENT, TOKEN_OR, TOKEN_PATH -> true;
            default -> isLiteral();
        };
    }
}
