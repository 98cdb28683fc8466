package org.pragmatica.nix.error;

/**
 * Thrown by callers that treat any syntax error as failure; carries the first error found.
 */
public final class ParseException extends Exception {
    private final transient ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
