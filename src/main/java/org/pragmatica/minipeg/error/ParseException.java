package org.pragmatica.minipeg.error;

import java.util.Objects;

/**
 * Raised when parsing is aborted: undefined rule, failed required rule or recursion limit.
 * Ordinary mismatches never raise this exception.
 */
public class ParseException extends RuntimeException {

    private final ParseError error;

    public ParseException(ParseError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
