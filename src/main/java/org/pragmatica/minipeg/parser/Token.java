package org.pragmatica.minipeg.parser;

import java.util.Objects;

/**
 * A pre-classified input unit: the kind assigned by a tokenizer and the raw text.
 */
public record Token(String kind, String value) {
    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }

    public static Token of(String kind, String value) {
        return new Token(kind, value);
    }

    public boolean is(String kind) {
        return this.kind.equals(kind);
    }

    @Override
    public String toString() {
        return kind + "'" + value + "'";
    }
}
