package org.pragmatica.minipeg.parser;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parse state over raw text. Input units are characters.
 */
public final class TextState extends ParseState {

    private final String input;

    private TextState(String input) {
        this.input = input;
    }

    public static TextState of(String input) {
        return new TextState(Objects.requireNonNull(input, "input"));
    }

    public String input() {
        return input;
    }

    public String remainingInput() {
        return input.substring(position());
    }

    @Override
    public int length() {
        return input.length();
    }

    /**
     * Position as 1-based {@code line:column}.
     */
    @Override
    public String describe(int position) {
        int line = 1;
        int column = 1;
        int end = Math.min(position, input.length());
        for (int i = 0; i < end; i++) {
            if (input.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return line + ":" + column;
    }

    @Override
    Optional<String> matchLiteral(String text) {
        if (!input.startsWith(text, position())) {
            return Optional.empty();
        }
        advance(text.length());
        return Optional.of(text);
    }

    @Override
    Optional<String> matchRegex(Pattern pattern) {
        if (isAtEnd()) {
            return Optional.empty();
        }
        var matcher = pattern.matcher(input)
                             .region(position(), input.length())
                             .useTransparentBounds(true);
        // A terminal must consume input; an empty match counts as no match
        if (!matcher.lookingAt() || matcher.end() == matcher.start()) {
            return Optional.empty();
        }
        var text = matcher.group();
        advance(text.length());
        return Optional.of(text);
    }

    @Override
    Optional<String> matchUnit(java.util.function.Predicate<Object> test) {
        if (isAtEnd()) {
            return Optional.empty();
        }
        char c = input.charAt(position());
        if (!test.test(c)) {
            return Optional.empty();
        }
        advance(1);
        return Optional.of(String.valueOf(c));
    }

    @Override
    void skip(Pattern whitespace) {
        if (isAtEnd()) {
            return;
        }
        var matcher = whitespace.matcher(input)
                                .region(position(), input.length());
        if (matcher.lookingAt()) {
            setPosition(matcher.end());
        }
    }

    @Override
    public String toString() {
        return "TextState[" + describe(position()) + "]";
    }
}
