package org.pragmatica.minipeg.parser;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parse state over a pre-tokenized input. Input units are {@link Token}s, and every
 * terminal consumes exactly one token, capturing its value.
 */
public final class TokenState extends ParseState {

    private final List<Token> tokens;

    private TokenState(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static TokenState of(List<Token> tokens) {
        return new TokenState(List.copyOf(tokens));
    }

    public List<Token> tokens() {
        return tokens;
    }

    public Optional<Token> current() {
        return isAtEnd()
               ? Optional.empty()
               : Optional.of(tokens.get(position()));
    }

    @Override
    public int length() {
        return tokens.size();
    }

    @Override
    public String describe(int position) {
        if (position >= tokens.size()) {
            return "token " + position + " (end of input)";
        }
        return "token " + position + " " + tokens.get(position);
    }

    @Override
    Optional<String> matchLiteral(String text) {
        return current().filter(token -> token.value().startsWith(text))
                        .map(this::consume);
    }

    @Override
    Optional<String> matchRegex(Pattern pattern) {
        return current().filter(token -> {
                            var matcher = pattern.matcher(token.value());
                            return matcher.lookingAt() && matcher.end() > 0;
                        })
                        .map(this::consume);
    }

    @Override
    Optional<String> matchUnit(java.util.function.Predicate<Object> test) {
        return current().filter(test::test)
                        .map(this::consume);
    }

    @Override
    void skip(Pattern whitespace) {
        // Token streams carry no inter-token whitespace
    }

    private String consume(Token token) {
        advance(1);
        return token.value();
    }

    @Override
    public String toString() {
        return "TokenState[" + describe(position()) + "]";
    }
}
