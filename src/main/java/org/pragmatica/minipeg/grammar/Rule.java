package org.pragmatica.minipeg.grammar;

import java.util.Objects;
import java.util.Optional;

/**
 * A grammar rule: name = expression, optionally fatal on failure with an error code.
 */
public record Rule(String name, Expression expression, Optional<String> errorCode) {
    public Rule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(errorCode, "errorCode");
    }

    public static Rule rule(String name, Expression expression) {
        return new Rule(name, expression, Optional.empty());
    }

    public static Rule required(String name, Expression expression, String errorCode) {
        return new Rule(name, expression, Optional.of(errorCode));
    }

    public boolean isRequired() {
        return errorCode.isPresent();
    }
}
