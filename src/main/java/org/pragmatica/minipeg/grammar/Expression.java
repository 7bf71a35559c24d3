package org.pragmatica.minipeg.grammar;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * PEG expression types - the building blocks of grammar rules.
 *
 * <p>Expressions are immutable trees. Use {@link Expressions} to build them.
 */
public sealed interface Expression {

    // === Terminals ===

    /**
     * Literal string match: 'text'
     */
    record Literal(String text) implements Expression {
        public Literal {
            Objects.requireNonNull(text, "text");
            if (text.isEmpty()) {
                throw new IllegalArgumentException("Literal text must not be empty");
            }
        }
    }

    /**
     * Regular expression match, anchored at the current position.
     */
    record Regex(Pattern pattern) implements Expression {
        public Regex {
            Objects.requireNonNull(pattern, "pattern");
        }
    }

    /**
     * Arbitrary test over the current input unit: a {@link Character} for text input,
     * a {@link org.pragmatica.minipeg.parser.Token} for token input.
     */
    record Predicate(String description, java.util.function.Predicate<Object> test) implements Expression {
        public Predicate {
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(test, "test");
        }
    }

    /**
     * Rule reference: name, resolved when evaluated.
     */
    record Reference(String ruleName) implements Expression {
        public Reference {
            Objects.requireNonNull(ruleName, "ruleName");
        }
    }

    // === Combinators ===

    /**
     * Sequence: e1 e2 e3
     */
    record Sequence(List<Expression> elements) implements Expression {
        public Sequence {
            elements = checkedChildren(elements, "Sequence");
        }
    }

    /**
     * Ordered choice: e1 | e2 | e3
     */
    record Choice(List<Expression> alternatives) implements Expression {
        public Choice {
            alternatives = checkedChildren(alternatives, "Choice");
        }
    }

    /**
     * Optional: [e]
     */
    record Optional(Expression expression) implements Expression {
        public Optional {
            Objects.requireNonNull(expression, "expression");
        }
    }

    /**
     * Repetition with lower bound: e repeated at least {@code min} times.
     */
    record Repetition(Expression expression, int min) implements Expression {
        public Repetition {
            Objects.requireNonNull(expression, "expression");
            if (min < 0) {
                throw new IllegalArgumentException("Repetition minimum must not be negative: " + min);
            }
        }
    }

    // === Special ===

    /**
     * Must match: failure of the inner expression aborts the parse with {@code errorCode}.
     */
    record Required(Expression expression, String errorCode) implements Expression {
        public Required {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(errorCode, "errorCode");
        }
    }

    /**
     * Ignore: matches the inner expression but keeps nothing of it in the tree.
     */
    record Ignore(Expression expression) implements Expression {
        public Ignore {
            Objects.requireNonNull(expression, "expression");
        }
    }

    private static List<Expression> checkedChildren(List<Expression> children, String kind) {
        Objects.requireNonNull(children, kind + " children");
        if (children.isEmpty()) {
            throw new IllegalArgumentException(kind + " requires at least one child");
        }
        for (var child : children) {
            Objects.requireNonNull(child, kind + " child");
        }
        return List.copyOf(children);
    }
}
