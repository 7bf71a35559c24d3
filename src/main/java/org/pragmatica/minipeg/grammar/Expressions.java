package org.pragmatica.minipeg.grammar;

import org.pragmatica.minipeg.parser.Token;

import java.util.List;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Builder functions for grammar expressions.
 *
 * <p>EBNF equivalents:
 * <ul>
 *   <li>{@code A B C} - {@link #sequence(Expression...)}</li>
 *   <li>{@code A | B | C} - {@link #choice(Expression...)}</li>
 *   <li>{@code [A]} - {@link #optional(Expression)}</li>
 *   <li>{@code {A}} - {@link #zeroOrMore(Expression)}, same as {@code repeat(A, 0)}</li>
 *   <li>{@code 'text'} - {@link #literal(String)}</li>
 *   <li>regular expression - {@link #regex(String)}</li>
 * </ul>
 *
 * <p>Example:
 * <pre>{@code
 * var grammar = Grammar.create()
 *     .define("expr", sequence(ref("term"), zeroOrMore(sequence(choice(literal("+"), literal("-")), ref("term")))))
 *     .define("term", sequence(ref("number"), zeroOrMore(sequence(choice(literal("*"), literal("/")), ref("number")))))
 *     .define("number", regex("[0-9]+"));
 * }</pre>
 */
public final class Expressions {
    private Expressions() {}

    // === Terminals ===

    public static Expression literal(String text) {
        return new Expression.Literal(text);
    }

    public static Expression regex(String pattern) {
        return new Expression.Regex(Pattern.compile(pattern));
    }

    public static Expression regex(Pattern pattern) {
        return new Expression.Regex(pattern);
    }

    /**
     * Single character satisfying {@code test}. Never matches a token.
     */
    public static Expression character(String description, IntPredicate test) {
        Objects.requireNonNull(test, "test");
        return new Expression.Predicate(description, unit -> unit instanceof Character c && test.test(c));
    }

    /**
     * Single token satisfying {@code test}. Never matches a character.
     */
    public static Expression token(String description, Predicate<Token> test) {
        Objects.requireNonNull(test, "test");
        return new Expression.Predicate(description, unit -> unit instanceof Token t && test.test(t));
    }

    public static Expression tokenOfKind(String kind) {
        return token("token of kind '" + kind + "'", t -> t.kind().equals(kind));
    }

    public static Expression tokenNotOfKind(String kind) {
        return token("token not of kind '" + kind + "'", t -> !t.kind().equals(kind));
    }

    public static Expression ref(String ruleName) {
        return new Expression.Reference(ruleName);
    }

    // === Combinators ===

    public static Expression sequence(Expression... elements) {
        return new Expression.Sequence(List.of(elements));
    }

    public static Expression sequence(List<Expression> elements) {
        return new Expression.Sequence(elements);
    }

    public static Expression choice(Expression... alternatives) {
        return new Expression.Choice(List.of(alternatives));
    }

    public static Expression choice(List<Expression> alternatives) {
        return new Expression.Choice(alternatives);
    }

    public static Expression optional(Expression expression) {
        return new Expression.Optional(expression);
    }

    public static Expression repeat(Expression expression, int min) {
        return new Expression.Repetition(expression, min);
    }

    public static Expression zeroOrMore(Expression expression) {
        return repeat(expression, 0);
    }

    public static Expression oneOrMore(Expression expression) {
        return repeat(expression, 1);
    }

    // === Special ===

    public static Expression required(Expression expression, String errorCode) {
        return new Expression.Required(expression, errorCode);
    }

    public static Expression ignore(Expression expression) {
        return new Expression.Ignore(expression);
    }
}
