package org.pragmatica.minipeg.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.minipeg.parser.Token;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.minipeg.grammar.Expressions.*;

class ExpressionsTest {

    // === Validation ===

    @Test
    void literal_rejectsEmptyText() {
        assertThrows(IllegalArgumentException.class, () -> literal(""));
        assertThrows(NullPointerException.class, () -> literal(null));
    }

    @Test
    void regex_rejectsInvalidPattern() {
        assertThrows(java.util.regex.PatternSyntaxException.class, () -> regex("[a-"));
    }

    @Test
    void repeat_rejectsNegativeMinimum() {
        var exception = assertThrows(IllegalArgumentException.class, () -> repeat(literal("a"), -1));

        assertTrue(exception.getMessage().contains("-1"));
    }

    @Test
    void sequenceAndChoice_rejectEmptyChildList() {
        assertThrows(IllegalArgumentException.class, () -> sequence());
        assertThrows(IllegalArgumentException.class, () -> choice(List.of()));
    }

    @Test
    void combinators_rejectNullChildren() {
        assertThrows(NullPointerException.class, () -> sequence(literal("a"), null));
        assertThrows(NullPointerException.class, () -> optional(null));
        assertThrows(NullPointerException.class, () -> ignore(null));
        assertThrows(NullPointerException.class, () -> required(literal("a"), null));
    }

    @Test
    void sequence_copiesChildList() {
        var elements = new ArrayList<Expression>(List.of(literal("a")));
        var sequence = (Expression.Sequence) sequence(elements);

        elements.add(literal("b"));

        assertEquals(1, sequence.elements().size());
    }

    // === EBNF Forms ===

    @Test
    void zeroOrMoreAndOneOrMore_areRepetitionsWithMinimum() {
        var a = literal("a");

        assertEquals(new Expression.Repetition(a, 0), zeroOrMore(a));
        assertEquals(new Expression.Repetition(a, 1), oneOrMore(a));
    }

    @Test
    void ref_holdsOnlyTheName() {
        assertEquals(new Expression.Reference("Later"), ref("Later"));
    }

    // === Unit Predicates ===

    @Test
    void character_acceptsOnlyMatchingCharacters() {
        var digit = (Expression.Predicate) character("digit", Character::isDigit);

        assertTrue(digit.test().test('7'));
        assertFalse(digit.test().test('x'));
        assertFalse(digit.test().test(Token.of("number", "7")));
        assertEquals("digit", digit.description());
    }

    @Test
    void tokenOfKind_acceptsOnlyTokensOfThatKind() {
        var blank = (Expression.Predicate) tokenOfKind("blank");

        assertTrue(blank.test().test(Token.of("blank", "")));
        assertFalse(blank.test().test(Token.of("normal", "text")));
        assertFalse(blank.test().test(' '));
    }

    @Test
    void tokenNotOfKind_acceptsTokensOfOtherKinds() {
        var notFence = (Expression.Predicate) tokenNotOfKind("fence");

        assertTrue(notFence.test().test(Token.of("normal", "text")));
        assertFalse(notFence.test().test(Token.of("fence", "```")));
    }
}
