package org.pragmatica.minipeg.examples;

import org.junit.jupiter.api.Test;
import org.pragmatica.minipeg.MiniPeg;
import org.pragmatica.minipeg.error.ParseError;
import org.pragmatica.minipeg.error.ParseException;
import org.pragmatica.minipeg.grammar.Grammar;
import org.pragmatica.minipeg.tree.AstNode;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.minipeg.grammar.Expressions.*;
import static org.pragmatica.minipeg.tree.AstPrinter.compact;
import static org.pragmatica.minipeg.tree.AstPrinter.dump;

/**
 * Arithmetic expressions: operator precedence through rule layering, right-associative
 * power, brackets with a mandatory closing parenthesis.
 */
class ArithmeticGrammarTest {

    private static Grammar simpleGrammar() {
        return Grammar.create()
                      .define("expr", sequence(ref("term"), zeroOrMore(sequence(choice(literal("+"), literal("-")), ref("term")))))
                      .define("term", sequence(ref("number"), zeroOrMore(sequence(choice(literal("*"), literal("/")), ref("number")))))
                      .define("number", regex("[0-9]+"));
    }

    private static Grammar calculatorGrammar() {
        return Grammar.create()
                      .define("expr", sequence(ref("term"), zeroOrMore(sequence(ref("add_op"), ref("term")))))
                      .define("add_op", choice(literal("+"), literal("-")))
                      .define("term", sequence(ref("factor"), zeroOrMore(sequence(ref("mul_op"), ref("factor")))))
                      .define("mul_op", choice(literal("*"), literal("/")))
                      .define("factor", choice(ref("power"), ref("number"), ref("bracket")))
                      .define("power", sequence(ref("number"), literal("^"), ref("factor")))
                      .define("number", regex("[0-9]+"))
                      .define("bracket", sequence(literal("("), ref("expr"), required(literal(")"), "unclosed-bracket")))
                      .whitespace(" *");
    }

    /**
     * Integer evaluation straight from the tree, operators applied left to right.
     */
    private static long evaluate(AstNode node) {
        return switch (node.rule()) {
            case "number" -> Long.parseLong(((AstNode.Terminal) node).text());
            case "factor" -> evaluate(((AstNode.NonTerminal) node).child(0));
            case "bracket" -> evaluate(((AstNode.NonTerminal) node).child(1));
            case "power" -> {
                var power = (AstNode.NonTerminal) node;
                long base = evaluate(power.child(0));
                long exponent = evaluate(power.child(2));
                long result = 1;
                for (long i = 0; i < exponent; i++) {
                    result *= base;
                }
                yield result;
            }
            case "expr", "term" -> {
                var chain = (AstNode.NonTerminal) node;
                long value = evaluate(chain.child(0));
                for (int i = 1; i < chain.size(); i += 2) {
                    var operator = ((AstNode.Terminal) chain.child(i)).text();
                    long operand = evaluate(chain.child(i + 1));
                    value = switch (operator) {
                        case "+" -> value + operand;
                        case "-" -> value - operand;
                        case "*" -> value * operand;
                        case "/" -> value / operand;
                        default -> throw new IllegalArgumentException("Unknown operator " + operator);
                    };
                }
                yield value;
            }
            default -> throw new IllegalArgumentException("Unexpected node " + node.rule());
        };
    }

    // === Layered Rules ===

    @Test
    void simpleGrammar_buildsPrecedenceTree() {
        var node = MiniPeg.parser(simpleGrammar()).parseText("3*7-4").unwrap();

        assertEquals("expr{ term{ number:\"3\", \"*\", number:\"7\" }, \"-\", term{ number:\"4\" } }", compact(node));
    }

    @Test
    void simpleGrammar_dumpsIndentedTree() {
        var node = MiniPeg.parser(simpleGrammar()).parseText("3*7-4").unwrap();

        assertEquals("""
                     expr:
                         term:
                             number: "3"
                             "*"
                             number: "7"
                         "-"
                         term:
                             number: "4"
                     """, dump(node));
    }

    @Test
    void simpleGrammar_reparsingGivesIdenticalTree() {
        var parser = MiniPeg.parser(simpleGrammar());
        var first = parser.parseText("3*7-4").unwrap();

        for (int i = 0; i < 5; i++) {
            assertEquals(first, parser.parseText("3*7-4").unwrap());
        }
    }

    // === Calculator ===

    @Test
    void calculator_parsesBracketsAndPowers() {
        var node = MiniPeg.parser(calculatorGrammar()).parseText("  (1+345^2) / 3*7-4").unwrap();

        assertEquals("expr{ term{ factor{ bracket{ \"(\", expr{ term{ factor{ number:\"1\" } }, add_op:\"+\", "
                     + "term{ factor{ power{ number:\"345\", \"^\", factor{ number:\"2\" } } } } }, \")\" } }, "
                     + "mul_op:\"/\", factor{ number:\"3\" }, mul_op:\"*\", factor{ number:\"7\" } }, "
                     + "add_op:\"-\", term{ factor{ number:\"4\" } } }",
                     compact(node));
    }

    @Test
    void calculator_treeEvaluates() {
        var parser = MiniPeg.parser(calculatorGrammar());

        assertEquals(277721, evaluate(parser.parseText("  (1+345^2) / 3*7-4").unwrap()));
        assertEquals(512, evaluate(parser.parseText("2^3^2").unwrap()));
        assertEquals(-5, evaluate(parser.parseText("1 - (2 + 4)").unwrap()));
    }

    @Test
    void calculator_packratGivesSameTree() {
        var input = "((2^2)*(3+4)) - 10/5";
        var plain = MiniPeg.parser(calculatorGrammar()).parseText(input).unwrap();
        var memoized = MiniPeg.builder(calculatorGrammar())
                              .packrat(true)
                              .build()
                              .parseText(input)
                              .unwrap();

        assertEquals(plain, memoized);
        assertEquals(26, evaluate(memoized));
    }

    @Test
    void calculator_unclosedBracket_abortsWithErrorCode() {
        var parser = MiniPeg.parser(calculatorGrammar());

        var exception = assertThrows(ParseException.class, () -> parser.parseText("(1+2"));

        var error = assertInstanceOf(ParseError.RuleFailed.class, exception.error());
        assertEquals("unclosed-bracket", error.errorCode());
        assertEquals(4, error.position());
        assertEquals("1:5", error.location());
    }

    @Test
    void calculator_danglingOperator_isOrdinaryFailureUnderFullInput() {
        var parser = MiniPeg.builder(calculatorGrammar())
                            .requireFullInput(true)
                            .build();

        var outcome = parser.parseText("1 +");

        assertTrue(outcome.isFailure());
        assertTrue(parser.parseText("1 + 2").isSuccess());
    }
}
