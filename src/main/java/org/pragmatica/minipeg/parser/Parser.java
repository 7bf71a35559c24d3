package org.pragmatica.minipeg.parser;

import org.pragmatica.minipeg.grammar.Grammar;

import java.util.List;

/**
 * Parser interface - parses input according to a grammar.
 *
 * <p>A mismatch is reported as {@link ParseOutcome.Failure}. An undefined rule, a failed
 * required rule or an exceeded depth limit abort the parse with
 * {@link org.pragmatica.minipeg.error.ParseException}.
 */
public interface Parser {

    /**
     * Parse from the grammar's start rule.
     */
    ParseOutcome parse(ParseState state);

    /**
     * Parse starting from a specific rule.
     */
    ParseOutcome parse(ParseState state, String startRule);

    /**
     * Parse raw text from the grammar's start rule.
     */
    default ParseOutcome parseText(String input) {
        return parse(TextState.of(input));
    }

    /**
     * Parse a token stream from the grammar's start rule.
     */
    default ParseOutcome parseTokens(List<Token> tokens) {
        return parse(TokenState.of(tokens));
    }

    Grammar grammar();

    ParserConfig config();
}
