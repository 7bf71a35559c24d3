package org.pragmatica.minipeg;

import org.pragmatica.minipeg.grammar.Grammar;
import org.pragmatica.minipeg.parser.Parser;
import org.pragmatica.minipeg.parser.ParserConfig;
import org.pragmatica.minipeg.parser.PegEngine;

/**
 * Entry point for creating PEG parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var grammar = Grammar.create()
 *     .define("list", sequence(ref("item"), zeroOrMore(sequence(literal(","), ref("item")))))
 *     .define("item", regex("[a-z]+"));
 *
 * var tree = MiniPeg.parser(grammar).parseText("a,b,c").unwrap();
 * }</pre>
 *
 * <p>The parser reads rules from the grammar as it goes, so rules defined after the
 * parser was created are visible to it.
 */
public final class MiniPeg {
    private MiniPeg() {}

    /**
     * Create a parser with default configuration.
     */
    public static Parser parser(Grammar grammar) {
        return parser(grammar, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser with custom configuration.
     */
    public static Parser parser(Grammar grammar, ParserConfig config) {
        return PegEngine.create(grammar, config);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder(Grammar grammar) {
        return new Builder(grammar);
    }

    public static final class Builder {
        private final Grammar grammar;
        private boolean packratEnabled = ParserConfig.DEFAULT.packratEnabled();
        private boolean requireFullInput = ParserConfig.DEFAULT.requireFullInput();
        private int maxDepth = ParserConfig.DEFAULT.maxDepth();

        private Builder(Grammar grammar) {
            this.grammar = grammar;
        }

        public Builder packrat(boolean enabled) {
            this.packratEnabled = enabled;
            return this;
        }

        public Builder requireFullInput(boolean required) {
            this.requireFullInput = required;
            return this;
        }

        public Builder maxDepth(int depth) {
            this.maxDepth = depth;
            return this;
        }

        public Parser build() {
            return parser(grammar, new ParserConfig(packratEnabled, requireFullInput, maxDepth));
        }
    }
}
