package org.pragmatica.minipeg.tree;

import java.util.List;
import java.util.Objects;

/**
 * Abstract Syntax Tree node produced by a successful parse.
 */
public sealed interface AstNode {
    /**
     * Name of the rule that produced this node, empty for text captured by an anonymous terminal.
     */
    String rule();

    /**
     * Range of input covered by this node.
     */
    Span span();

    default boolean isAnonymous() {
        return rule().isEmpty();
    }

    /**
     * Terminal AST node - a leaf with captured text.
     */
    record Terminal(String rule, String text, Span span) implements AstNode {
        public Terminal {
            Objects.requireNonNull(rule, "rule");
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(span, "span");
        }

        public static Terminal anonymous(String text, Span span) {
            return new Terminal("", text, span);
        }

        public Terminal withRule(String name) {
            return new Terminal(name, text, span);
        }
    }

    /**
     * Non-terminal AST node - a named rule match with its children.
     */
    record NonTerminal(String rule, List<AstNode> children, Span span) implements AstNode {
        public NonTerminal {
            Objects.requireNonNull(rule, "rule");
            Objects.requireNonNull(span, "span");
            children = List.copyOf(children);
        }

        public AstNode child(int index) {
            return children.get(index);
        }

        public int size() {
            return children.size();
        }
    }
}
