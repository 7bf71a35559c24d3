package org.pragmatica.minipeg.tree;

/**
 * Human-readable renderings of an AST.
 */
public final class AstPrinter {
    private static final int INDENT = 4;

    private AstPrinter() {}

    /**
     * Multi-line depth-first dump: each named node as {@code name:} with its children indented
     * one level further, terminals as quoted text.
     *
     * <pre>
     * expr:
     *     term:
     *         number: "3"
     *         "*"
     * </pre>
     */
    public static String dump(AstNode node) {
        var sb = new StringBuilder();
        dump(node, 0, sb);
        return sb.toString();
    }

    /**
     * Single-line rendering, e.g. {@code expr{ term{ number:"3" }, "-", term{ number:"4" } }}.
     */
    public static String compact(AstNode node) {
        var sb = new StringBuilder();
        compact(node, sb);
        return sb.toString();
    }

    private static void dump(AstNode node, int level, StringBuilder sb) {
        sb.append(" ".repeat(level));
        if (node instanceof AstNode.Terminal terminal) {
            if (!terminal.isAnonymous()) {
                sb.append(terminal.rule()).append(": ");
            }
            sb.append(quote(terminal.text())).append('\n');
        } else if (node instanceof AstNode.NonTerminal nonTerminal) {
            sb.append(nonTerminal.rule()).append(":\n");
            for (var child : nonTerminal.children()) {
                dump(child, level + INDENT, sb);
            }
        }
    }

    private static void compact(AstNode node, StringBuilder sb) {
        if (node instanceof AstNode.Terminal terminal) {
            if (!terminal.isAnonymous()) {
                sb.append(terminal.rule()).append(':');
            }
            sb.append(quote(terminal.text()));
        } else if (node instanceof AstNode.NonTerminal nonTerminal) {
            sb.append(nonTerminal.rule()).append('{');
            var children = nonTerminal.children();
            for (int i = 0; i < children.size(); i++) {
                sb.append(i == 0 ? " " : ", ");
                compact(children.get(i), sb);
            }
            sb.append(children.isEmpty() ? "}" : " }");
        }
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\")
                         .replace("\"", "\\\"")
                         .replace("\n", "\\n") + '"';
    }
}
