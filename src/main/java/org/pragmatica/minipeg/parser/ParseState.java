package org.pragmatica.minipeg.parser;

import org.pragmatica.minipeg.tree.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Mutable parsing state: input, current position and the accumulated AST.
 *
 * <p>A state belongs to one parse at a time and is not synchronized. The engine takes a
 * {@link Checkpoint} before every attempt and restores it when the attempt fails, so a
 * failed attempt leaves position and AST exactly as they were.
 */
public abstract sealed class ParseState permits TextState, TokenState {

    private final List<AstNode> ast = new ArrayList<>();
    private final Map<Long, Memo> memo = new HashMap<>();
    private final Map<String, Integer> ruleIds = new HashMap<>();

    private int pos;
    private int depth;
    private int furthestPos;
    private String furthestExpected = "";

    /**
     * Snapshot of position and AST size.
     */
    public record Checkpoint(int position, int astSize) {}

    record Memo(boolean matched, int end, Optional<AstNode> node) {}

    // === Input ===

    /**
     * Number of input units: characters or tokens.
     */
    public abstract int length();

    /**
     * Human-readable description of an input position.
     */
    public abstract String describe(int position);

    abstract Optional<String> matchLiteral(String text);

    abstract Optional<String> matchRegex(Pattern pattern);

    abstract Optional<String> matchUnit(java.util.function.Predicate<Object> test);

    abstract void skip(Pattern whitespace);

    // === Position Management ===

    public int position() {
        return pos;
    }

    public boolean isAtEnd() {
        return pos >= length();
    }

    public int remaining() {
        return length() - pos;
    }

    void advance(int units) {
        pos += units;
    }

    void setPosition(int position) {
        this.pos = position;
    }

    // === Backtracking ===

    public Checkpoint checkpoint() {
        return new Checkpoint(pos, ast.size());
    }

    public void restore(Checkpoint checkpoint) {
        pos = checkpoint.position();
        truncate(checkpoint.astSize());
    }

    // === AST Accumulator ===

    /**
     * Accumulated nodes, oldest first.
     */
    public List<AstNode> ast() {
        return Collections.unmodifiableList(ast);
    }

    /**
     * Most recently produced node, the root after a successful top-level parse.
     */
    public Optional<AstNode> lastNode() {
        return ast.isEmpty()
               ? Optional.empty()
               : Optional.of(ast.get(ast.size() - 1));
    }

    void push(AstNode node) {
        ast.add(node);
    }

    /**
     * Remove and return the nodes added since the accumulator had {@code size} entries.
     */
    List<AstNode> takeFrom(int size) {
        var tail = ast.subList(size, ast.size());
        var taken = List.copyOf(tail);
        tail.clear();
        return taken;
    }

    void truncate(int size) {
        if (size < ast.size()) {
            ast.subList(size, ast.size())
               .clear();
        }
    }

    // === Error Tracking ===

    void updateFurthest(String expected) {
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestExpected = expected;
        } else if (pos == furthestPos && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                               ? expected
                               : furthestExpected + " or " + expected;
        }
    }

    public int furthestPosition() {
        return furthestPos;
    }

    public String furthestExpected() {
        return furthestExpected;
    }

    // === Rule Nesting ===

    int enterRule() {
        return ++depth;
    }

    void exitRule() {
        depth--;
    }

    int depth() {
        return depth;
    }

    // === Packrat Cache ===

    Optional<Memo> memoAt(String ruleName, int position) {
        return Optional.ofNullable(memo.get(memoKey(ruleName, position)));
    }

    void memoize(String ruleName, int position, Memo entry) {
        memo.put(memoKey(ruleName, position), entry);
    }

    private long memoKey(String ruleName, int position) {
        int ruleId = ruleIds.computeIfAbsent(ruleName, k -> ruleIds.size());
        return ((long) ruleId << 32) | (position & 0xFFFFFFFFL);
    }

    /**
     * Reset per-invocation bookkeeping. Position and AST are left as they are.
     */
    void beginParse() {
        memo.clear();
        ruleIds.clear();
        depth = 0;
        furthestPos = pos;
        furthestExpected = "";
    }
}
