package org.pragmatica.minipeg.tree;

/**
 * A range of input units from start (inclusive) to end (exclusive).
 * Units are characters for text input and tokens for token input.
 */
public record Span(int start, int end) {
    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span " + start + "-" + end);
        }
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    public static Span at(int position) {
        return new Span(position, position);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public String extract(String source) {
        return source.substring(start, end);
    }

    public Span merge(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
