package org.pragmatica.minipeg.parser;

/**
 * Parser configuration options.
 *
 * @param packratEnabled   memoize named rule results per input position
 * @param requireFullInput treat a top-level match that leaves input unconsumed as a failure
 * @param maxDepth         maximum rule nesting depth, {@code 0} for unlimited
 */
public record ParserConfig(
    boolean packratEnabled,
    boolean requireFullInput,
    int maxDepth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        false,
        false,
        0
    );

    public ParserConfig {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
    }

    public boolean hasDepthLimit() {
        return maxDepth > 0;
    }
}
