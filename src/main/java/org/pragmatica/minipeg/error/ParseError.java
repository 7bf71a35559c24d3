package org.pragmatica.minipeg.error;

import java.util.Optional;

/**
 * Parse error with location and context information.
 *
 * <p>{@link NoMatch} is the ordinary outcome of input that does not conform to the grammar
 * and is returned as a value. The other variants abort the parse and surface as
 * {@link ParseException}.
 */
public sealed interface ParseError {

    String message();

    /**
     * Input does not match. Recoverable by enclosing alternatives.
     */
    record NoMatch(int position, String location, String expected) implements ParseError {
        @Override
        public String message() {
            return "No match at " + location + ", expected " + expected;
        }
    }

    /**
     * Reference to a rule that was never defined - the grammar is malformed.
     */
    record UndefinedRule(String ruleName) implements ParseError {
        @Override
        public String message() {
            return "Undefined rule: '" + ruleName + "'";
        }
    }

    /**
     * A rule or expression marked as required failed to match.
     */
    record RuleFailed(String errorCode, Optional<String> ruleName, int position, String location) implements ParseError {
        @Override
        public String message() {
            return ruleName.map(name -> "Required rule '" + name + "' failed")
                           .orElse("Required expression failed")
                   + " at " + location + " [" + errorCode + "]";
        }
    }

    /**
     * Rule nesting exceeded the configured maximum depth.
     */
    record RecursionLimit(int maxDepth, String ruleName, int position, String location) implements ParseError {
        @Override
        public String message() {
            return "Recursion limit of " + maxDepth + " exceeded in rule '" + ruleName + "' at " + location;
        }
    }
}
