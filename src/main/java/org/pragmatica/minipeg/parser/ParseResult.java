package org.pragmatica.minipeg.parser;

import org.pragmatica.minipeg.error.ParseError;

/**
 * Result of evaluating an expression - success, ordinary failure or fatal failure.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Expression matched; the state now stands at {@code end}.
     */
    record Success(int end) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Failed parse - no match at current position. Enclosing alternatives may try again.
     */
    record Failure(int position, String expected) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        public static Failure at(int position, String expected) {
            return new Failure(position, expected);
        }
    }

    /**
     * Failure that must not be recovered by backtracking. Combinators pass it upwards
     * untouched and the parser raises it to the caller.
     */
    record Fatal(ParseError error) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
