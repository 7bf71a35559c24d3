package org.pragmatica.minipeg.parser;

import org.pragmatica.minipeg.error.ParseError;
import org.pragmatica.minipeg.tree.AstNode;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a top-level parse: the parsed state with its root node, or the reason of the mismatch.
 */
public sealed interface ParseOutcome {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Root node of the parse tree, if the parse succeeded.
     */
    Optional<AstNode> root();

    /**
     * Root node of the parse tree.
     *
     * @throws IllegalStateException if the parse failed
     */
    default AstNode unwrap() {
        return root().orElseThrow(() -> new IllegalStateException(
            "Parse failed: " + ((Failure) this).error().message()));
    }

    <T> T fold(Function<ParseError.NoMatch, T> onFailure, Function<AstNode, T> onSuccess);

    record Success(ParseState state, AstNode node) implements ParseOutcome {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<AstNode> root() {
            return Optional.of(node);
        }

        @Override
        public <T> T fold(Function<ParseError.NoMatch, T> onFailure, Function<AstNode, T> onSuccess) {
            return onSuccess.apply(node);
        }
    }

    record Failure(ParseError.NoMatch error) implements ParseOutcome {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<AstNode> root() {
            return Optional.empty();
        }

        @Override
        public <T> T fold(Function<ParseError.NoMatch, T> onFailure, Function<AstNode, T> onSuccess) {
            return onFailure.apply(error);
        }
    }
}
