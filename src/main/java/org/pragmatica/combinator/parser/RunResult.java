package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.error.ParseException;
import org.pragmatica.combinator.tree.Node;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a whole-input parse run.
 */
public sealed interface RunResult {

    /**
     * Root node written by the grammar. Meaningless when the grammar itself failed to match.
     */
    Node node();

    /**
     * Cursor state at the end of the run.
     */
    ParseState state();

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    Optional<ParseError> error();

    /**
     * Semantic value of the root node, or {@code null} if none was attached.
     */
    default Object value() {
        return node().value();
    }

    /**
     * Input left unconsumed at the end of the run.
     */
    default String leftover() {
        return state().remaining();
    }

    /**
     * Root node of a successful run.
     *
     * @throws ParseException if the run failed
     */
    default Node unwrap() {
        return fold(error -> {
                        throw new ParseException(error);
                    },
                    node -> node);
    }

    <R> R fold(Function<? super ParseError, ? extends R> onFailure, Function<? super Node, ? extends R> onSuccess);

    static RunResult success(Node node, ParseState state) {
        return new Success(node, state);
    }

    static RunResult failure(Node node, ParseState state, ParseError error) {
        return new Failure(node, state, error);
    }

    record Success(Node node, ParseState state) implements RunResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.empty();
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super Node, ? extends R> onSuccess) {
            return onSuccess.apply(node);
        }
    }

    record Failure(Node node, ParseState state, ParseError cause) implements RunResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.of(cause);
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super Node, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
