package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError.UnparsedInputError;
import org.pragmatica.combinator.tree.Node;

/**
 * Runs a grammar against a whole input.
 */
public final class ParseRunner {
    private ParseRunner() {}

    public static RunResult run(Object grammar, String input) {
        return run(grammar, input, RunConfig.DEFAULT);
    }

    /**
     * Parse the input and require that the grammar consumes all of it.
     * A grammar mismatch is reported as a {@code MatchError}, trailing input
     * (after skipping whitespace) as an {@link UnparsedInputError}.
     */
    public static RunResult run(Object grammar, String input, RunConfig config) {
        var parser = Parsify.parsify(grammar);
        var state = ParseState.create(input, config);
        var root = new Node();

        state.skipWhitespace();
        parser.parse(state, root);

        if (state.errored()) {
            return RunResult.failure(root, state, state.error());
        }

        state.skipWhitespace();

        if (!state.isAtEnd()) {
            return RunResult.failure(root, state, new UnparsedInputError(state.remaining()));
        }
        return RunResult.success(root, state);
    }
}
