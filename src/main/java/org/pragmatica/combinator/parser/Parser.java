package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.tree.Node;

import java.util.function.Consumer;

/**
 * A parser reads from the shared {@link ParseState} and writes what it matched into the given node.
 *
 * <p>Contract for every implementation:
 * <ul>
 *   <li>on success the cursor is advanced past the consumed text, the node holds the match
 *   and the state carries no error;</li>
 *   <li>on failure the state carries a {@link org.pragmatica.combinator.error.ParseError.MatchError}
 *   and the node content is meaningless.</li>
 * </ul>
 * Failures are state, never exceptions: callers check {@link ParseState#errored()} after each call.
 */
@FunctionalInterface
public interface Parser {

    void parse(ParseState state, Node node);

    /**
     * Invoke the action with the populated node when this parser matches.
     * The action may replace the node's value or token.
     */
    default Parser map(Consumer<Node> action) {
        var self = this;
        return (state, node) -> {
            self.parse(state, node);
            if (state.errored()) {
                return;
            }
            action.accept(node);
        };
    }

    /**
     * Attach a name used for tracing.
     */
    static Parser named(String name, Parser body) {
        return (state, node) -> state.invoke(name, body, node);
    }
}
