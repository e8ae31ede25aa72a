package org.pragmatica.combinator;

import org.pragmatica.combinator.error.ParseError.MatchError;
import org.pragmatica.combinator.parser.ParseRunner;
import org.pragmatica.combinator.parser.ParseState;
import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.parser.RunConfig;
import org.pragmatica.combinator.parser.RunResult;
import org.pragmatica.combinator.parser.Whitespace;
import org.pragmatica.combinator.tree.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.pragmatica.combinator.parser.Parsify.parsify;
import static org.pragmatica.combinator.parser.Parsify.parsifyAll;

/**
 * Parser combinators.
 *
 * <p>Every parameter declared as {@code Object} accepts a "parserish" value: a {@link String}
 * (exact match) or a {@link Parser}.
 *
 * <p>Example usage:
 * <pre>{@code
 * var alpha = Literals.chars("a-z");
 * var tags = many(any(seq("<", cut(), alpha, ">"), alpha));
 *
 * var result = Combinators.run(tags, "asdf <foo>");
 * }</pre>
 */
public final class Combinators {
    static final String END_OF_INPUT = "end of input";

    private Combinators() {}

    // === Driver ===

    /**
     * Parse the whole input with the default configuration.
     */
    public static RunResult run(Object grammar, String input) {
        return ParseRunner.run(grammar, input);
    }

    public static RunResult run(Object grammar, String input, RunConfig config) {
        return ParseRunner.run(grammar, input, config);
    }

    // === Sequencing ===

    /**
     * Match all parsers in order. Child {@code i} holds the result of parser {@code i};
     * the token is the verbatim input span, interior whitespace included.
     */
    public static Parser seq(Object... parsers) {
        var parts = parsifyAll(parsers);

        return Parser.named("seq", (state, node) -> {
            int start = state.pos();
            var children = new ArrayList<Node>(parts.size());

            for (var part : parts) {
                var child = new Node();
                children.add(child);
                part.parse(state, child);
                if (state.errored()) {
                    state.setPos(start);
                    node.setChildren(children);
                    return;
                }
            }
            node.setChildren(children);
            node.setToken(state.substring(start, state.pos()));
        });
    }

    // === Alternation ===

    /**
     * First matching alternative wins. When all fail, the furthest failure among them is reported.
     */
    public static Parser any(Object... parsers) {
        var alternatives = alternatives(parsers);

        return Parser.named("any", (state, node) -> {
            int entry = state.pos();
            if (!prepareAlternation(state, entry)) {
                return;
            }
            int start = state.pos();
            var furthest = MatchError.NONE;

            for (var alternative : alternatives) {
                node.clear();
                alternative.parse(state, node);
                if (!state.errored()) {
                    return;
                }
                if (state.error().outranks(furthest)) {
                    furthest = state.error();
                }
                if (state.committedPast(start)) {
                    break;
                }
                state.recover();
                state.setPos(start);
            }
            state.fail(furthest);
            state.setPos(entry);
        });
    }

    /**
     * First matching alternative wins. When all fail, {@code name} is reported as expected
     * at the alternation start, unless a cut fired inside an alternative: that failure
     * is propagated unchanged.
     */
    public static Parser anyWithName(String name, Object... parsers) {
        var alternatives = alternatives(parsers);

        return Parser.named("anyWithName " + name, (state, node) -> {
            int entry = state.pos();
            if (!prepareAlternation(state, entry)) {
                return;
            }
            int start = state.pos();

            for (var alternative : alternatives) {
                node.clear();
                alternative.parse(state, node);
                if (!state.errored()) {
                    return;
                }
                if (state.committedPast(start)) {
                    state.setPos(entry);
                    return;
                }
                state.recover();
                state.setPos(start);
            }
            state.fail(MatchError.at(start, name));
            state.setPos(entry);
        });
    }

    /**
     * Try every alternative and keep the one which consumed the most input.
     * Ties keep the earliest listed alternative.
     */
    public static Parser longest(String name, Object... parsers) {
        var alternatives = alternatives(parsers);

        return Parser.named("longest " + name, (state, node) -> {
            int entry = state.pos();
            if (!prepareAlternation(state, entry)) {
                return;
            }
            int start = state.pos();
            Node best = null;
            int bestEnd = start;

            for (var alternative : alternatives) {
                var candidate = new Node();
                alternative.parse(state, candidate);
                if (state.errored()) {
                    if (state.committedPast(start)) {
                        break;
                    }
                    state.recover();
                    state.setPos(start);
                    continue;
                }
                if (state.pos() > bestEnd) {
                    best = candidate;
                    bestEnd = state.pos();
                }
                state.setPos(start);
            }

            if (best != null) {
                state.recover();
                state.setPos(bestEnd);
                node.copyFrom(best);
                return;
            }
            state.fail(MatchError.at(start, name));
            state.setPos(entry);
        });
    }

    private static List<Parser> alternatives(Object... parsers) {
        if (parsers.length == 0) {
            throw new IllegalArgumentException("Alternation requires at least one alternative");
        }
        return parsifyAll(parsers);
    }

    /**
     * Shared alternation preamble. Returns false when the alternation must not try any alternative:
     * either input is exhausted, or a cut already fired past the start position.
     */
    private static boolean prepareAlternation(ParseState state, int entry) {
        state.skipWhitespace();
        if (state.isAtEnd()) {
            state.errorHere(END_OF_INPUT);
            state.setPos(entry);
            return false;
        }
        if (state.committedPast(state.pos())) {
            state.setPos(entry);
            return false;
        }
        state.recover();
        return true;
    }

    // === Repetition ===

    /**
     * Zero or more matches, each added as a child.
     */
    public static Parser many(Object parser) {
        return repetition("many", 0, parser, null);
    }

    /**
     * Zero or more matches separated by {@code separator}. Separators are consumed but not
     * added as children; a trailing separator is accepted.
     */
    public static Parser many(Object parser, Object separator) {
        return repetition("many", 0, parser, parsify(separator));
    }

    /**
     * One or more matches, each added as a child.
     */
    public static Parser some(Object parser) {
        return repetition("some", 1, parser, null);
    }

    public static Parser some(Object parser, Object separator) {
        return repetition("some", 1, parser, parsify(separator));
    }

    private static Parser repetition(String name, int min, Object operand, Parser separator) {
        var element = parsify(operand);

        return Parser.named(name, (state, node) -> {
            int start = state.pos();
            var children = new ArrayList<Node>();

            while (true) {
                int iterationStart = state.pos();
                var child = new Node();
                element.parse(state, child);

                if (state.errored()) {
                    if (children.size() < min || state.committedPast(state.pos())) {
                        state.setPos(start);
                        node.setChildren(children);
                        return;
                    }
                    state.recover();
                    state.setPos(iterationStart);
                    break;
                }
                children.add(child);

                if (separator != null) {
                    int separatorStart = state.pos();
                    separator.parse(state, new Node());
                    if (state.errored()) {
                        state.recover();
                        state.setPos(separatorStart);
                        break;
                    }
                }
                // Nothing consumed: another round would match the same way forever
                if (state.pos() == iterationStart) {
                    break;
                }
            }
            node.setChildren(children);
            node.setToken(state.substring(start, state.pos()));
        });
    }

    // === Optionality and commit ===

    /**
     * Zero or one match. A failure leaves an empty node and no error, unless a cut
     * fired past the start position.
     */
    public static Parser maybe(Object parser) {
        var inner = parsify(parser);

        return Parser.named("maybe", (state, node) -> {
            int start = state.pos();
            inner.parse(state, node);
            if (state.errored() && !state.committedPast(start)) {
                state.recover();
                state.setPos(start);
                node.clear();
            }
        });
    }

    /**
     * Commit: consumes nothing and raises the cut barrier to the current position.
     * Failures after this point can no longer be recovered by an enclosing
     * {@code any}, {@code maybe} or {@code many}.
     */
    public static Parser cut() {
        return Parser.named("cut", (state, node) -> state.cutHere());
    }

    // === Semantic values ===

    /**
     * Set a constant semantic value when the parser matches.
     */
    public static Parser bind(Object parser, Object value) {
        var inner = parsify(parser);

        return (state, node) -> {
            inner.parse(state, node);
            if (state.errored()) {
                return;
            }
            node.setValue(value);
        };
    }

    /**
     * Invoke the action with the populated node when the parser matches.
     */
    public static Parser map(Object parser, Consumer<Node> action) {
        return parsify(parser).map(action);
    }

    /**
     * Replace the token with the concatenated tokens of all leaves below the node.
     * The child tree is left as is.
     */
    public static Parser merge(Object parser) {
        return map(parser, node -> node.setToken(node.flatten()));
    }

    // === Whitespace ===

    /**
     * Disable whitespace skipping for everything below the parser.
     */
    public static Parser noAutoWs(Object parser) {
        var inner = parsify(parser);

        return (state, node) -> {
            var previous = state.whitespace();
            state.setWhitespace(Whitespace.NONE);
            try {
                inner.parse(state, node);
            } finally {
                state.setWhitespace(previous);
            }
        };
    }

    // === Signal scanning ===

    /**
     * Find the signals, in order, embedded in noise.
     *
     * @see SignalSequence
     */
    public static Parser signalSeq(Object noise, Object... signals) {
        return SignalSequence.create(noise, signals);
    }
}
