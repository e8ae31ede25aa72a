package org.pragmatica.combinator;

import org.pragmatica.combinator.error.ParseError.MatchError;
import org.pragmatica.combinator.parser.ParseState;
import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.parser.Parsify;
import org.pragmatica.combinator.tree.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Scanner for an ordered list of "signal" matches embedded in arbitrary "noise".
 *
 * <p>At each position the next expected signal is tried first, then the noise parser.
 * Signal matches become children with their own values. Noise matches become children too;
 * those that carry neither a semantic value nor a label from a named matcher are tagged
 * with {@link Marker#NOISE}.
 * Scanning stops when neither matches. The scan succeeds only if every signal was found in order.
 *
 * <p>Tagged noise after the last meaningful child is not part of the match: the cursor is left
 * right after that child. The token joins the tokens of the meaningful children with single spaces.
 */
public final class SignalSequence {

    /**
     * Value attached to noise children which carry no value of their own.
     */
    public enum Marker {
        NOISE;

        @Override
        public String toString() {
            return "<noise>";
        }
    }

    private SignalSequence() {}

    static Parser create(Object noise, Object... signals) {
        if (signals.length == 0) {
            throw new IllegalArgumentException("Signal sequence requires at least one signal");
        }
        var noiseParser = Parsify.parsify(noise);
        var signalParsers = Parsify.parsifyAll(signals);

        return Parser.named("signalSeq", (state, node) -> scan(state, node, noiseParser, signalParsers));
    }

    public static boolean isNoise(Node node) {
        return node.value() == Marker.NOISE;
    }

    /**
     * Children of a signal sequence result that are not tagged noise.
     */
    public static List<Node> meaningful(Node node) {
        return node.children()
                   .stream()
                   .filter(child -> !isNoise(child))
                   .collect(Collectors.toList());
    }

    private static void scan(ParseState state, Node node, Parser noise, List<Parser> signals) {
        int start = state.pos();
        var matches = new ArrayList<Node>();
        var ends = new ArrayList<Integer>();
        var stall = MatchError.NONE;
        int expected = 0;

        while (true) {
            int attempt = state.pos();

            if (expected < signals.size()) {
                var signal = new Node();
                signals.get(expected).parse(state, signal);
                if (!state.errored()) {
                    matches.add(signal);
                    ends.add(state.pos());
                    expected++;
                    continue;
                }
                if (state.committedPast(attempt)) {
                    state.setPos(start);
                    return;
                }
                stall = state.error();
                state.recover();
                state.setPos(attempt);
            }

            var filler = new Node();
            noise.parse(state, filler);
            if (state.errored()) {
                if (state.committedPast(attempt)) {
                    state.setPos(start);
                    return;
                }
                state.recover();
                state.setPos(attempt);
                break;
            }
            if (state.pos() == attempt) {
                break;
            }
            if (!filler.hasValue() && !filler.hasLabel()) {
                filler.setValue(Marker.NOISE);
            }
            matches.add(filler);
            ends.add(state.pos());
        }

        if (expected < signals.size()) {
            state.fail(MatchError.at(stall.position(), stall.expected() + " or noise"));
            state.setPos(start);
            return;
        }

        int last = matches.size() - 1;
        while (last >= 0 && isNoise(matches.get(last))) {
            last--;
        }
        var kept = matches.subList(0, last + 1);

        node.setChildren(kept);
        node.setToken(kept.stream()
                          .filter(child -> !isNoise(child))
                          .map(Node::token)
                          .collect(Collectors.joining(" ")));
        state.setPos(last >= 0 ? ends.get(last) : start);
    }
}
