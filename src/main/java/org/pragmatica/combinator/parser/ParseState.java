package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError.MatchError;
import org.pragmatica.combinator.trace.TraceEvent;
import org.pragmatica.combinator.trace.Tracer;
import org.pragmatica.combinator.tree.Node;

/**
 * Mutable scan cursor shared by all parsers of one run.
 *
 * <p>Holds the input, the current offset, the active error, the whitespace policy
 * and the cut barrier. One instance belongs to exactly one in-flight parse.
 */
public final class ParseState {
    private static final int PREVIEW_LENGTH = 20;

    private final String input;
    private final Tracer tracer;

    private int pos;
    private MatchError error;
    private int cut;
    private Whitespace whitespace;
    private int traceDepth;

    private ParseState(String input, Whitespace whitespace, Tracer tracer) {
        this.input = input;
        this.tracer = tracer;
        this.whitespace = whitespace;
        this.pos = 0;
        this.error = MatchError.NONE;
        this.cut = 0;
    }

    public static ParseState create(String input) {
        return create(input, RunConfig.DEFAULT);
    }

    public static ParseState create(String input, RunConfig config) {
        return new ParseState(input, config.whitespace(), config.tracer());
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public void setPos(int pos) {
        if (pos < 0 || pos > input.length()) {
            throw new IllegalArgumentException("Position " + pos + " outside of input [0, " + input.length() + "]");
        }
        this.pos = pos;
    }

    public void advance(int count) {
        setPos(pos + count);
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    // === Input Access ===

    public String input() {
        return input;
    }

    /**
     * Unconsumed input from the current position.
     */
    public String remaining() {
        return input.substring(pos);
    }

    /**
     * At most {@code length} characters starting at the current position.
     */
    public String preview(int length) {
        return previewAt(pos, length);
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    public boolean startsWith(String text) {
        return input.startsWith(text, pos);
    }

    private String previewAt(int start, int length) {
        return input.substring(start, Math.min(input.length(), start + length));
    }

    // === Error Tracking ===

    public MatchError error() {
        return error;
    }

    public boolean errored() {
        return !error.isNone();
    }

    /**
     * Record a failure at the current position.
     */
    public void errorHere(String expected) {
        error = MatchError.at(pos, expected);
    }

    public void fail(MatchError error) {
        this.error = error;
    }

    /**
     * Clear the active error so an alternative path can be tried.
     */
    public void recover() {
        error = MatchError.NONE;
    }

    // === Cut Barrier ===

    public int cut() {
        return cut;
    }

    /**
     * Raise the cut barrier to the current position. The barrier never moves back.
     */
    public void cutHere() {
        cut = Math.max(cut, pos);
    }

    /**
     * True when a cut fired past the given position, so failures there must not be recovered.
     */
    public boolean committedPast(int position) {
        return cut > position;
    }

    // === Whitespace ===

    public Whitespace whitespace() {
        return whitespace;
    }

    public void setWhitespace(Whitespace whitespace) {
        this.whitespace = whitespace;
    }

    public void skipWhitespace() {
        whitespace.skip(this);
    }

    // === Tracing ===

    /**
     * Run the parser, reporting the invocation to the tracer when tracing is enabled.
     */
    public void invoke(String name, Parser parser, Node node) {
        if (tracer == Tracer.NONE) {
            parser.parse(this, node);
            return;
        }

        var start = pos;
        var depth = traceDepth++;
        try {
            parser.parse(this, node);
        } finally {
            traceDepth--;
        }
        var matched = !errored();
        tracer.trace(new TraceEvent(name,
                                    depth,
                                    start,
                                    previewAt(start, PREVIEW_LENGTH),
                                    matched,
                                    matched ? node.token() : error.message()));
    }

    @Override
    public String toString() {
        return "ParseState{pos=" + pos + ", cut=" + cut + ", error=" + error + ", next='" + preview(PREVIEW_LENGTH) + "'}";
    }
}
