package org.pragmatica.combinator.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.combinator.error.ParseError.MatchError;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParseState, focusing on error, cut and whitespace bookkeeping.
 */
class ParseStateTest {

    // === Position Management ===

    @Test
    void newState_startsAtBeginningWithoutError() {
        var state = ParseState.create("abc");

        assertEquals(0, state.pos());
        assertEquals(0, state.cut());
        assertFalse(state.errored());
        assertSame(MatchError.NONE, state.error());
    }

    @Test
    void setPos_outsideInput_isRejected() {
        var state = ParseState.create("abc");

        assertThrows(IllegalArgumentException.class, () -> state.setPos(-1));
        assertThrows(IllegalArgumentException.class, () -> state.setPos(4));
        state.setPos(3);
        assertTrue(state.isAtEnd());
    }

    @Test
    void remainingAndPreview_startAtCurrentPosition() {
        var state = ParseState.create("hello world");
        state.advance(6);

        assertEquals("world", state.remaining());
        assertEquals("wo", state.preview(2));
        assertEquals("world", state.preview(100));
        assertTrue(state.startsWith("wor"));
    }

    // === Error Tracking ===

    @Test
    void errorHere_recordsCurrentPosition() {
        var state = ParseState.create("abc");
        state.advance(2);
        state.errorHere("x");

        assertTrue(state.errored());
        assertEquals(MatchError.at(2, "x"), state.error());
    }

    @Test
    void recover_clearsError() {
        var state = ParseState.create("abc");
        state.errorHere("x");
        state.recover();

        assertFalse(state.errored());
    }

    // === Cut Barrier ===

    @Test
    void cutHere_neverLowersBarrier() {
        var state = ParseState.create("abcdef");
        state.setPos(4);
        state.cutHere();
        state.setPos(1);
        state.cutHere();

        assertEquals(4, state.cut());
    }

    @Test
    void committedPast_comparesAgainstBarrier() {
        var state = ParseState.create("abcdef");
        state.setPos(3);
        state.cutHere();

        assertTrue(state.committedPast(2));
        assertFalse(state.committedPast(3));
        assertFalse(state.committedPast(5));
    }

    // === Whitespace ===

    @Test
    void skipWhitespace_unicodePolicy_skipsUnicodeSpaces() {
        var state = ParseState.create(" \t x");
        state.skipWhitespace();

        assertEquals(3, state.pos());
    }

    @Test
    void skipWhitespace_asciiPolicy_stopsAtUnicodeSpace() {
        var config = RunConfig.builder().whitespace(Whitespace.ASCII).build();
        var state = ParseState.create(" \t x", config);
        state.skipWhitespace();

        assertEquals(2, state.pos());
    }

    @Test
    void skipWhitespace_nonePolicy_staysPut() {
        var state = ParseState.create("  x");
        state.setWhitespace(Whitespace.NONE);
        state.skipWhitespace();

        assertEquals(0, state.pos());
    }
}
