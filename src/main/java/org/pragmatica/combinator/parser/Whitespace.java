package org.pragmatica.combinator.parser;

import java.util.function.IntPredicate;

/**
 * Policy for skipping insignificant input before a match is attempted.
 */
@FunctionalInterface
public interface Whitespace {

    void skip(ParseState state);

    /**
     * Skips nothing; matches must be literally adjacent.
     */
    Whitespace NONE = state -> {};

    /**
     * Skips every code point for which {@link Character#isWhitespace(int)} holds.
     */
    Whitespace UNICODE = matching(Character::isWhitespace);

    /**
     * Skips space, tab, line feed, carriage return, vertical tab and form feed.
     */
    Whitespace ASCII = matching(cp -> cp == ' '
                                      || cp == '\t'
                                      || cp == '\n'
                                      || cp == '\r'
                                      || cp == '\u000B'
                                      || cp == '\f');

    static Whitespace matching(IntPredicate isSpace) {
        return state -> {
            var input = state.input();
            int pos = state.pos();
            while (pos < input.length()) {
                int cp = input.codePointAt(pos);
                if (!isSpace.test(cp)) {
                    break;
                }
                pos += Character.charCount(cp);
            }
            state.setPos(pos);
        };
    }
}
