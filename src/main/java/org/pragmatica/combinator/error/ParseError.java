package org.pragmatica.combinator.error;

/**
 * Parse error kinds reported by a parse run.
 */
public sealed interface ParseError {
    String message();

    /**
     * No alternative matched. Carries the furthest failure position reachable
     * under the ranking rule of {@link #outranks(MatchError)}.
     */
    record MatchError(int position, String expected) implements ParseError {

        /**
         * Sentinel meaning "no failure".
         */
        public static final MatchError NONE = new MatchError(-1, "");

        public static MatchError at(int position, String expected) {
            return new MatchError(position, expected);
        }

        public boolean isNone() {
            return position < 0;
        }

        /**
         * Furthest position wins, ties favor this (more recent) error.
         */
        public boolean outranks(MatchError other) {
            return position >= other.position;
        }

        @Override
        public String message() {
            return "offset " + position + ": expected " + expected;
        }

        @Override
        public String toString() {
            return isNone() ? "no error" : message();
        }
    }

    /**
     * The grammar matched but did not consume the whole input.
     */
    record UnparsedInputError(String leftover) implements ParseError {
        @Override
        public String message() {
            return "left unparsed: " + leftover;
        }
    }
}
