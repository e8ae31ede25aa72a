package org.pragmatica.combinator.literal;

import org.pragmatica.combinator.parser.Parser;

import java.util.regex.Pattern;

/**
 * Leaf matchers. Each skips whitespace per the active policy, then either consumes
 * its match or records {@code {offset, description}} as the error and leaves the
 * cursor at the offset where the match was attempted.
 */
public final class Literals {
    private static final int UNBOUNDED = -1;

    private Literals() {}

    /**
     * Exact text match.
     */
    public static Parser exact(String text) {
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Exact match of empty text");
        }
        return Parser.named("exact '" + text + "'", (state, node) -> {
            state.skipWhitespace();
            if (!state.startsWith(text)) {
                state.errorHere(text);
                return;
            }
            state.advance(text.length());
            node.setToken(text);
        });
    }

    /**
     * One or more code points from the set, e.g. {@code chars("a-z0-9")}.
     */
    public static Parser chars(String set) {
        return chars(set, 1, UNBOUNDED);
    }

    /**
     * At least {@code min} code points from the set.
     */
    public static Parser chars(String set, int min) {
        return chars(set, min, UNBOUNDED);
    }

    /**
     * Between {@code min} and {@code max} code points from the set; {@code max} of -1 means no limit.
     */
    public static Parser chars(String set, int min, int max) {
        return charRun(CharSet.parse(set), false, min, max, set);
    }

    /**
     * One or more code points outside the set.
     */
    public static Parser notChars(String set) {
        return notChars(set, 1, UNBOUNDED);
    }

    public static Parser notChars(String set, int min, int max) {
        return charRun(CharSet.parse(set), true, min, max, "not " + set);
    }

    /**
     * Regular expression anchored at the cursor. The pattern doubles as the error description.
     */
    public static Parser regex(String pattern) {
        return regexMatcher(pattern, pattern, null);
    }

    /**
     * Regular expression anchored at the cursor, described as {@code name} in errors.
     * A successful match is labelled with {@code name}.
     */
    public static Parser namedRegex(String name, String pattern) {
        return regexMatcher(name, pattern, name);
    }

    private static Parser regexMatcher(String name, String pattern, String label) {
        var compiled = Pattern.compile(pattern);
        return Parser.named("regex " + name, (state, node) -> {
            state.skipWhitespace();
            var matcher = compiled.matcher(state.input())
                                  .region(state.pos(), state.input().length());
            if (!matcher.lookingAt()) {
                state.errorHere(name);
                return;
            }
            node.setToken(matcher.group());
            node.setLabel(label);
            state.setPos(matcher.end());
        });
    }

    private static Parser charRun(CharSet set, boolean negated, int min, int max, String expected) {
        if (min < 0 || (max != UNBOUNDED && max < min)) {
            throw new IllegalArgumentException("Invalid repetition bounds " + min + ".." + max);
        }
        return Parser.named("chars " + expected, (state, node) -> {
            state.skipWhitespace();
            var input = state.input();
            int start = state.pos();
            int end = start;
            int matched = 0;
            while (end < input.length() && (max == UNBOUNDED || matched < max)) {
                int cp = input.codePointAt(end);
                if (set.contains(cp) == negated) {
                    break;
                }
                end += Character.charCount(cp);
                matched++;
            }
            if (matched < min) {
                state.errorHere(expected);
                return;
            }
            node.setToken(input.substring(start, end));
            state.setPos(end);
        });
    }
}
