package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.literal.Literals;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns "parserish" values into parsers: a {@link String} becomes an exact match,
 * a {@link Parser} (including a {@link ParserRef}) is used as is.
 */
public final class Parsify {
    private Parsify() {}

    public static Parser parsify(Object parserish) {
        if (parserish instanceof Parser parser) {
            return parser;
        }
        if (parserish instanceof String literal) {
            return Literals.exact(literal);
        }
        throw new IllegalArgumentException("Cannot turn "
                                           + (parserish == null ? "null" : parserish.getClass().getName())
                                           + " into a parser");
    }

    public static List<Parser> parsifyAll(Object... parserish) {
        var parsers = new ArrayList<Parser>(parserish.length);
        for (var p : parserish) {
            parsers.add(parsify(p));
        }
        return List.copyOf(parsers);
    }
}
