package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.tree.Node;

/**
 * Late-bound parser cell for self-referential grammars.
 *
 * <pre>{@code
 * var parens = ParserRef.create();
 * parens.set(seq("(", maybe(parens), ")"));
 * }</pre>
 */
public final class ParserRef implements Parser {
    private Parser target;

    private ParserRef() {}

    public static ParserRef create() {
        return new ParserRef();
    }

    public ParserRef set(Object parserish) {
        this.target = Parsify.parsify(parserish);
        return this;
    }

    public boolean isSet() {
        return target != null;
    }

    @Override
    public void parse(ParseState state, Node node) {
        if (target == null) {
            throw new IllegalStateException("Parser reference used before being set");
        }
        target.parse(state, node);
    }
}
