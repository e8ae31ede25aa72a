package org.pragmatica.combinator.literal;

import java.util.BitSet;

/**
 * Set of code points written as characters and ranges, e.g. {@code "a-zA-Z_"}.
 * A {@code -} at the start or end of the definition stands for itself.
 */
final class CharSet {
    private final String definition;
    private final BitSet members;

    private CharSet(String definition, BitSet members) {
        this.definition = definition;
        this.members = members;
    }

    static CharSet parse(String definition) {
        if (definition.isEmpty()) {
            throw new IllegalArgumentException("Empty character set");
        }
        var codePoints = definition.codePoints().toArray();
        var members = new BitSet();
        int i = 0;
        while (i < codePoints.length) {
            int start = codePoints[i];
            if (i + 2 < codePoints.length && codePoints[i + 1] == '-') {
                int end = codePoints[i + 2];
                if (end < start) {
                    throw new IllegalArgumentException("Invalid range "
                                                       + Character.toString(start) + "-" + Character.toString(end)
                                                       + " in character set '" + definition + "'");
                }
                members.set(start, end + 1);
                i += 3;
            } else {
                members.set(start);
                i++;
            }
        }
        return new CharSet(definition, members);
    }

    boolean contains(int codePoint) {
        return members.get(codePoint);
    }

    @Override
    public String toString() {
        return definition;
    }
}
