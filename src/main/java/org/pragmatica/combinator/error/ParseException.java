package org.pragmatica.combinator.error;

/**
 * Unchecked carrier for a {@link ParseError}, for callers which prefer exceptions.
 */
public final class ParseException extends RuntimeException {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    /**
     * Check whether the throwable, or any throwable in its cause chain, carries a parse error of the given kind.
     * Classification is by type only, never by message text.
     */
    public static boolean isKind(Throwable throwable, Class<? extends ParseError> kind) {
        for (var current = throwable; current != null; current = current.getCause()) {
            if (current instanceof ParseException parseException && kind.isInstance(parseException.error())) {
                return true;
            }
        }
        return false;
    }
}
