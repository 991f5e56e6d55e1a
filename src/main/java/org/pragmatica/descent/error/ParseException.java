package org.pragmatica.descent.error;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Unchecked exception carrying a {@link ParseError}.
 */
public final class ParseException extends RuntimeException {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(checkNotNull(error, "error").message());
        this.error = error;
    }

    public ParseException(ParseError error, Throwable cause) {
        super(checkNotNull(error, "error").message(), cause);
        this.error = error;
    }

    /**
     * Convenience for reducers rejecting a matched production.
     */
    public static ParseException semantic(String reason) {
        return new ParseException(new ParseError.SemanticError(reason));
    }

    public ParseError error() {
        return error;
    }
}
