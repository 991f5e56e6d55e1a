package org.pragmatica.descent.parser;

/**
 * Result of matching a symbol or a production body - either success with a value or a soft failure.
 * Soft failures are recovered by trying the next alternative; they never carry reducer errors.
 */
public sealed interface ParseResult<T> {

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> symbolNotFound(int tokenIndex) {
        return new Failure<>(Reason.SYMBOL_NOT_FOUND, tokenIndex);
    }

    static <T> ParseResult<T> unexpectedEnd(int tokenIndex) {
        return new Failure<>(Reason.UNEXPECTED_END, tokenIndex);
    }

    enum Reason {
        SYMBOL_NOT_FOUND,
        UNEXPECTED_END
    }

    /**
     * Successful match with its semantic value.
     */
    record Success<T>(T value) implements ParseResult<T> {}

    /**
     * Failed match - the required element was not found, or input ended first.
     */
    record Failure<T>(Reason reason, int tokenIndex) implements ParseResult<T> {
        public <U> Failure<U> retype() {
            return new Failure<>(reason, tokenIndex);
        }
    }
}
