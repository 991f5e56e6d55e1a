package org.pragmatica.descent.error;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    String message();

    /**
     * A token or whitespace pattern that is not a valid regular expression.
     */
    record PatternCompile(
    String source,
    String pattern,
    String detail) implements ParseError {
        @Override
        public String message() {
            return "Invalid " + source + " '" + pattern + "': " + detail;
        }
    }

    /**
     * No token pattern and no whitespace pattern matches at the given offset.
     */
    record NoMatch(
    int offset,
    String preview) implements ParseError {
        @Override
        public String message() {
            return "No match pattern was found at offset " + offset + ": '" + preview + "'";
        }
    }

    /**
     * No production of a symbol matches the tokens at the given position.
     */
    record SymbolNotFound(
    String symbol,
    int tokenIndex,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Symbol " + symbol + " not found: unexpected " + found + " at token " + tokenIndex
                   + ", expected " + expected;
        }
    }

    /**
     * Token stream exhausted while a terminal or nonterminal was still required.
     */
    record UnexpectedEnd(
    int tokenIndex,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at token " + tokenIndex + ", expected " + expected;
        }
    }

    /**
     * Error raised by a reducer. Never backtracked.
     */
    record SemanticError(String reason) implements ParseError {
        @Override
        public String message() {
            return reason;
        }
    }
}
