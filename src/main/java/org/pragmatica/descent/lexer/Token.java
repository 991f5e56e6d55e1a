package org.pragmatica.descent.lexer;

/**
 * One token occurrence: its kind, the matched lexeme and the offset of the lexeme in the source text.
 */
public record Token<K>(K kind, String lexeme, int offset) {

    public int endOffset() {
        return offset + lexeme.length();
    }

    @Override
    public String toString() {
        return kind + "('" + lexeme + "')";
    }
}
