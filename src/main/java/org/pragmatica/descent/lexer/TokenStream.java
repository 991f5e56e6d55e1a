package org.pragmatica.descent.lexer;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable sequence of tokens produced by the {@link Tokenizer}.
 *
 * <p>The stream has an implicit End sentinel at index {@link #size()}: positions
 * {@code 0..size()-1} address real tokens, position {@code size()} is the end of input.
 */
public final class TokenStream<K> {
    private final String source;
    private final ImmutableList<Token<K>> tokens;

    private TokenStream(String source, ImmutableList<Token<K>> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    public static <K> TokenStream<K> of(String source, List<Token<K>> tokens) {
        return new TokenStream<>(checkNotNull(source, "source"), ImmutableList.copyOf(tokens));
    }

    /**
     * Stream built from tokens alone. Its source is the concatenation of their lexemes.
     */
    @SafeVarargs
    public static <K> TokenStream<K> ofTokens(Token<K>... tokens) {
        var sb = new StringBuilder();
        for (var token : tokens) {
            sb.append(token.lexeme());
        }
        return new TokenStream<>(sb.toString(), ImmutableList.copyOf(tokens));
    }

    public String source() {
        return source;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public boolean isAtEnd(int index) {
        return index >= tokens.size();
    }

    public Token<K> get(int index) {
        checkElementIndex(index, tokens.size(), "token index");
        return tokens.get(index);
    }

    public List<Token<K>> tokens() {
        return tokens;
    }

    public List<K> kinds() {
        return tokens.stream()
                     .map(Token::kind)
                     .toList();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TokenStream<?> other && tokens.equals(other.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}
