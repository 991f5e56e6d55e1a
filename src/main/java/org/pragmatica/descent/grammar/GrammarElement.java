package org.pragmatica.descent.grammar;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One element of a production body: a terminal token kind, a nonterminal symbol or the end of input.
 *
 * @param <K> token kind type
 * @param <S> nonterminal symbol type
 */
public sealed interface GrammarElement<K, S> {

    static <K, S> GrammarElement<K, S> terminal(K kind) {
        return new Terminal<>(kind);
    }

    static <K, S> GrammarElement<K, S> symbol(S symbol) {
        return new Nonterminal<>(symbol);
    }

    static <K, S> GrammarElement<K, S> end() {
        return new End<>();
    }

    /**
     * Matches exactly one token of the given kind.
     */
    record Terminal<K, S>(K kind) implements GrammarElement<K, S> {
        public Terminal {
            checkNotNull(kind, "kind");
        }

        @Override
        public String toString() {
            return String.valueOf(kind);
        }
    }

    /**
     * Expands to one of the productions headed by the given symbol.
     */
    record Nonterminal<K, S>(S symbol) implements GrammarElement<K, S> {
        public Nonterminal {
            checkNotNull(symbol, "symbol");
        }

        @Override
        public String toString() {
            return "<" + symbol + ">";
        }
    }

    /**
     * Matches only when all tokens are consumed. Consumes nothing.
     */
    record End<K, S>() implements GrammarElement<K, S> {
        @Override
        public String toString() {
            return "end of input";
        }
    }
}
