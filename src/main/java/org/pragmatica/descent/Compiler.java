package org.pragmatica.descent;

import org.pragmatica.descent.action.Reducer;
import org.pragmatica.descent.action.TokenMapper;
import org.pragmatica.descent.error.ParseException;
import org.pragmatica.descent.grammar.Grammar;
import org.pragmatica.descent.grammar.GrammarElement;
import org.pragmatica.descent.lexer.TokenPattern;
import org.pragmatica.descent.lexer.Tokenizer;
import org.pragmatica.descent.parser.GrammarEngine;
import org.pragmatica.descent.parser.ParserConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Entry point wiring a {@link Tokenizer} and a {@link GrammarEngine} into a single text-to-result call.
 *
 * <p>Example usage:
 * <pre>{@code
 * var compiler = Compiler.<Tok, Sym, Integer>builder()
 *     .token(Tok.PLUS, "\\+")
 *     .token(Tok.NUM, "\\d+")
 *     .whitespace(" ")
 *     .production(Sym.SUM, sv -> sv.get(0) + sv.get(2), symbol(Sym.SUM), terminal(Tok.PLUS), symbol(Sym.SUM))
 *     .production(Sym.SUM, Reducer.pick(0), terminal(Tok.NUM))
 *     .start(Sym.SUM)
 *     .tokenMapper((kind, lexeme) -> kind == Tok.NUM ? Integer.parseInt(lexeme) : 0)
 *     .build();
 *
 * int result = compiler.compile("1 + 2 + 3");
 * }</pre>
 */
public final class Compiler<K, S, R> {
    private static final Logger LOGGER = Logger.getLogger(Compiler.class.getName());

    private final Tokenizer<K> tokenizer;
    private final GrammarEngine<K, S, R> engine;
    private final S startSymbol;

    private Compiler(Tokenizer<K> tokenizer, GrammarEngine<K, S, R> engine, S startSymbol) {
        this.tokenizer = tokenizer;
        this.engine = engine;
        this.startSymbol = startSymbol;
    }

    /**
     * Create a compiler from already built parts.
     */
    public static <K, S, R> Compiler<K, S, R> of(Tokenizer<K> tokenizer, GrammarEngine<K, S, R> engine, S startSymbol) {
        return new Compiler<>(checkNotNull(tokenizer, "tokenizer"),
                              checkNotNull(engine, "engine"),
                              checkNotNull(startSymbol, "startSymbol"));
    }

    public static <K, S, R> Builder<K, S, R> builder() {
        return new Builder<>();
    }

    /**
     * Tokenize the text and resolve the start symbol over the tokens.
     *
     * @throws ParseException on tokenizer or grammar failure
     */
    public R compile(String text) {
        return engine.analyze(tokenizer.tokenize(text), startSymbol);
    }

    public Tokenizer<K> tokenizer() {
        return tokenizer;
    }

    public GrammarEngine<K, S, R> engine() {
        return engine;
    }

    public S startSymbol() {
        return startSymbol;
    }

    public static final class Builder<K, S, R> {
        private final List<TokenPattern<K>> tokens = new ArrayList<>();
        private final List<String> whitespace = new ArrayList<>();
        private final Grammar.Builder<K, S, R> grammar = Grammar.builder();
        private S startSymbol;
        private TokenMapper<K, R> tokenMapper;
        private ParserConfig config = ParserConfig.DEFAULT;

        private Builder() {}

        public Builder<K, S, R> token(K kind, String pattern) {
            tokens.add(TokenPattern.of(kind, pattern));
            return this;
        }

        public Builder<K, S, R> literal(K kind, String text) {
            tokens.add(TokenPattern.literal(kind, text));
            return this;
        }

        public Builder<K, S, R> whitespace(String... patterns) {
            whitespace.addAll(Arrays.asList(patterns));
            return this;
        }

        public Builder<K, S, R> production(S head, List<GrammarElement<K, S>> body, Reducer<R> reducer) {
            grammar.production(head, body, reducer);
            return this;
        }

        @SafeVarargs
        public final Builder<K, S, R> production(S head, Reducer<R> reducer, GrammarElement<K, S>... body) {
            grammar.production(head, Arrays.asList(body), reducer);
            return this;
        }

        public Builder<K, S, R> start(S symbol) {
            this.startSymbol = checkNotNull(symbol, "symbol");
            return this;
        }

        public Builder<K, S, R> tokenMapper(TokenMapper<K, R> mapper) {
            this.tokenMapper = checkNotNull(mapper, "mapper");
            return this;
        }

        public Builder<K, S, R> config(ParserConfig config) {
            this.config = checkNotNull(config, "config");
            return this;
        }

        /**
         * @throws ParseException carrying a pattern compile error if a token or whitespace pattern is invalid
         */
        public Compiler<K, S, R> build() {
            checkState(startSymbol != null, "Start symbol is not set");
            checkState(tokenMapper != null, "Token mapper is not set");

            var compiler = Compiler.of(Tokenizer.build(tokens, whitespace, config),
                                       GrammarEngine.build(grammar.build(), tokenMapper),
                                       startSymbol);
            LOGGER.log(Level.FINE, "Built compiler starting from {0}", startSymbol);
            return compiler;
        }
    }
}
