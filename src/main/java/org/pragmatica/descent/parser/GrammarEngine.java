package org.pragmatica.descent.parser;

import org.pragmatica.descent.action.SemanticValues;
import org.pragmatica.descent.action.TokenMapper;
import org.pragmatica.descent.error.ParseError;
import org.pragmatica.descent.error.ParseException;
import org.pragmatica.descent.grammar.GrammarElement;
import org.pragmatica.descent.grammar.Grammar;
import org.pragmatica.descent.lexer.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Backtracking recursive-descent engine - interprets a {@link Grammar} over a {@link TokenStream}.
 *
 * <p>Productions sharing a head are tried in declaration order and the first one whose body
 * matches wins; its reducer is applied to the values of the body elements. A structural
 * mismatch is soft and moves on to the next alternative, while an exception thrown by a
 * reducer aborts the whole parse unchanged.
 *
 * <p>Left recursion terminates through a path-scoped exclusion set: when a body starts with
 * a nonterminal, the body itself is excluded for that nested call, so a left-recursive
 * alternative cannot reselect itself before a token has been consumed. Productions headed by
 * the same symbol are therefore combined right-associatively.
 *
 * <p>No partial results are memoized. Every alternative re-parses from its start position, so
 * the running time is exponential in the worst case: grammars with several left-recursive
 * binary productions slow down sharply as parenthesized groups nest, and a few nested groups
 * can already take minutes.
 *
 * <p>The engine is immutable; concurrent {@link #analyze} calls are independent. Descent is
 * recursive and bounded only by grammar nesting and input length, so very deep inputs end in
 * a {@link StackOverflowError}, which is not caught.
 */
public final class GrammarEngine<K, S, R> {
    private static final Logger LOGGER = Logger.getLogger(GrammarEngine.class.getName());

    private final Grammar<K, S, R> grammar;
    private final TokenMapper<K, R> tokenMapper;

    private GrammarEngine(Grammar<K, S, R> grammar, TokenMapper<K, R> tokenMapper) {
        this.grammar = grammar;
        this.tokenMapper = tokenMapper;
    }

    public static <K, S, R> GrammarEngine<K, S, R> build(Grammar<K, S, R> grammar, TokenMapper<K, R> tokenMapper) {
        checkNotNull(grammar, "grammar");
        checkNotNull(tokenMapper, "tokenMapper");
        LOGGER.log(Level.FINE, "Built grammar engine with {0} productions for {1} symbols",
                   new Object[]{grammar.size(), grammar.heads().size()});
        return new GrammarEngine<>(grammar, tokenMapper);
    }

    public Grammar<K, S, R> grammar() {
        return grammar;
    }

    /**
     * Resolve the start symbol against the whole token stream.
     *
     * @throws ParseException carrying {@link ParseError.SymbolNotFound} or {@link ParseError.UnexpectedEnd}
     *                        once every alternative has failed
     */
    public R analyze(TokenStream<K> tokens, S start) {
        checkNotNull(tokens, "tokens");
        checkNotNull(start, "start");

        if (!grammar.defines(start)) {
            throw new ParseException(new ParseError.SymbolNotFound(String.valueOf(start),
                                                                   0,
                                                                   "no production",
                                                                   "a production headed by " + start));
        }

        LOGGER.log(Level.FINER, "Analyzing {0} tokens from {1}", new Object[]{tokens.size(), start});
        var ctx = ParsingContext.create(tokens);
        var result = resolveSymbol(ctx, start, ExclusionSet.empty());

        if (result instanceof ParseResult.Success<R> success) {
            return success.value();
        }

        var error = ctx.furthestIsAtEnd()
                    ? new ParseError.UnexpectedEnd(ctx.furthestPos(), ctx.furthestExpected())
                    : new ParseError.SymbolNotFound(String.valueOf(start),
                                                    ctx.furthestPos(),
                                                    ctx.furthestFound(),
                                                    ctx.furthestExpected());
        LOGGER.log(Level.FINE, "Parse failed: {0}", error.message());
        throw new ParseException(error);
    }

    // === Symbol Resolution ===

    private ParseResult<R> resolveSymbol(ParsingContext<K> ctx, S symbol, ExclusionSet exclusions) {
        var startPos = ctx.pos();
        var candidates = candidates(symbol, exclusions);

        if (candidates.isEmpty()) {
            ctx.updateFurthest("<" + symbol + ">");
        }

        for (var index : candidates) {
            ctx.setPos(startPos);

            var matched = matchBody(ctx, index, exclusions);

            if (matched instanceof ParseResult.Success<List<R>> success) {
                var sv = SemanticValues.of(ctx.text(startPos, ctx.pos()), success.value());
                // reducer exceptions propagate unchanged
                return ParseResult.success(grammar.production(index)
                                                  .reducer()
                                                  .reduce(sv));
            }
        }

        ctx.setPos(startPos);
        return ParseResult.symbolNotFound(startPos);
    }

    // Filtered once on entry; clearing the exclusions later does not re-admit candidates here.
    private List<Integer> candidates(S symbol, ExclusionSet exclusions) {
        var result = new ArrayList<Integer>();
        for (var index : grammar.productionsFor(symbol)) {
            if (!exclusions.isExcluded(grammar.bodyId(index))) {
                result.add(index);
            }
        }
        return result;
    }

    // === Body Matching ===

    private ParseResult<List<R>> matchBody(ParsingContext<K> ctx, int productionIndex, ExclusionSet exclusions) {
        var body = grammar.production(productionIndex)
                          .body();
        var values = new ArrayList<R>(body.size());

        for (int i = 0; i < body.size(); i++) {
            var element = body.get(i);

            if (element instanceof GrammarElement.Terminal<K, S> terminal) {
                if (ctx.isAtEnd()) {
                    ctx.updateFurthest(terminal.toString());
                    return ParseResult.unexpectedEnd(ctx.pos());
                }
                if (!ctx.peek()
                        .kind()
                        .equals(terminal.kind())) {
                    ctx.updateFurthest(terminal.toString());
                    return ParseResult.symbolNotFound(ctx.pos());
                }
                var token = ctx.advance();
                exclusions.clear();
                values.add(tokenMapper.map(token.kind(), token.lexeme()));
            } else if (element instanceof GrammarElement.Nonterminal<K, S> nonterminal) {
                var derived = exclusions.copy();
                if (i == 0) {
                    derived.exclude(grammar.bodyId(productionIndex));
                }
                var resolved = resolveSymbol(ctx, nonterminal.symbol(), derived);
                if (resolved instanceof ParseResult.Failure<R> failure) {
                    return failure.retype();
                }
                values.add(((ParseResult.Success<R>) resolved).value());
            } else {
                if (!ctx.isAtEnd()) {
                    ctx.updateFurthest(element.toString());
                    return ParseResult.symbolNotFound(ctx.pos());
                }
                exclusions.clear();
            }
        }
        return ParseResult.success(values);
    }
}
