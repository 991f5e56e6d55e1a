package org.pragmatica.descent;

import org.junit.jupiter.api.Test;
import org.pragmatica.descent.action.Reducer;
import org.pragmatica.descent.error.ParseError;
import org.pragmatica.descent.error.ParseException;
import org.pragmatica.descent.parser.ParserConfig;

import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.descent.grammar.GrammarElement.end;
import static org.pragmatica.descent.grammar.GrammarElement.symbol;
import static org.pragmatica.descent.grammar.GrammarElement.terminal;

class CompilerTest {

    enum Tok {
        RPAREN,
        LPAREN,
        PLUS,
        NUM
    }

    enum Sym {
        PROGRAM,
        VALUE
    }

    sealed interface Expr {}

    record Num(int value) implements Expr {}

    record Add(Expr left, Expr right) implements Expr {}

    record Punct(Tok kind) implements Expr {}

    private static Compiler.Builder<Tok, Sym, Expr> sumBuilder() {
        return Compiler.<Tok, Sym, Expr>builder()
                       .token(Tok.RPAREN, "\\)")
                       .token(Tok.LPAREN, "\\(")
                       .token(Tok.PLUS, "\\+")
                       .token(Tok.NUM, "\\d+")
                       .whitespace(" ", "\\t", "\\n")
                       .production(Sym.PROGRAM, Reducer.pick(0), symbol(Sym.VALUE), end())
                       .production(Sym.VALUE, sv -> new Add(sv.get(0), sv.get(2)), symbol(Sym.VALUE), terminal(Tok.PLUS), symbol(Sym.VALUE))
                       .production(Sym.VALUE, Reducer.pick(1), terminal(Tok.LPAREN), symbol(Sym.VALUE), terminal(Tok.RPAREN))
                       .production(Sym.VALUE, Reducer.pick(0), terminal(Tok.NUM))
                       .start(Sym.PROGRAM)
                       .tokenMapper((kind, lexeme) -> kind == Tok.NUM
                                                      ? new Num(Integer.parseInt(lexeme))
                                                      : new Punct(kind));
    }

    // === End to End ===

    @Test
    void compile_parenthesizedSum_groupsAsWritten() {
        var compiler = sumBuilder().build();

        assertEquals(new Add(new Add(new Num(1), new Num(2)), new Num(3)), compiler.compile("(1+2)+3"));
    }

    @Test
    void compile_unparenthesizedSum_isRightAssociative() {
        var compiler = sumBuilder().build();

        assertEquals(new Add(new Num(1), new Add(new Num(2), new Num(3))), compiler.compile("1 + 2 + 3"));
    }

    @Test
    void compile_whitespaceEverywhere_isIgnored() {
        var compiler = sumBuilder().build();

        assertEquals(new Num(42), compiler.compile("\n\t ( ( 42 ) )  \n"));
    }

    // === Failures ===

    @Test
    void compile_unknownCharacter_failsWithNoMatch() {
        var compiler = sumBuilder().build();

        var error = assertThrows(ParseException.class, () -> compiler.compile("1 + x"));

        assertEquals(new ParseError.NoMatch(4, "x"), error.error());
    }

    @Test
    void compile_unbalancedParentheses_failsWithUnexpectedEnd() {
        var compiler = sumBuilder().build();

        var error = assertThrows(ParseException.class, () -> compiler.compile("(1 + 2"));

        assertThat(error.error()).isInstanceOf(ParseError.UnexpectedEnd.class);
        assertThat(error.getMessage()).contains("RPAREN");
    }

    @Test
    void build_invalidPattern_failsBeforeFirstUse() {
        var builder = sumBuilder().token(Tok.NUM, "[0-9");

        var error = assertThrows(ParseException.class, builder::build);

        assertThat(error.error()).isInstanceOf(ParseError.PatternCompile.class);
    }

    @Test
    void build_withoutStartOrMapper_isRejected() {
        assertThatThrownBy(() -> Compiler.<Tok, Sym, Expr>builder()
                                         .token(Tok.NUM, "\\d+")
                                         .production(Sym.VALUE, Reducer.pick(0), terminal(Tok.NUM))
                                         .build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Start symbol");
    }

    @Test
    void build_customConfig_appliesToTokenizer() {
        var compiler = sumBuilder().config(new ParserConfig(10, 8)).build();

        assertEquals(new Num(7), compiler.compile("7"));
        assertThrows(IllegalArgumentException.class, () -> compiler.compile("1+2+3+4+5"));
    }

    @Test
    void literal_quotesRegexMetacharacters() {
        var compiler = Compiler.<Tok, Sym, Expr>builder()
                               .literal(Tok.PLUS, "+")
                               .token(Tok.NUM, "\\d+")
                               .production(Sym.VALUE, sv -> new Add(sv.get(0), sv.get(2)), terminal(Tok.NUM), terminal(Tok.PLUS), terminal(Tok.NUM))
                               .start(Sym.VALUE)
                               .tokenMapper((kind, lexeme) -> kind == Tok.NUM ? new Num(Integer.parseInt(lexeme)) : new Punct(kind))
                               .build();

        assertEquals(new Add(new Num(1), new Num(2)), compiler.compile("1+2"));
    }

    // === Concurrency ===

    @Test
    void compile_concurrentCalls_areIndependent() throws Exception {
        var compiler = sumBuilder().build();
        var executor = Executors.newFixedThreadPool(4);
        try {
            var futures = new ArrayList<Future<Expr>>();
            for (int i = 0; i < 64; i++) {
                int n = i;
                Callable<Expr> task = () -> compiler.compile("(" + n + " + 1) + " + n);
                futures.add(executor.submit(task));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(new Add(new Add(new Num(i), new Num(1)), new Num(i)), futures.get(i).get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
