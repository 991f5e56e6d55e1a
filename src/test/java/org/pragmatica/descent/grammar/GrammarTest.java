package org.pragmatica.descent.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.descent.action.Reducer;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.descent.grammar.GrammarElement.end;
import static org.pragmatica.descent.grammar.GrammarElement.symbol;
import static org.pragmatica.descent.grammar.GrammarElement.terminal;

class GrammarTest {

    enum Tok {
        NUM,
        PLUS
    }

    enum Sym {
        PROGRAM,
        VALUE,
        OTHER
    }

    private static final Reducer<String> FIRST = Reducer.pick(0);

    // === Grammar Elements ===

    @Test
    void elements_haveStructuralEquality() {
        assertEquals(GrammarElement.<Tok, Sym>terminal(Tok.NUM), terminal(Tok.NUM));
        assertEquals(GrammarElement.<Tok, Sym>symbol(Sym.VALUE), symbol(Sym.VALUE));
        assertEquals(GrammarElement.<Tok, Sym>end(), end());
        assertNotEquals(GrammarElement.<Tok, Sym>terminal(Tok.NUM), terminal(Tok.PLUS));
        assertEquals(List.of(terminal(Tok.NUM), end()).hashCode(), List.of(terminal(Tok.NUM), end()).hashCode());
    }

    @Test
    void production_rendersHeadAndBody() {
        var production = new Production<Tok, Sym, String>(Sym.VALUE,
                                                          List.of(symbol(Sym.VALUE), terminal(Tok.PLUS), symbol(Sym.VALUE)),
                                                          FIRST);

        assertEquals("VALUE -> <VALUE> PLUS <VALUE>", production.toString());
    }

    @Test
    void production_bodyIsImmutable() {
        var production = new Production<Tok, Sym, String>(Sym.VALUE, List.of(terminal(Tok.NUM)), FIRST);

        assertThrows(UnsupportedOperationException.class, () -> production.body().add(end()));
    }

    // === Lookup ===

    @Test
    void productionsFor_preservesDeclarationOrder() {
        var grammar = Grammar.<Tok, Sym, String>builder()
                             .production(Sym.PROGRAM, FIRST, symbol(Sym.VALUE), end())
                             .production(Sym.VALUE, FIRST, symbol(Sym.VALUE), terminal(Tok.PLUS), symbol(Sym.VALUE))
                             .production(Sym.OTHER, FIRST, terminal(Tok.PLUS))
                             .production(Sym.VALUE, FIRST, terminal(Tok.NUM))
                             .build();

        assertEquals(List.of(1, 3), grammar.productionsFor(Sym.VALUE));
        assertEquals(List.of(0), grammar.productionsFor(Sym.PROGRAM));
        assertTrue(grammar.defines(Sym.OTHER));
        assertThat(grammar.heads()).containsExactly(Sym.PROGRAM, Sym.VALUE, Sym.OTHER);
    }

    @Test
    void productionsFor_unknownSymbol_isEmpty() {
        var grammar = Grammar.<Tok, Sym, String>builder()
                             .production(Sym.VALUE, FIRST, terminal(Tok.NUM))
                             .build();

        assertTrue(grammar.productionsFor(Sym.OTHER).isEmpty());
        assertFalse(grammar.defines(Sym.OTHER));
    }

    // === Body Ids ===

    @Test
    void bodyId_equalBodiesShareTheFirstIndex() {
        var grammar = Grammar.<Tok, Sym, String>builder()
                             .production(Sym.VALUE, FIRST, terminal(Tok.NUM))
                             .production(Sym.VALUE, FIRST, terminal(Tok.PLUS))
                             .production(Sym.OTHER, FIRST, terminal(Tok.NUM))
                             .production(Sym.VALUE, s -> "other reducer", terminal(Tok.PLUS))
                             .build();

        assertEquals(0, grammar.bodyId(0));
        assertEquals(1, grammar.bodyId(1));
        assertEquals(0, grammar.bodyId(2));
        assertEquals(1, grammar.bodyId(3));
    }

    // === Validation ===

    @Test
    void build_emptyGrammar_isRejected() {
        assertThatThrownBy(() -> Grammar.<Tok, Sym, String>builder().build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_nullElement_isRejected() {
        assertThrows(NullPointerException.class,
                     () -> Grammar.<Tok, Sym, String>builder()
                                  .production(Sym.VALUE, FIRST, terminal(Tok.NUM), null));
    }
}
