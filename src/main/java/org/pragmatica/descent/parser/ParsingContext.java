package org.pragmatica.descent.parser;

import org.pragmatica.descent.lexer.Token;
import org.pragmatica.descent.lexer.TokenStream;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable state of a single parse: the cursor into the token stream and the furthest failure seen.
 */
public final class ParsingContext<K> {

    private final TokenStream<K> tokens;

    private int pos;
    private int furthestPos;
    private final Set<String> furthestExpected;

    private ParsingContext(TokenStream<K> tokens) {
        this.tokens = tokens;
        this.pos = 0;
        this.furthestPos = 0;
        this.furthestExpected = new LinkedHashSet<>();
    }

    public static <K> ParsingContext<K> create(TokenStream<K> tokens) {
        return new ParsingContext<>(tokens);
    }

    // === Cursor Management ===

    public int pos() {
        return pos;
    }

    public void setPos(int pos) {
        this.pos = pos;
    }

    public boolean isAtEnd() {
        return tokens.isAtEnd(pos);
    }

    public Token<K> peek() {
        return tokens.get(pos);
    }

    public Token<K> advance() {
        return tokens.get(pos++);
    }

    /**
     * Source text spanned by the tokens in {@code [start, end)}, empty if the range is empty.
     */
    public String text(int start, int end) {
        if (end <= start) {
            return "";
        }
        return tokens.source()
                     .substring(tokens.get(start).offset(), tokens.get(end - 1).endOffset());
    }

    // === Error Tracking ===

    public void updateFurthest(String expected) {
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestExpected.clear();
            furthestExpected.add(expected);
        } else if (pos == furthestPos) {
            furthestExpected.add(expected);
        }
    }

    public int furthestPos() {
        return furthestPos;
    }

    public boolean furthestIsAtEnd() {
        return tokens.isAtEnd(furthestPos);
    }

    /**
     * What was found at the furthest failure position.
     */
    public String furthestFound() {
        if (furthestIsAtEnd()) {
            return "end of input";
        }
        var token = tokens.get(furthestPos);
        return "'" + token.lexeme() + "' (" + token.kind() + ")";
    }

    public String furthestExpected() {
        return String.join(" or ", furthestExpected);
    }
}
