package org.pragmatica.descent.lexer;

import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A token kind paired with the regular expression that recognizes it.
 * Patterns are always matched anchored at the current input position.
 */
public record TokenPattern<K>(K kind, String pattern) {

    public TokenPattern {
        checkNotNull(kind, "kind");
        checkNotNull(pattern, "pattern");
    }

    public static <K> TokenPattern<K> of(K kind, String pattern) {
        return new TokenPattern<>(kind, pattern);
    }

    /**
     * Pattern matching the given text literally.
     */
    public static <K> TokenPattern<K> literal(K kind, String text) {
        return new TokenPattern<>(kind, Pattern.quote(text));
    }
}
