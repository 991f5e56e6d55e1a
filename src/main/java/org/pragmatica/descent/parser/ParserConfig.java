package org.pragmatica.descent.parser;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Parser configuration options.
 *
 * @param noMatchPreviewLength number of characters of unmatched input quoted in a no-match error
 * @param maxInputLength       largest input, in characters, the tokenizer accepts
 */
public record ParserConfig(
    int noMatchPreviewLength,
    int maxInputLength
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        10,
        1_000_000
    );

    public ParserConfig {
        checkArgument(noMatchPreviewLength > 0, "noMatchPreviewLength must be positive: %s", noMatchPreviewLength);
        checkArgument(maxInputLength > 0, "maxInputLength must be positive: %s", maxInputLength);
    }
}
