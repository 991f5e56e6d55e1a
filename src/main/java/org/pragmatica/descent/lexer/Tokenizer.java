package org.pragmatica.descent.lexer;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import org.pragmatica.descent.error.ParseError;
import org.pragmatica.descent.error.ParseException;
import org.pragmatica.descent.parser.ParserConfig;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Pattern-ordered lexer.
 *
 * <p>At every position whitespace is skipped first, then token patterns are tried in
 * declaration order and the first one matching at the current position wins. This is
 * not longest-match: more specific patterns (multi-character operators, reserved words)
 * must be declared before general ones (identifiers).
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class Tokenizer<K> {
    private static final Logger LOGGER = Logger.getLogger(Tokenizer.class.getName());

    private final ImmutableList<CompiledPattern<K>> tokenPatterns;
    private final ImmutableList<Pattern> whitespacePatterns;
    private final ParserConfig config;

    private record CompiledPattern<K>(K kind, Pattern pattern) {}

    private Tokenizer(ImmutableList<CompiledPattern<K>> tokenPatterns,
                      ImmutableList<Pattern> whitespacePatterns,
                      ParserConfig config) {
        this.tokenPatterns = tokenPatterns;
        this.whitespacePatterns = whitespacePatterns;
        this.config = config;
    }

    public static <K> Tokenizer<K> build(List<TokenPattern<K>> tokenPatterns, List<String> whitespacePatterns) {
        return build(tokenPatterns, whitespacePatterns, ParserConfig.DEFAULT);
    }

    /**
     * Compile all patterns.
     *
     * @throws ParseException carrying {@link ParseError.PatternCompile} if any pattern is not a valid regular expression
     */
    public static <K> Tokenizer<K> build(List<TokenPattern<K>> tokenPatterns,
                                         List<String> whitespacePatterns,
                                         ParserConfig config) {
        checkNotNull(tokenPatterns, "tokenPatterns");
        checkNotNull(whitespacePatterns, "whitespacePatterns");
        checkNotNull(config, "config");

        var compiledTokens = ImmutableList.<CompiledPattern<K>>builder();
        for (var tokenPattern : tokenPatterns) {
            var pattern = compile("token pattern for " + tokenPattern.kind(), tokenPattern.pattern());
            compiledTokens.add(new CompiledPattern<>(tokenPattern.kind(), pattern));
        }

        var compiledWhitespace = ImmutableList.<Pattern>builder();
        for (int i = 0; i < whitespacePatterns.size(); i++) {
            compiledWhitespace.add(compile("whitespace pattern #" + i, whitespacePatterns.get(i)));
        }

        var tokenizer = new Tokenizer<>(compiledTokens.build(), compiledWhitespace.build(), config);
        LOGGER.log(Level.FINE, "Built tokenizer with {0} token patterns and {1} whitespace patterns",
                   new Object[]{tokenizer.tokenPatterns.size(), tokenizer.whitespacePatterns.size()});
        return tokenizer;
    }

    private static Pattern compile(String source, String regex) {
        checkNotNull(regex, "pattern");
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ParseException(new ParseError.PatternCompile(source, regex, e.getDescription()), e);
        }
    }

    /**
     * Split text into tokens.
     *
     * @throws ParseException carrying {@link ParseError.NoMatch} when nothing matches at some position
     */
    public TokenStream<K> tokenize(String text) {
        checkNotNull(text, "text");
        checkArgument(text.length() <= config.maxInputLength(),
                      "Input exceeds maximum size of %s characters", config.maxInputLength());

        var matchers = new Matchers(text);
        var tokens = new ArrayList<Token<K>>();
        int pos = 0;

        while (pos < text.length()) {
            pos = skipWhitespace(matchers, pos);
            if (pos >= text.length()) {
                break;
            }
            var token = matchToken(matchers, pos);
            tokens.add(token);
            pos = token.endOffset();
        }

        LOGGER.log(Level.FINER, "Tokenized {0} characters into {1} tokens", new Object[]{text.length(), tokens.size()});
        return TokenStream.of(text, tokens);
    }

    // Restart from the first whitespace pattern after every skip: consuming one region
    // may expose input that an earlier pattern matches.
    private int skipWhitespace(Matchers matchers, int pos) {
        boolean skipped = true;
        while (skipped && pos < matchers.text.length()) {
            skipped = false;
            for (var pattern : whitespacePatterns) {
                int end = matchers.matchAt(pattern, pos);
                if (end > pos) {
                    pos = end;
                    skipped = true;
                    break;
                }
            }
        }
        return pos;
    }

    private Token<K> matchToken(Matchers matchers, int pos) {
        for (var tokenPattern : tokenPatterns) {
            int end = matchers.matchAt(tokenPattern.pattern(), pos);
            if (end > pos) {
                return new Token<>(tokenPattern.kind(), matchers.text.substring(pos, end), pos);
            }
        }
        var preview = Ascii.truncate(matchers.text.substring(pos), config.noMatchPreviewLength(), "");
        throw new ParseException(new ParseError.NoMatch(pos, preview));
    }

    /**
     * Per-call matcher cache, one matcher per pattern, reset onto the same text.
     */
    private static final class Matchers {
        private final String text;
        private final Map<Pattern, Matcher> matchers = new IdentityHashMap<>();

        private Matchers(String text) {
            this.text = text;
        }

        // End offset of a match anchored at pos, or -1. Callers treat empty matches as no match.
        private int matchAt(Pattern pattern, int pos) {
            var matcher = matchers.computeIfAbsent(pattern, p -> p.matcher(text));
            matcher.region(pos, text.length());
            return matcher.lookingAt()
                   ? matcher.end()
                   : -1;
        }
    }
}
