package org.feather.compiler.frontend.lexer;

import com.typesafe.config.Config;

/**
 * Tunables of the {@link Lexer}, read from the {@code feather.lexer} configuration block:
 * <pre>
 * feather.lexer {
 *   keyword-matching = "EXACT"  # or "PREFIX"
 *   capacity-hint = 1024
 * }
 * </pre>
 *
 * @param keywordMatching How identifiers are matched against keywords.
 * @param capacityHint    The number of tokens the stream reserves room for up front.
 */
public record LexerOptions(KeywordMatching keywordMatching, int capacityHint) {

    /** Exact keyword matching and a capacity hint of 1024 tokens. */
    public static final LexerOptions DEFAULTS = new LexerOptions(KeywordMatching.EXACT, 1024);

    private static final String KEYWORD_MATCHING_KEY = "keyword-matching";
    private static final String CAPACITY_HINT_KEY = "capacity-hint";

    public LexerOptions {
        if (keywordMatching == null) {
            throw new IllegalArgumentException("keywordMatching must not be null");
        }
        if (capacityHint < 0) {
            throw new IllegalArgumentException("capacityHint must not be negative: " + capacityHint);
        }
    }

    /**
     * Reads the options from a {@code feather.lexer} block. Missing keys fall back to {@link #DEFAULTS}.
     *
     * @param lexerConfig The {@code feather.lexer} sub-configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException.BadValue if {@code keyword-matching} is not a known policy.
     */
    public static LexerOptions fromConfig(Config lexerConfig) {
        KeywordMatching matching = lexerConfig.hasPath(KEYWORD_MATCHING_KEY)
                ? lexerConfig.getEnum(KeywordMatching.class, KEYWORD_MATCHING_KEY)
                : DEFAULTS.keywordMatching();
        int capacityHint = lexerConfig.hasPath(CAPACITY_HINT_KEY)
                ? lexerConfig.getInt(CAPACITY_HINT_KEY)
                : DEFAULTS.capacityHint();
        return new LexerOptions(matching, capacityHint);
    }
}
