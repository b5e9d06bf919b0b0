package org.feather.compiler.frontend.lexer;

import java.util.Map;

/**
 * Keyword lookup, organised by keyword length from the longest ({@code continue})
 * down to the shortest ({@code or}, {@code fn}, {@code if}, {@code do}).
 */
public final class KeywordTable {

    private static final int[] LENGTHS = {8, 6, 5, 4, 3, 2};

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("packed", TokenType.PACKED),
            Map.entry("struct", TokenType.STRUCT),
            Map.entry("union", TokenType.UNION),
            Map.entry("defer", TokenType.DEFER),
            Map.entry("while", TokenType.WHILE),
            Map.entry("break", TokenType.BREAK),
            Map.entry("enum", TokenType.ENUM),
            Map.entry("then", TokenType.THEN),
            Map.entry("else", TokenType.ELSE),
            Map.entry("loop", TokenType.LOOP),
            Map.entry("and", TokenType.AND),
            Map.entry("xor", TokenType.XOR),
            Map.entry("not", TokenType.NOT),
            Map.entry("pub", TokenType.PUB),
            Map.entry("or", TokenType.OR),
            Map.entry("fn", TokenType.FN),
            Map.entry("if", TokenType.IF),
            Map.entry("do", TokenType.DO)
    );

    private KeywordTable() {}

    /**
     * Classifies an identifier.
     *
     * @param identifier The identifier text.
     * @param matching   The matching policy to apply.
     * @return The keyword's token type, or {@code null} if the identifier is not a keyword.
     */
    public static TokenType lookup(String identifier, KeywordMatching matching) {
        if (matching == KeywordMatching.EXACT) {
            return KEYWORDS.get(identifier);
        }
        for (int length : LENGTHS) {
            if (identifier.length() >= length) {
                TokenType type = KEYWORDS.get(identifier.substring(0, length));
                if (type != null) {
                    return type;
                }
            }
        }
        return null;
    }
}
