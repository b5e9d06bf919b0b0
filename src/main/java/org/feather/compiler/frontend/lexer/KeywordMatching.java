package org.feather.compiler.frontend.lexer;

/**
 * Selects how the {@link KeywordTable} decides whether an identifier is a keyword.
 */
public enum KeywordMatching {
    /** The identifier's full text must equal the keyword. {@code ifx} is an identifier. */
    EXACT,
    /**
     * Keywords are tried from the longest length to the shortest and the first keyword
     * equal to the identifier's leading characters wins, so {@code continued} lexes as
     * {@link TokenType#CONTINUE} and {@code ifx} as {@link TokenType#IF}. Kept for
     * compatibility with token streams produced by older front ends.
     */
    PREFIX
}
