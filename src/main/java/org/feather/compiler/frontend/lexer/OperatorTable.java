package org.feather.compiler.frontend.lexer;

import java.util.Map;

/**
 * Static longest-match tables for operators and punctuation.
 * <p>
 * The two-character table is always consulted before the one-character table,
 * so {@code --} is never split into two {@link TokenType#MINUS} tokens. There are
 * no operators longer than two characters.
 */
public final class OperatorTable {

    /**
     * A successful operator match.
     *
     * @param type   The token type of the operator.
     * @param length The number of characters the operator spans.
     */
    public record Match(TokenType type, int length) {}

    private static final Map<String, TokenType> TWO_CHAR = Map.ofEntries(
            Map.entry("==", TokenType.EQUALS),
            Map.entry("!=", TokenType.NOT_EQUALS),
            Map.entry("<=", TokenType.LESS_EQUAL),
            Map.entry(">=", TokenType.GREATER_EQUAL),
            Map.entry(">-", TokenType.FEATHER),
            Map.entry("->", TokenType.ARROW),
            Map.entry("<<", TokenType.L_SHIFT),
            Map.entry(">>", TokenType.R_SHIFT),
            Map.entry("++", TokenType.INCR),
            Map.entry("--", TokenType.DECR),
            Map.entry("**", TokenType.POW)
    );

    private static final Map<Character, TokenType> ONE_CHAR = Map.ofEntries(
            Map.entry('%', TokenType.MODULO),
            Map.entry('<', TokenType.LESS_THAN),
            Map.entry('>', TokenType.GREATER_THAN),
            Map.entry('&', TokenType.AMPERSAND),
            Map.entry('|', TokenType.PIPE),
            Map.entry('^', TokenType.CARET),
            Map.entry('~', TokenType.TILDE),
            Map.entry('+', TokenType.PLUS),
            Map.entry('-', TokenType.MINUS),
            Map.entry('*', TokenType.MUL),
            Map.entry('/', TokenType.DIV),
            Map.entry('=', TokenType.EQUAL),
            Map.entry(';', TokenType.SEMI),
            Map.entry(':', TokenType.COLON),
            Map.entry(',', TokenType.COMMA),
            Map.entry('.', TokenType.DOT),
            Map.entry('(', TokenType.L_PARENS),
            Map.entry(')', TokenType.R_PARENS),
            Map.entry('[', TokenType.L_BRACKET),
            Map.entry(']', TokenType.R_BRACKET),
            Map.entry('{', TokenType.L_BRACE),
            Map.entry('}', TokenType.R_BRACE)
    );

    private OperatorTable() {}

    /**
     * Finds the longest operator starting at the given offset.
     *
     * @param source The complete source text.
     * @param offset The offset at which the operator would begin.
     * @return The match, or {@code null} if no operator starts at {@code offset}.
     */
    public static Match match(String source, int offset) {
        if (offset + 2 <= source.length()) {
            TokenType type = TWO_CHAR.get(source.substring(offset, offset + 2));
            if (type != null) {
                return new Match(type, 2);
            }
        }
        if (offset < source.length()) {
            TokenType type = ONE_CHAR.get(source.charAt(offset));
            if (type != null) {
                return new Match(type, 1);
            }
        }
        return null;
    }
}
