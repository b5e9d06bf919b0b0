package org.feather.compiler.frontend.lexer;

/**
 * A materialised view of one entry of a {@link TokenStream}, for consumers that
 * prefer a single object per token over the stream's parallel sequences.
 *
 * @param type     The type of the token.
 * @param text     The exact text of the token from the source code.
 * @param line     The 1-based line number where the token begins.
 * @param column   The 0-based column where the token begins.
 * @param fileName The logical file name the token was scanned from.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column,
        String fileName
) {
}
