package org.feather.compiler.frontend.lexer;

/**
 * The location of one token inside the source it was scanned from.
 * <p>
 * A span does not copy the token's characters; it records the offset and length
 * into the shared source text. {@link #text()} materialises them on demand.
 *
 * @param source The complete source text the span points into.
 * @param offset The offset of the token's first character.
 * @param length The number of characters in the token.
 * @param line   The 1-based line on which the token begins.
 * @param column The 0-based column (offset from the start of that line) at which the token begins.
 */
public record TokenSpan(String source, int offset, int length, int line, int column) {

    public TokenSpan {
        if (offset < 0 || length < 0 || offset + length > source.length()) {
            throw new IllegalArgumentException(
                    "Span [" + offset + ", " + (offset + length) + ") lies outside a source of length " + source.length());
        }
    }

    /**
     * @return The offset just past the token's last character.
     */
    public int end() {
        return offset + length;
    }

    /**
     * @return The exact source characters of the token.
     */
    public String text() {
        return source.substring(offset, offset + length);
    }

    @Override
    public String toString() {
        return line + ":" + column + " '" + text() + "'";
    }
}
