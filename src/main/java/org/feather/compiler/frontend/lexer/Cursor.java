package org.feather.compiler.frontend.lexer;

/**
 * The scanning position inside an immutable source text: the offset of the next
 * unconsumed character, the current line number and the offset at which the
 * current line starts. One cursor is shared by every nested scan of a file, so
 * positions only ever move forward.
 */
final class Cursor {

    private final String source;
    private int offset = 0;
    private int line = 1;
    private int lineStart = 0;

    Cursor(String source) {
        this.source = source;
    }

    int offset() {
        return offset;
    }

    int line() {
        return line;
    }

    /**
     * @return The 0-based column of the next unconsumed character.
     */
    int column() {
        return offset - lineStart;
    }

    boolean isAtEnd() {
        return offset >= source.length();
    }

    /**
     * @return The next unconsumed character, or {@code '\0'} at the end of input.
     */
    char peek() {
        return isAtEnd() ? '\0' : source.charAt(offset);
    }

    boolean startsWith(String prefix) {
        return source.startsWith(prefix, offset);
    }

    void advance(int count) {
        offset = Math.min(offset + count, source.length());
    }

    /**
     * Consumes the newline at the current position, records its offset and moves
     * to the start of the next line.
     *
     * @param sink The stream receiving the line break.
     */
    void newline(TokenStream.Builder sink) {
        if (peek() != '\n') {
            throw new IllegalStateException("No newline at offset " + offset);
        }
        sink.lineBreak(offset);
        offset++;
        line++;
        lineStart = offset;
    }
}
