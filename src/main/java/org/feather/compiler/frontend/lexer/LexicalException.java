package org.feather.compiler.frontend.lexer;

/**
 * Thrown by the {@link Lexer} when the source cannot be tokenized. Carries the kind
 * of error and the position where the offending construct begins.
 * <p>
 * The message has the form {@code <file>:<line>:<col>: <text>} with a 1-based column.
 */
public class LexicalException extends Exception {

    private final LexicalErrorKind kind;
    private final String fileName;
    private final int line;
    private final int column;

    /**
     * @param kind     The kind of error.
     * @param fileName The logical file name.
     * @param line     The 1-based line of the error's origin.
     * @param column   The 0-based column of the error's origin.
     */
    public LexicalException(LexicalErrorKind kind, String fileName, int line, int column) {
        super(String.format("%s:%d:%d: %s", fileName, line, column + 1, kind.message()));
        this.kind = kind;
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public LexicalErrorKind getKind() {
        return kind;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    /**
     * @return The 0-based column, consistent with {@link TokenSpan#column()}.
     */
    public int getColumn() {
        return column;
    }
}
