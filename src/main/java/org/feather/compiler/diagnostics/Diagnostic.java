package org.feather.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * produced while processing a source file.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The 1-based line number of the issue.
 * @param columnNumber The 1-based column number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * @return The diagnostic as {@code <file>:<line>:<col>: <message>}.
     */
    @Override
    public String toString() {
        return String.format("%s:%d:%d: %s", fileName, lineNumber, columnNumber, message);
    }
}
