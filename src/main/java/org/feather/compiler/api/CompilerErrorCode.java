package org.feather.compiler.api;

/**
 * Defines unique, testable error codes for all errors the front end can report.
 * This decouples the test logic from the wording of the messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** An interpolated string was not closed before the end of the file. */
    UNTERMINATED_INTERPOLATED_STRING,
    /** A string literal was not closed before the end of the file. */
    UNTERMINATED_STRING,
    /** A character literal was not closed before the end of the file. */
    UNTERMINATED_CHAR,
    /** An opening parenthesis was never matched. */
    UNCLOSED_PARENTHESIS,
    /** An opening bracket was never matched. */
    UNCLOSED_BRACKET,
    /** An opening brace was never matched. */
    UNCLOSED_BRACE,
    /** The input matched no token pattern. */
    UNRECOGNIZED_TOKEN,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a file. */
    IO_ERROR_READING_FILE
    // endregion
}
