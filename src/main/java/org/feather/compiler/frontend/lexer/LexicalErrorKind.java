package org.feather.compiler.frontend.lexer;

/**
 * The lexical errors that abort a scan. Every one of them is fatal for the file.
 */
public enum LexicalErrorKind {
    UNTERMINATED_INTERPOLATED_STRING("Unfinished interpolated string"),
    UNTERMINATED_STRING("Unfinished string"),
    UNTERMINATED_CHAR("Unfinished char"),
    UNCLOSED_PARENTHESIS("Unclosed parenthesis"),
    UNCLOSED_BRACKET("Unclosed bracket"),
    UNCLOSED_BRACE("Unclosed brace"),
    UNRECOGNIZED_TOKEN("Cannot parse token");

    private final String message;

    LexicalErrorKind(String message) {
        this.message = message;
    }

    /**
     * @return The human-readable diagnostic text.
     */
    public String message() {
        return message;
    }
}
