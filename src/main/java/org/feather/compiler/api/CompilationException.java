package org.feather.compiler.api;

/**
 * An exception that is thrown when a source file cannot be processed.
 * <p>
 * It is part of the public API and hides the internal exception types of the front end.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with an error code and the position of the error.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The source information, or {@code null} if the error has no position.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The position of the error, or {@code null} if it has none (e.g. an I/O error).
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
