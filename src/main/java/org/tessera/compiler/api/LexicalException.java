package org.tessera.compiler.api;

/**
 * An exception that is thrown when the source cannot be tokenized.
 * <p>
 * Lexical errors are fatal: the lexer that raised one does not resume scanning.
 * The exception carries a stable {@link LexerErrorCode} and the position of the
 * offending input so that a hosting tool can render a diagnostic.
 */
public class LexicalException extends Exception {

    private final LexerErrorCode errorCode;
    private final String reason;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new lexical exception without source information.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The cause, may be null.
     */
    public LexicalException(LexerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.reason = message;
        this.sourceInfo = null;
    }

    /**
     * Constructs a new lexical exception with the specified detail message and source information.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The position of the offending input.
     */
    public LexicalException(LexerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(String.format("%s at %s", message, sourceInfo), null);
        this.errorCode = errorCode;
        this.reason = message;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The error code of this failure.
     */
    public LexerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The localized message without the position suffix.
     */
    public String getReason() {
        return reason;
    }

    /**
     * @return The position of the offending input, or {@code null} if the error is not tied to a position.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
