package org.tessera.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur while tokenizing.
 * This decouples the test logic from the translated error messages.
 */
public enum LexerErrorCode {
    // region Scanning Errors
    /** No token rule matches at the current position. */
    UNMATCHED_CHARACTER,
    // endregion

    // region Literal Decoding Errors
    /** A text literal contains a backslash escape that is not in the escape table. */
    INVALID_ESCAPE,
    /** A numeric literal could not be decoded into a value. */
    INVALID_NUMERIC_LITERAL,
    /** A decoded region (text, label, path, URL) is not valid UTF-8. */
    INVALID_ENCODING,
    // endregion

    // region Source Errors
    /** The source exceeds the configured maximum size. */
    SOURCE_TOO_LARGE,
    /** An I/O error occurred while reading a file. */
    IO_ERROR_READING_FILE
    // endregion
}
