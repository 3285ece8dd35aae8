package org.tessera.compiler.diagnostics;

/**
 * A single error reported while a source file was tokenized.
 *
 * @param message The localized message, without position.
 * @param fileName The name of the file where the error occurred.
 * @param lineNumber The line number of the error.
 * @param columnNumber The column number of the error.
 */
public record Diagnostic(
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    @Override
    public String toString() {
        return String.format("%s:%d:%d: %s", fileName, lineNumber, columnNumber, message);
    }
}
