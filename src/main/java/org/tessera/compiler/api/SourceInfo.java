package org.tessera.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 * @param fragment The offending piece of source text, may be empty.
 * @param lineContent The content of the line, may be empty.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, String fragment, String lineContent) {

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
    }
}
