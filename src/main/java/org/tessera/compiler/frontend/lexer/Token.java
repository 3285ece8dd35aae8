package org.tessera.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Label, NaturalLit, Let).
 * @param text The exact text of the token from the source code.
 * @param value The decoded payload of the token, or {@code null} for fixed-text tokens.
 * @param start The byte offset of the first byte of the token.
 * @param end The byte offset just past the last byte of the token.
 * @param line The line number where the token begins.
 * @param column The column number where the token begins.
 * @param fileName The logical file name of the source this token was read from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int start,
        int end,
        int line,
        int column,
        String fileName
) {

    /**
     * @return The position at which this token begins.
     */
    public SourcePosition position() {
        return new SourcePosition(start, line, column);
    }

    @Override
    public String toString() {
        return String.format("%s %s '%s'", position(), type, TokenRenderer.render(this));
    }
}
