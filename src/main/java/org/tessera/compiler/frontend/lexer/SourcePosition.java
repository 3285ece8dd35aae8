package org.tessera.compiler.frontend.lexer;

/**
 * An immutable snapshot of a scan position.
 *
 * @param offset The 0-based byte offset into the source buffer.
 * @param line The 1-based line number.
 * @param column The 1-based column number, counted in characters.
 */
public record SourcePosition(int offset, int line, int column) {

    /** The position of the first byte of any source. */
    public static final SourcePosition START = new SourcePosition(0, 1, 1);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
