package org.tessera.compiler.frontend.lexer;

/**
 * The mutable scan position of a {@link Lexer} over its {@link SourceBuffer}.
 * <p>
 * A newline increments the line and resets the column. Every other character
 * increments the column by one; UTF-8 continuation bytes belong to the character
 * that started them and do not advance the column.
 * Not thread-safe, owned by exactly one lexer.
 */
final class Cursor {

    private int offset = 0;
    private int line = 1;
    private int column = 1;

    int offset() {
        return offset;
    }

    /**
     * Moves the cursor over {@code length} bytes of {@code bytes} starting at the current offset.
     */
    void advance(byte[] bytes, int length) {
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            int b = bytes[i] & 0xFF;
            if (b == '\n') {
                line++;
                column = 1;
            } else if ((b & 0xC0) != 0x80) {
                column++;
            }
        }
        offset = end;
    }

    SourcePosition snapshot() {
        return new SourcePosition(offset, line, column);
    }
}
