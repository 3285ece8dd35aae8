package org.tessera.compiler.frontend.lexer;

import org.tessera.compiler.api.LexerErrorCode;
import org.tessera.compiler.api.LexicalException;
import org.tessera.compiler.api.SourceInfo;

import java.nio.charset.StandardCharsets;

/**
 * The span of source matched by a token rule, handed to a literal decoder.
 *
 * @param source The buffer the span belongs to.
 * @param start The first byte offset of the span, inclusive.
 * @param end The last byte offset of the span, exclusive.
 * @param position The position of the first byte.
 */
public record Lexeme(SourceBuffer source, int start, int end, SourcePosition position) {

    /**
     * @return The number of bytes in the span.
     */
    public int length() {
        return end - start;
    }

    /**
     * @return A fresh copy of the matched bytes.
     */
    public byte[] bytes() {
        return source.copyOfRange(start, end);
    }

    /**
     * @return The matched bytes as text. Malformed UTF-8 is replaced; use for diagnostics only.
     */
    public String rawText() {
        return new String(source.bytes(), start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Computes the position of a byte inside the span.
     * @param index The index relative to {@link #start()}.
     * @return The position of that byte.
     */
    public SourcePosition positionOf(int index) {
        int line = position.line();
        int column = position.column();
        for (int i = start; i < start + index; i++) {
            int b = source.byteAt(i);
            if (b == '\n') {
                line++;
                column = 1;
            } else if ((b & 0xC0) != 0x80) {
                column++;
            }
        }
        return new SourcePosition(start + index, line, column);
    }

    /**
     * Creates an error located at a byte inside the span.
     *
     * @param index The index relative to {@link #start()}.
     * @param code The error code.
     * @param message The localized message.
     * @param fragment The offending piece of text.
     * @return The exception, ready to be thrown.
     */
    public LexicalException errorAt(int index, LexerErrorCode code, String message, String fragment) {
        SourcePosition at = positionOf(index);
        SourceInfo info = new SourceInfo(source.fileName(), at.line(), at.column(), fragment, source.lineContent(at.line()));
        return new LexicalException(code, message, info);
    }
}
