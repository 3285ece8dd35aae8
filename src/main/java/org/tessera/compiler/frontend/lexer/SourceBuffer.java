package org.tessera.compiler.frontend.lexer;

import org.tessera.compiler.api.LexerErrorCode;
import org.tessera.compiler.api.LexicalException;
import org.tessera.compiler.internal.i18n.Messages;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * The immutable source text being tokenized, held as raw UTF-8 bytes.
 * <p>
 * A buffer can be shared freely between any number of {@link Lexer} instances,
 * each of which scans it with its own cursor.
 */
public final class SourceBuffer {

    private final byte[] bytes;
    private final String fileName;

    private SourceBuffer(byte[] bytes, String fileName) {
        this.bytes = bytes;
        this.fileName = fileName;
    }

    /**
     * Creates a buffer from a copy of the given bytes.
     * @param bytes The UTF-8 encoded source.
     * @param fileName The logical file name, used in diagnostics.
     * @return The new buffer.
     */
    public static SourceBuffer of(byte[] bytes, String fileName) {
        return new SourceBuffer(Arrays.copyOf(bytes, bytes.length), fileName);
    }

    /**
     * Creates a buffer from the UTF-8 encoding of the given text.
     * @param source The source text.
     * @param fileName The logical file name, used in diagnostics.
     * @return The new buffer.
     */
    public static SourceBuffer of(String source, String fileName) {
        return new SourceBuffer(source.getBytes(StandardCharsets.UTF_8), fileName);
    }

    /**
     * Reads a source file completely into memory.
     *
     * @param path The file to read.
     * @param options The lexer options providing the size limit.
     * @return The new buffer, named after the given path.
     * @throws LexicalException if the file cannot be read or is larger than the configured limit.
     */
    public static SourceBuffer read(Path path, LexerOptions options) throws LexicalException {
        try {
            long size = Files.size(path);
            if (size > options.maxSourceBytes()) {
                throw new LexicalException(LexerErrorCode.SOURCE_TOO_LARGE,
                        Messages.get("source.tooLarge", path.toString(), String.valueOf(size), String.valueOf(options.maxSourceBytes())),
                        (Throwable) null);
            }
            return new SourceBuffer(Files.readAllBytes(path), path.toString());
        } catch (IOException e) {
            throw new LexicalException(LexerErrorCode.IO_ERROR_READING_FILE,
                    Messages.get("source.readError", path.toString(), e.getMessage()), e);
        }
    }

    /**
     * Reads a stream to its end.
     *
     * @param in The stream to read; it is not closed.
     * @param fileName The logical file name, used in diagnostics.
     * @param options The lexer options providing the size limit.
     * @return The new buffer.
     * @throws LexicalException if the stream cannot be read or is larger than the configured limit.
     */
    public static SourceBuffer read(InputStream in, String fileName, LexerOptions options) throws LexicalException {
        int limit = (int) Math.min(Integer.MAX_VALUE - 8, options.maxSourceBytes());
        try {
            byte[] bytes = in.readNBytes(limit + 1);
            if (bytes.length > limit) {
                throw new LexicalException(LexerErrorCode.SOURCE_TOO_LARGE,
                        Messages.get("source.tooLarge", fileName, "> " + limit, String.valueOf(options.maxSourceBytes())),
                        (Throwable) null);
            }
            return new SourceBuffer(bytes, fileName);
        } catch (IOException e) {
            throw new LexicalException(LexerErrorCode.IO_ERROR_READING_FILE,
                    Messages.get("source.readError", fileName, e.getMessage()), e);
        }
    }

    /**
     * @return The number of bytes in this buffer.
     */
    public int length() {
        return bytes.length;
    }

    /**
     * @return The logical file name of this source.
     */
    public String fileName() {
        return fileName;
    }

    /**
     * @param offset A byte offset.
     * @return The unsigned value of the byte at {@code offset}.
     */
    public int byteAt(int offset) {
        return bytes[offset] & 0xFF;
    }

    /**
     * Returns a fresh copy of the bytes in {@code [start, end)}.
     * @param start The first offset, inclusive.
     * @param end The last offset, exclusive.
     * @return A copy of the range.
     */
    public byte[] copyOfRange(int start, int end) {
        return Arrays.copyOfRange(bytes, start, end);
    }

    /**
     * Returns the text of a line for diagnostics. Malformed UTF-8 is replaced, never reported.
     * @param line The 1-based line number.
     * @return The line without its terminator, or an empty string if the line does not exist.
     */
    public String lineContent(int line) {
        int current = 1;
        int start = 0;
        while (current < line) {
            int newline = indexOf((byte) '\n', start);
            if (newline < 0) {
                return "";
            }
            start = newline + 1;
            current++;
        }
        int end = indexOf((byte) '\n', start);
        if (end < 0) {
            end = bytes.length;
        }
        if (end > start && bytes[end - 1] == '\r') {
            end--;
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    byte[] bytes() {
        return bytes;
    }

    private int indexOf(byte target, int from) {
        for (int i = from; i < bytes.length; i++) {
            if (bytes[i] == target) {
                return i;
            }
        }
        return -1;
    }
}
