package org.tessera.compiler.frontend.lexer.decode;

import org.tessera.compiler.api.LexerErrorCode;
import org.tessera.compiler.api.LexicalException;
import org.tessera.compiler.frontend.lexer.Lexeme;
import org.tessera.compiler.internal.i18n.Messages;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 decoding of lexeme regions. Malformed input is reported at the first bad byte.
 */
final class Utf8 {

    private Utf8() {}

    /**
     * Decodes {@code bytes[from, to)}, which were copied from {@code lexeme}.
     *
     * @param lexeme The lexeme the bytes belong to, used for error positions.
     * @param bytes A copy of the lexeme bytes.
     * @param from The first index, inclusive.
     * @param to The last index, exclusive.
     * @param kind The kind of literal, named in the error message.
     * @return The decoded text.
     * @throws LexicalException if the region is not valid UTF-8.
     */
    static String decode(Lexeme lexeme, byte[] bytes, int from, int to, String kind) throws LexicalException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes, from, to - from);
        CharBuffer out = CharBuffer.allocate(to - from);
        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        if (result.isError()) {
            int bad = in.position();
            throw lexeme.errorAt(bad, LexerErrorCode.INVALID_ENCODING,
                    Messages.get("lexer.invalidEncoding", kind),
                    String.format("0x%02X", bytes[bad] & 0xFF));
        }
        out.flip();
        return out.toString();
    }
}
