package org.tessera.compiler.frontend.lexer.decode;

import org.tessera.compiler.api.LexerErrorCode;
import org.tessera.compiler.api.LexicalException;
import org.tessera.compiler.frontend.lexer.Lexeme;
import org.tessera.compiler.internal.i18n.Messages;

import java.nio.charset.StandardCharsets;

/**
 * Decodes double-quoted text literals, resolving escapes through {@link TextEscapes}.
 */
public final class TextLiteralDecoder {

    private TextLiteralDecoder() {}

    /**
     * Strips the quotes of a text literal and resolves its escapes.
     *
     * @param lexeme The matched literal, quotes included.
     * @return The decoded text.
     * @throws LexicalException on an unknown or truncated escape, or on malformed UTF-8.
     */
    public static String decode(Lexeme lexeme) throws LexicalException {
        byte[] bytes = lexeme.bytes();
        int last = bytes.length - 1;
        if (bytes.length < 2 || bytes[0] != '"' || bytes[last] != '"') {
            throw lexeme.errorAt(0, LexerErrorCode.INVALID_ESCAPE,
                    Messages.get("lexer.invalidEscape", lexeme.rawText()), lexeme.rawText());
        }

        StringBuilder sb = new StringBuilder(bytes.length);
        int runStart = 1;
        int i = 1;
        while (i < last) {
            if (bytes[i] != '\\') {
                i++;
                continue;
            }
            sb.append(Utf8.decode(lexeme, bytes, runStart, i, "text"));
            if (i + 1 >= last) {
                throw invalidEscape(lexeme, bytes, i, last);
            }
            int c = bytes[i + 1] & 0xFF;
            if (c == 'u') {
                sb.append(unicodeEscape(lexeme, bytes, i, last));
                i += 6;
            } else {
                int unescaped = TextEscapes.unescape(c);
                if (unescaped < 0) {
                    throw invalidEscape(lexeme, bytes, i, last);
                }
                sb.append((char) unescaped);
                i += 2;
            }
            runStart = i;
        }
        sb.append(Utf8.decode(lexeme, bytes, runStart, last, "text"));
        return sb.toString();
    }

    private static char unicodeEscape(Lexeme lexeme, byte[] bytes, int backslash, int last) throws LexicalException {
        int end = Math.min(backslash + 6, last);
        String escape = new String(bytes, backslash, end - backslash, StandardCharsets.US_ASCII);
        if (end - backslash < 6) {
            throw lexeme.errorAt(backslash, LexerErrorCode.INVALID_ESCAPE,
                    Messages.get("lexer.invalidUnicodeEscape", escape), escape);
        }
        int value = 0;
        for (int k = backslash + 2; k < end; k++) {
            int digit = Character.digit(bytes[k] & 0xFF, 16);
            if (digit < 0) {
                throw lexeme.errorAt(backslash, LexerErrorCode.INVALID_ESCAPE,
                        Messages.get("lexer.invalidUnicodeEscape", escape), escape);
            }
            value = value * 16 + digit;
        }
        return (char) value;
    }

    private static LexicalException invalidEscape(Lexeme lexeme, byte[] bytes, int backslash, int last) {
        int end = Math.min(backslash + 2, last);
        // Take the whole character after the backslash, however many bytes it has.
        while (end < last && (bytes[end] & 0xC0) == 0x80) {
            end++;
        }
        String escape = new String(bytes, backslash, end - backslash, StandardCharsets.UTF_8);
        return lexeme.errorAt(backslash, LexerErrorCode.INVALID_ESCAPE, Messages.get("lexer.invalidEscape", escape), escape);
    }
}
