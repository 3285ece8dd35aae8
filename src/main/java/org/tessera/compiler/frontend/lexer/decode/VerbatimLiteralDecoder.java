package org.tessera.compiler.frontend.lexer.decode;

import org.tessera.compiler.api.LexicalException;
import org.tessera.compiler.frontend.lexer.Lexeme;

/**
 * Decoders for literals whose payload is their own source text.
 */
public final class VerbatimLiteralDecoder {

    private VerbatimLiteralDecoder() {}

    /**
     * Decodes a label: a bare name or a parenthesized operator such as {@code (+)}.
     * @param lexeme The matched label.
     * @return The label text, parentheses included for operators.
     * @throws LexicalException if the label is not valid UTF-8.
     */
    public static String decodeLabel(Lexeme lexeme) throws LexicalException {
        byte[] bytes = lexeme.bytes();
        return Utf8.decode(lexeme, bytes, 0, bytes.length, "label");
    }

    /**
     * Decodes a URL, scheme included.
     * @param lexeme The matched URL.
     * @return The URL text.
     * @throws LexicalException if the URL is not valid UTF-8.
     */
    public static String decodeUrl(Lexeme lexeme) throws LexicalException {
        byte[] bytes = lexeme.bytes();
        return Utf8.decode(lexeme, bytes, 0, bytes.length, "URL");
    }
}
