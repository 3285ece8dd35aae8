package org.tessera.compiler.frontend.lexer.decode;

import org.tessera.compiler.api.LexicalException;
import org.tessera.compiler.frontend.lexer.Lexeme;

/**
 * Decodes file literals. The text is kept exactly as written: no separator is rewritten,
 * no slash collapsed and nothing resolved against the filesystem. Turning it into a
 * {@link java.nio.file.Path} is up to whoever resolves the import.
 */
public final class PathLiteralDecoder {

    private PathLiteralDecoder() {}

    /**
     * Decodes a file literal. {@code /a} and {@code ../a} are kept as written,
     * {@code ./a} loses its {@code ./} prefix.
     *
     * @param lexeme The matched file literal.
     * @return The path text.
     * @throws LexicalException if the literal is not valid UTF-8.
     */
    public static String decode(Lexeme lexeme) throws LexicalException {
        byte[] bytes = lexeme.bytes();
        int from = bytes.length > 2 && bytes[0] == '.' && bytes[1] == '/' ? 2 : 0;
        return Utf8.decode(lexeme, bytes, from, bytes.length, "file");
    }
}
