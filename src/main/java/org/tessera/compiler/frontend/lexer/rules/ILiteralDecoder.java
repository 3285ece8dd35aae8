package org.tessera.compiler.frontend.lexer.rules;

import org.tessera.compiler.api.LexicalException;
import org.tessera.compiler.frontend.lexer.Lexeme;

/**
 * Converts the span matched by a {@link TokenRule} into the payload of its token.
 */
@FunctionalInterface
public interface ILiteralDecoder {

    /**
     * Decodes the matched span. Implementations must not assume the span is well-formed.
     *
     * @param lexeme The matched span.
     * @return The decoded value, never aliasing the source buffer.
     * @throws LexicalException if the span cannot be decoded.
     */
    Object decode(Lexeme lexeme) throws LexicalException;
}
