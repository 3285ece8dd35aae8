package org.tessera.compiler.frontend.lexer;

import org.tessera.compiler.api.LexicalException;

/**
 * A pull-based source of tokens, as consumed by a parser.
 */
public interface ITokenSource {

    /**
     * Produces the next token. Once the input is exhausted, every call returns a token of type
     * {@link TokenType#END_OF_INPUT}.
     *
     * @return The next token, never {@code null}.
     * @throws LexicalException if the input at the current position cannot be tokenized.
     */
    Token nextToken() throws LexicalException;
}
