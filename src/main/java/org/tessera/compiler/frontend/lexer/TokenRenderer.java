package org.tessera.compiler.frontend.lexer;

import org.tessera.compiler.frontend.lexer.decode.TextEscapes;

/**
 * Converts tokens back into canonical source text for diagnostics.
 * <p>
 * Rendering never fails. Fixed-text tokens use the ASCII spelling even if they were written
 * with the Unicode alternative, e.g. {@code λ} renders as {@code \}.
 */
public final class TokenRenderer {

    private TokenRenderer() {}

    /**
     * @param token The token to render.
     * @return The canonical text of the token.
     */
    public static String render(Token token) {
        return render(token.type(), token.value());
    }

    /**
     * @param type The token type.
     * @param value The payload, as produced by the lexer for that type.
     * @return The canonical text of a token with that type and payload.
     */
    public static String render(TokenType type, Object value) {
        if (type.isFixedText()) {
            return type.spelling();
        }
        return switch (type) {
            case TEXT_LIT -> TextEscapes.quote(String.valueOf(value));
            case NATURAL_LIT -> "+" + value;
            case END_OF_INPUT -> "";
            default -> String.valueOf(value);
        };
    }
}
