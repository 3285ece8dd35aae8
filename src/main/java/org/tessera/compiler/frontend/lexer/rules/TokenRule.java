package org.tessera.compiler.frontend.lexer.rules;

import org.tessera.compiler.frontend.lexer.TokenType;

/**
 * One entry of the {@link TokenRuleTable}.
 *
 * @param name A name for logging and diagnostics.
 * @param pattern The pattern this rule matches.
 * @param type The type of the produced token, or {@code null} for trivia that produces no token.
 * @param decoder The payload decoder, or {@code null} for tokens without payload.
 */
public record TokenRule(String name, ITokenPattern pattern, TokenType type, ILiteralDecoder decoder) {

    /**
     * Creates a rule for a fixed-text token.
     * @param type The token type.
     * @param spellings Every accepted spelling of the token.
     * @return The rule.
     */
    public static TokenRule fixed(TokenType type, String... spellings) {
        ITokenPattern[] alternatives = new ITokenPattern[spellings.length];
        for (int i = 0; i < spellings.length; i++) {
            alternatives[i] = Patterns.literal(spellings[i]);
        }
        ITokenPattern pattern = alternatives.length == 1 ? alternatives[0] : Patterns.anyOf(alternatives);
        return new TokenRule(type.name(), pattern, type, null);
    }

    /**
     * Creates a rule for a token that carries a decoded payload.
     * @param type The token type.
     * @param pattern The pattern.
     * @param decoder The payload decoder.
     * @return The rule.
     */
    public static TokenRule literal(TokenType type, ITokenPattern pattern, ILiteralDecoder decoder) {
        return new TokenRule(type.name(), pattern, type, decoder);
    }

    /**
     * Creates a rule whose matches are consumed and discarded.
     * @param name The name of the rule.
     * @param pattern The pattern.
     * @return The rule.
     */
    public static TokenRule trivia(String name, ITokenPattern pattern) {
        return new TokenRule(name, pattern, null, null);
    }

    /**
     * @return {@code true} if this rule produces no token.
     */
    public boolean isTrivia() {
        return type == null;
    }
}
