package org.tessera.compiler.frontend.lexer.decode;

import org.tessera.compiler.api.LexerErrorCode;
import org.tessera.compiler.api.LexicalException;
import org.tessera.compiler.frontend.lexer.Lexeme;
import org.tessera.compiler.internal.i18n.Messages;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Decoders for natural, integer and double literals.
 * <p>
 * Integers have no width limit. Every decoder re-validates its input instead of trusting
 * the rule that selected it.
 */
public final class NumericLiteralDecoder {

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    private static final Pattern DOUBLE = Pattern.compile("[0-9]+(\\.[0-9]+)?([eE][+-]?[0-9]+)?");

    private NumericLiteralDecoder() {}

    /**
     * Decodes an unsigned digit run.
     * @param lexeme The matched number.
     * @return The value.
     * @throws LexicalException if the lexeme is not a digit run.
     */
    public static BigInteger decodeNumber(Lexeme lexeme) throws LexicalException {
        return parseDigits(lexeme, ascii(lexeme), 0);
    }

    /**
     * Decodes a natural literal such as {@code +42}.
     * @param lexeme The matched natural, including the leading {@code +}.
     * @return The value without sign.
     * @throws LexicalException if the lexeme is not a {@code +} followed by a digit run.
     */
    public static BigInteger decodeNatural(Lexeme lexeme) throws LexicalException {
        String text = ascii(lexeme);
        if (!text.startsWith("+")) {
            throw invalid(lexeme, text);
        }
        return parseDigits(lexeme, text, 1);
    }

    /**
     * Decodes a double literal into the nearest 64-bit float.
     * @param lexeme The matched double.
     * @return The value.
     * @throws LexicalException if the lexeme is malformed or its value is not finite.
     */
    public static Double decodeDouble(Lexeme lexeme) throws LexicalException {
        String text = ascii(lexeme);
        if (!DOUBLE.matcher(text).matches()) {
            throw invalid(lexeme, text);
        }
        double value = Double.parseDouble(text);
        if (Double.isInfinite(value)) {
            throw lexeme.errorAt(0, LexerErrorCode.INVALID_NUMERIC_LITERAL, Messages.get("lexer.numberOutOfRange", text), text);
        }
        return value;
    }

    private static BigInteger parseDigits(Lexeme lexeme, String text, int from) throws LexicalException {
        String digits = text.substring(from);
        if (!DIGITS.matcher(digits).matches()) {
            throw invalid(lexeme, text);
        }
        return new BigInteger(digits);
    }

    private static String ascii(Lexeme lexeme) {
        // Non-ASCII bytes decode to U+FFFD and then fail validation.
        return new String(lexeme.bytes(), StandardCharsets.US_ASCII);
    }

    private static LexicalException invalid(Lexeme lexeme, String text) {
        return lexeme.errorAt(0, LexerErrorCode.INVALID_NUMERIC_LITERAL, Messages.get("lexer.invalidNumber", text), text);
    }
}
