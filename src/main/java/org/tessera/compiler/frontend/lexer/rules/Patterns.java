package org.tessera.compiler.frontend.lexer.rules;

import java.nio.charset.StandardCharsets;

/**
 * Factory for the pattern combinators the rule table is written in.
 * <p>
 * Sequences and repetitions consume greedily. The token grammars built from them never need to
 * give input back, so the greedy match is the longest one.
 */
public final class Patterns {

    private Patterns() {}

    /**
     * @param text The exact text, encoded as UTF-8.
     * @return A pattern matching exactly that text.
     */
    public static ITokenPattern literal(String text) {
        byte[] expected = text.getBytes(StandardCharsets.UTF_8);
        return (input, offset) -> {
            if (offset + expected.length > input.length) {
                return ITokenPattern.NO_MATCH;
            }
            for (int i = 0; i < expected.length; i++) {
                if (input[offset + i] != expected[i]) {
                    return ITokenPattern.NO_MATCH;
                }
            }
            return expected.length;
        };
    }

    /**
     * @param bytes The accepted bytes.
     * @return A pattern matching exactly one byte of the class.
     */
    public static ITokenPattern single(ByteClass bytes) {
        return (input, offset) -> offset < input.length && bytes.contains(input[offset]) ? 1 : ITokenPattern.NO_MATCH;
    }

    /**
     * @param bytes The accepted bytes.
     * @return A pattern matching one or more bytes of the class.
     */
    public static ITokenPattern run(ByteClass bytes) {
        return (input, offset) -> {
            int length = countRun(bytes, input, offset);
            return length > 0 ? length : ITokenPattern.NO_MATCH;
        };
    }

    /**
     * @param bytes The accepted bytes.
     * @return A pattern matching zero or more bytes of the class.
     */
    public static ITokenPattern optionalRun(ByteClass bytes) {
        return (input, offset) -> countRun(bytes, input, offset);
    }

    /**
     * @param alternatives The alternatives.
     * @return A pattern matching the longest of the alternatives.
     */
    public static ITokenPattern anyOf(ITokenPattern... alternatives) {
        return (input, offset) -> {
            int best = ITokenPattern.NO_MATCH;
            for (ITokenPattern alternative : alternatives) {
                best = Math.max(best, alternative.match(input, offset));
            }
            return best;
        };
    }

    /**
     * @param parts The parts, matched one after another.
     * @return A pattern matching all parts in order.
     */
    public static ITokenPattern sequence(ITokenPattern... parts) {
        return (input, offset) -> {
            int position = offset;
            for (ITokenPattern part : parts) {
                int length = part.match(input, position);
                if (length == ITokenPattern.NO_MATCH) {
                    return ITokenPattern.NO_MATCH;
                }
                position += length;
            }
            return position - offset;
        };
    }

    /**
     * @param pattern The optional pattern.
     * @return A pattern matching {@code pattern} or the empty string.
     */
    public static ITokenPattern optional(ITokenPattern pattern) {
        return (input, offset) -> Math.max(0, pattern.match(input, offset));
    }

    /**
     * @param pattern The repeated pattern.
     * @return A pattern matching {@code pattern} zero or more times.
     */
    public static ITokenPattern zeroOrMore(ITokenPattern pattern) {
        return (input, offset) -> {
            int position = offset;
            int length;
            while ((length = pattern.match(input, position)) > 0) {
                position += length;
            }
            return position - offset;
        };
    }

    private static int countRun(ByteClass bytes, byte[] input, int offset) {
        int position = offset;
        while (position < input.length && bytes.contains(input[position])) {
            position++;
        }
        return position - offset;
    }
}
