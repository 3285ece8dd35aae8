package org.tessera.compiler.frontend.lexer.decode;

/**
 * The escape table of text literals, shared by decoding and re-quoting.
 * <p>
 * Besides the single-character escapes below, {@code \}{@code uXXXX} denotes a UTF-16 code unit
 * given as four hex digits.
 */
public final class TextEscapes {

    private TextEscapes() {}

    /**
     * Resolves a single-character escape.
     * @param c The character following the backslash.
     * @return The escaped character, or {@code -1} if {@code c} is not in the table.
     */
    public static int unescape(int c) {
        return switch (c) {
            case '"' -> '"';
            case '\\' -> '\\';
            case '\'' -> '\'';
            case '/' -> '/';
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'a' -> 0x07;
            case 'v' -> 0x0B;
            case '0' -> 0x00;
            default -> -1;
        };
    }

    /**
     * Renders a string as a text literal that decodes back to the same string.
     * @param value The decoded text.
     * @return The quoted and escaped literal.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case 0x07 -> sb.append("\\a");
                case 0x0B -> sb.append("\\v");
                case 0x00 -> sb.append("\\0");
                default -> {
                    if (c < 0x20 || c == 0x7F) {
                        sb.append(String.format("\\u%04X", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
