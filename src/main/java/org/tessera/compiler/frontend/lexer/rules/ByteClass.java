package org.tessera.compiler.frontend.lexer.rules;

/**
 * An immutable set of byte values, used as the alphabet of a {@link ITokenPattern}.
 */
public final class ByteClass {

    /** Every byte value. */
    public static final ByteClass ANY = new ByteClass(new boolean[256]).negate();

    private final boolean[] members;

    private ByteClass(boolean[] members) {
        this.members = members;
    }

    /**
     * @param chars ASCII characters that belong to the class.
     * @return The class containing exactly the given characters.
     */
    public static ByteClass of(String chars) {
        boolean[] members = new boolean[256];
        for (int i = 0; i < chars.length(); i++) {
            char c = chars.charAt(i);
            if (c > 0x7F) {
                throw new IllegalArgumentException("Byte classes are defined over ASCII, got: " + c);
            }
            members[c] = true;
        }
        return new ByteClass(members);
    }

    /**
     * @param from The first byte value, inclusive.
     * @param to The last byte value, inclusive.
     * @return The class containing every byte in the range.
     */
    public static ByteClass range(int from, int to) {
        boolean[] members = new boolean[256];
        for (int b = from; b <= to; b++) {
            members[b] = true;
        }
        return new ByteClass(members);
    }

    /**
     * @param other Another class.
     * @return The union of this class and {@code other}.
     */
    public ByteClass or(ByteClass other) {
        boolean[] union = new boolean[256];
        for (int b = 0; b < 256; b++) {
            union[b] = members[b] || other.members[b];
        }
        return new ByteClass(union);
    }

    /**
     * @param other Another class.
     * @return The bytes of this class that are not in {@code other}.
     */
    public ByteClass except(ByteClass other) {
        boolean[] difference = new boolean[256];
        for (int b = 0; b < 256; b++) {
            difference[b] = members[b] && !other.members[b];
        }
        return new ByteClass(difference);
    }

    /**
     * @return The complement of this class.
     */
    public ByteClass negate() {
        boolean[] complement = new boolean[256];
        for (int b = 0; b < 256; b++) {
            complement[b] = !members[b];
        }
        return new ByteClass(complement);
    }

    /**
     * @param b An unsigned byte value.
     * @return {@code true} if the byte belongs to this class.
     */
    public boolean contains(int b) {
        return members[b & 0xFF];
    }
}
