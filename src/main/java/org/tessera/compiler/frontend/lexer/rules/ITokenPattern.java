package org.tessera.compiler.frontend.lexer.rules;

/**
 * A byte-level pattern that a {@link TokenRule} matches against the source.
 */
@FunctionalInterface
public interface ITokenPattern {

    /** Returned by {@link #match} when the pattern does not match at all. */
    int NO_MATCH = -1;

    /**
     * Computes the longest prefix of the input at {@code offset} that this pattern matches.
     *
     * @param input The complete source bytes. Must not be modified.
     * @param offset The offset at which matching starts.
     * @return The length of the match (possibly 0), or {@link #NO_MATCH}.
     */
    int match(byte[] input, int offset);
}
