package com.hashhunt.keyspace;

/**
 * Maps keyspace indices to candidate strings and back.
 *
 * The index is read as a mixed-radix number in base {@code charset.length()}:
 * digits are extracted right-to-left by repeated modulo and division and each
 * digit is mapped through the charset. Most significant symbol comes first.
 *
 * Example (charset="abc", length=3):
 *   Index 0  → "aaa"
 *   Index 1  → "aab"
 *   Index 3  → "aba"
 *   Index 26 → "ccc"
 *
 * Any index can be decoded directly, so a worker starts its chunk at an
 * arbitrary offset without iterating from zero.
 */
public final class Indexer {

    private Indexer() {
    }

    /**
     * @param space the keyspace
     * @param index position in {@code [0, space.getTotal())}
     * @return candidate of length {@code space.getLength()}
     * @throws IndexOutOfRangeException if the index is outside the keyspace
     */
    public static String decode(SearchSpace space, long index) {
        char[] buffer = new char[space.getLength()];
        decodeInto(space, index, buffer);
        return new String(buffer);
    }

    /**
     * Same as {@link #decode} but writes into a caller-owned buffer.
     * Workers reuse one buffer for a whole chunk.
     *
     * @param buffer array of exactly {@code space.getLength()} chars
     * @throws IllegalArgumentException if the buffer has any other length
     */
    public static void decodeInto(SearchSpace space, long index, char[] buffer) {
        if (buffer.length != space.getLength()) {
            throw new IllegalArgumentException(String.format(
                "Buffer length %d does not match candidate length %d", buffer.length, space.getLength()));
        }
        if (index < 0 || index >= space.getTotal()) {
            throw new IndexOutOfRangeException(index, space.getTotal());
        }
        String charset = space.getCharset();
        int base = charset.length();

        for (int i = buffer.length - 1; i >= 0; i--) {
            buffer[i] = charset.charAt((int) (index % base));
            index /= base;
        }
    }

    /**
     * Inverse of {@link #decode}.
     *
     * @param space the keyspace
     * @param candidate string of {@code space.getLength()} symbols from the charset
     * @return index of the candidate
     * @throws IllegalArgumentException if the candidate has the wrong length
     *         or a symbol outside the charset
     */
    public static long encode(SearchSpace space, String candidate) {
        if (candidate == null || candidate.length() != space.getLength()) {
            throw new IllegalArgumentException(
                "Candidate must have length " + space.getLength() + ": " + candidate);
        }
        String charset = space.getCharset();
        long index = 0;

        for (int i = 0; i < candidate.length(); i++) {
            int digit = charset.indexOf(candidate.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException(
                    "Symbol '" + candidate.charAt(i) + "' not in charset");
            }
            index = index * charset.length() + digit;
        }
        return index;
    }
}
