package com.hashhunt.keyspace;

import com.hashhunt.config.ConfigurationException;

import java.util.HashSet;
import java.util.Set;

/**
 * The set of all strings of a fixed length over an ordered charset.
 *
 * Immutable after construction, so it is shared by all workers without locking.
 *
 * Example:
 *   Charset: "01"
 *   Length: 2
 *   Total: 2^2 = 4  ("00", "01", "10", "11")
 */
public final class SearchSpace {

    private final String charset;
    private final int length;
    private final long total;

    private SearchSpace(String charset, int length, long total) {
        this.charset = charset;
        this.length = length;
        this.total = total;
    }

    /**
     * Builds a search space, rejecting anything the indexer could not address.
     *
     * @param charset ordered distinct symbols
     * @param length candidate length, at least 1
     * @return the search space
     * @throws ConfigurationException if the charset is empty, repeats a symbol or
     *         holds a surrogate char; if the length is not positive; or if
     *         charset.length()^length overflows a long
     */
    public static SearchSpace of(String charset, int length) {
        if (charset == null || charset.isEmpty()) {
            throw new ConfigurationException("Charset cannot be empty");
        }
        if (length < 1) {
            throw new ConfigurationException("Pre-image length must be at least 1 (got: " + length + ")");
        }
        Set<Character> seen = new HashSet<>();
        for (int i = 0; i < charset.length(); i++) {
            // Candidates are built char by char, so a symbol must fit in one char
            if (Character.isSurrogate(charset.charAt(i))) {
                throw new ConfigurationException(String.format(
                    "Charset symbol at position %d is outside the Basic Multilingual Plane", i));
            }
            if (!seen.add(charset.charAt(i))) {
                throw new ConfigurationException(
                    "Charset contains duplicate symbol '" + charset.charAt(i) + "'");
            }
        }
        return new SearchSpace(charset, length, calculateTotal(charset.length(), length));
    }

    /**
     * base^length with exact overflow detection (no floating point).
     */
    private static long calculateTotal(int base, int length) {
        long result = 1;
        for (int i = 0; i < length; i++) {
            try {
                result = Math.multiplyExact(result, (long) base);
            } catch (ArithmeticException e) {
                throw new ConfigurationException(String.format(
                    "Keyspace too large: %d^%d exceeds Long.MAX_VALUE", base, length), e);
            }
        }
        return result;
    }

    // ==================== Getters ====================

    public String getCharset() {
        return charset;
    }

    public int getLength() {
        return length;
    }

    public int getBase() {
        return charset.length();
    }

    /**
     * @return number of candidates, charset.length()^length
     */
    public long getTotal() {
        return total;
    }

    @Override
    public String toString() {
        return String.format("SearchSpace[charset=%d symbols, length=%d, total=%,d]",
                             charset.length(), length, total);
    }
}
