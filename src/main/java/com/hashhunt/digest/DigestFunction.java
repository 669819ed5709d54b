package com.hashhunt.digest;

/**
 * Computes the lower-case hex digest of a candidate.
 *
 * Instances are NOT required to be thread-safe: each worker obtains its own
 * from a {@link DigestFunctionFactory}.
 */
@FunctionalInterface
public interface DigestFunction {

    /**
     * @param candidate plain-text candidate
     * @return lower-case hex digest
     */
    String digest(String candidate);
}
