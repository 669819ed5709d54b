package com.hashhunt.digest;

/**
 * Creates a fresh {@link DigestFunction} per worker.
 * Must be thread-safe; the functions it returns need not be.
 */
@FunctionalInterface
public interface DigestFunctionFactory {

    DigestFunction newInstance();
}
