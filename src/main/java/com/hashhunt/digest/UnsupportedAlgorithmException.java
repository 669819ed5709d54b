package com.hashhunt.digest;

import com.hashhunt.config.ConfigurationException;

/**
 * Raised when a hash algorithm name does not resolve to a {@link HashAlgorithm}.
 */
public class UnsupportedAlgorithmException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String algorithmName;

    public UnsupportedAlgorithmException(String algorithmName) {
        super("Unsupported hash algorithm: " + algorithmName + " (supported: MD5, SHA-1, SHA-256)");
        this.algorithmName = algorithmName;
    }

    public String getAlgorithmName() {
        return algorithmName;
    }
}
