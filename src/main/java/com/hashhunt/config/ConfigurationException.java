package com.hashhunt.config;

import com.hashhunt.HashhuntException;

/**
 * Invalid search configuration: bad worker count, charset, length (including
 * keyspace overflow), target digests or input file.
 * Always reported before any worker starts.
 */
public class ConfigurationException extends HashhuntException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
