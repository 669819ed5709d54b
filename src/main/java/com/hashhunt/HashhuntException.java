package com.hashhunt;

/**
 * Base class for every error raised by the search core.
 *
 * Unchecked on purpose: a failed search is aborted, never retried,
 * so callers only catch it at the outer edge (CLI, tests).
 */
public class HashhuntException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public HashhuntException(String message) {
        super(message);
    }

    public HashhuntException(String message, Throwable cause) {
        super(message, cause);
    }
}
