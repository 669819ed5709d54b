package com.hashhunt.task;

/**
 * Read side of the cooperative cancellation signal, polled by workers.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();
}
