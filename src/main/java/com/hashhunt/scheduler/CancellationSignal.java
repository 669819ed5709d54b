package com.hashhunt.scheduler;

import com.hashhunt.task.CancellationToken;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Write-once broadcast flag: raised by the coordinator, observed by every
 * worker, never reset.
 */
public final class CancellationSignal implements CancellationToken {

    private final AtomicBoolean raised = new AtomicBoolean(false);

    /**
     * Raises the signal. Idempotent.
     *
     * @return true only for the call that actually raised it
     */
    public boolean raise() {
        return raised.compareAndSet(false, true);
    }

    @Override
    public boolean isCancellationRequested() {
        return raised.get();
    }
}
