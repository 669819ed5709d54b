package com.hashhunt.event;

/**
 * Reports {@code delta} candidates processed since the worker's previous report.
 * The deltas of one worker add up exactly to the candidates it processed.
 */
public final class ProgressEvent implements SearchEvent {

    private final int workerId;
    private final long delta;
    private final long chunkSize;

    public ProgressEvent(int workerId, long delta, long chunkSize) {
        if (delta <= 0) {
            throw new IllegalArgumentException("delta must be positive: " + delta);
        }
        this.workerId = workerId;
        this.delta = delta;
        this.chunkSize = chunkSize;
    }

    @Override
    public int getWorkerId() {
        return workerId;
    }

    public long getDelta() {
        return delta;
    }

    public long getChunkSize() {
        return chunkSize;
    }

    @Override
    public String toString() {
        return String.format("ProgressEvent[worker=%d, +%d/%d]", workerId, delta, chunkSize);
    }
}
