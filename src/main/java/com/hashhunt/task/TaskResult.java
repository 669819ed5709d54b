package com.hashhunt.task;

import com.hashhunt.keyspace.Chunk;

/**
 * Terminal state of one worker.
 *
 * 3 possible states:
 * - completed, the whole chunk was searched
 * - cancelled, the worker observed cancellation and stopped early
 * - failure, the worker body threw; its chunk is not fully covered
 *
 * Matches are not carried here: they are streamed as events while the worker runs.
 */
public final class TaskResult {

    /**
     * Enum to represent the status of a TaskResult.
     */
    public enum Status {
        COMPLETED,
        CANCELLED,
        FAILURE
    }

    private final Chunk chunk;
    private final Status status;
    private final long processed;
    private final int matches;
    private final Throwable cause;
    private final long executionTimeMs;

    /**
     * Private constructor - use factory methods.
     */
    private TaskResult(Chunk chunk, Status status, long processed, int matches,
                       Throwable cause, long executionTimeMs) {
        this.chunk = chunk;
        this.status = status;
        this.processed = processed;
        this.matches = matches;
        this.cause = cause;
        this.executionTimeMs = executionTimeMs;
    }

    // ==================== Factory Methods ====================

    public static TaskResult completed(Chunk chunk, long processed, int matches, long executionTimeMs) {
        return new TaskResult(chunk, Status.COMPLETED, processed, matches, null, executionTimeMs);
    }

    /**
     * @param processed candidates processed before the worker stopped
     */
    public static TaskResult cancelled(Chunk chunk, long processed, int matches, long executionTimeMs) {
        return new TaskResult(chunk, Status.CANCELLED, processed, matches, null, executionTimeMs);
    }

    public static TaskResult failure(Chunk chunk, Throwable cause) {
        return new TaskResult(chunk, Status.FAILURE, 0, 0, cause, 0);
    }

    // ==================== Getters ====================

    public Chunk getChunk() {
        return chunk;
    }

    public int getWorkerId() {
        return chunk.getWorkerId();
    }

    public Status getStatus() {
        return status;
    }

    public long getProcessed() {
        return processed;
    }

    public int getMatches() {
        return matches;
    }

    public Throwable getCause() {
        return cause;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    // ==================== Convenience Methods ====================

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    @Override
    public String toString() {
        switch (status) {
            case COMPLETED:
                return String.format("TaskResult[worker=%d: COMPLETED, processed=%d, matches=%d, time=%dms]",
                    getWorkerId(), processed, matches, executionTimeMs);
            case CANCELLED:
                return String.format("TaskResult[worker=%d: CANCELLED, processed=%d/%d, matches=%d, time=%dms]",
                    getWorkerId(), processed, chunk.size(), matches, executionTimeMs);
            case FAILURE:
                return String.format("TaskResult[worker=%d: FAILURE, error=%s]", getWorkerId(), cause);
            default:
                return String.format("TaskResult[worker=%d: %s]", getWorkerId(), status);
        }
    }
}
