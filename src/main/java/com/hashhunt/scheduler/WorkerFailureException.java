package com.hashhunt.scheduler;

import com.hashhunt.HashhuntException;
import com.hashhunt.keyspace.Chunk;

/**
 * A worker terminated abnormally, so part of the keyspace was not searched.
 * Fatal to the whole search.
 */
public class WorkerFailureException extends HashhuntException {

    private static final long serialVersionUID = 1L;

    private final transient Chunk chunk;

    public WorkerFailureException(Chunk chunk, Throwable cause) {
        super(String.format("Worker %d failed, range [%d, %d) not fully searched: %s",
                            chunk.getWorkerId(), chunk.getStartIndex(), chunk.getEndIndex(), cause), cause);
        this.chunk = chunk;
    }

    public Chunk getChunk() {
        return chunk;
    }

    public int getWorkerId() {
        return chunk.getWorkerId();
    }
}
