package com.hashhunt.task.splitting;

import com.hashhunt.keyspace.Chunk;

import java.util.List;

/**
 * Strategy to partition the keyspace index range {@code [0, total)} into chunks.
 *
 * Implementations must return chunks that are contiguous, non-overlapping and
 * cover the whole range, in index order.
 */
@FunctionalInterface
public interface SplittingStrategy {

    /**
     * @param total number of candidates in the keyspace
     * @param workers number of workers, at least 1
     * @return one chunk per worker, some possibly empty
     * @throws IllegalArgumentException if total is negative or workers is not positive
     */
    List<Chunk> split(long total, int workers);

    /**
     * @return descriptive name of the strategy (for logging)
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
