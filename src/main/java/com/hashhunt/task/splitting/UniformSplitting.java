package com.hashhunt.task.splitting;

import com.hashhunt.keyspace.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Uniform splitting strategy: 1 chunk per worker.
 *
 * <p>Formula: {@code chunkSize = total / workers}, the last chunk absorbs the remainder.</p>
 *
 * Example:
 *   Total: 10,000
 *   With 4 workers:
 *     Worker 0: [0, 2500)
 *     Worker 1: [2500, 5000)
 *     Worker 2: [5000, 7500)
 *     Worker 3: [7500, 10000)
 *
 * With more workers than candidates the chunk size is 0: every chunk but the
 * last is empty and the last one holds the whole range.
 */
public class UniformSplitting implements SplittingStrategy {

    private static final Logger log = LoggerFactory.getLogger(UniformSplitting.class);

    @Override
    public List<Chunk> split(long total, int workers) {
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative: " + total);
        }
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }

        List<Chunk> chunks = new ArrayList<>(workers);
        long rangeSize = total / workers;

        for (int i = 0; i < workers; i++) {
            long startIndex = i * rangeSize;
            // Last chunk gets remainder
            long endIndex = (i == workers - 1) ? total : (i + 1) * rangeSize;
            chunks.add(new Chunk(i, startIndex, endIndex));

            log.debug("  worker-{} -> range [{}, {}) ({} candidates)",
                      i, startIndex, endIndex, endIndex - startIndex);
        }

        log.info("UniformSplitting: {} candidates into {} chunks of ~{}", total, workers, rangeSize);
        return chunks;
    }

    @Override
    public String getName() {
        return "UniformSplitting";
    }
}
