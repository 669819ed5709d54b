package com.hashhunt.task;

import com.hashhunt.digest.DigestFunctionFactory;
import com.hashhunt.digest.DigestMatcher;
import com.hashhunt.digest.TargetSet;
import com.hashhunt.event.EventSink;
import com.hashhunt.event.MatchEvent;
import com.hashhunt.event.ProgressEvent;
import com.hashhunt.keyspace.Chunk;
import com.hashhunt.keyspace.Indexer;
import com.hashhunt.keyspace.SearchSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Worker that brute-forces one chunk of the keyspace.
 *
 * For every index in {@code [start, end)} it decodes the candidate, hashes it
 * and tests the digest against the targets. Matches are published immediately;
 * progress is published in batches.
 *
 * Cancellation is cooperative: the token (and the thread's interrupt flag) is
 * checked before the first candidate and then every
 * {@value #CANCELLATION_CHECK_INTERVAL} candidates. After cancellation is
 * raised a worker may therefore process up to
 * {@code CANCELLATION_CHECK_INTERVAL - 1} more candidates before it stops.
 *
 * Progress accounting: the pending batch is published every
 * {@link #progressBatchSize(long)} candidates and once more when the worker
 * stops. A matching candidate is reported on its own as a one-unit event right
 * after its MatchEvent and never enters the batch, so the sum of all deltas is
 * exactly the number of candidates processed.
 */
public class ChunkSearchTask implements Callable<TaskResult> {

    private static final Logger log = LoggerFactory.getLogger(ChunkSearchTask.class);

    // Cancellation check frequency (responsiveness vs per-candidate overhead)
    public static final int CANCELLATION_CHECK_INTERVAL = 4096;

    // Upper bound on batched progress events per worker (plus one final flush)
    public static final int MAX_PROGRESS_REPORTS = 100;

    private final Chunk chunk;
    private final SearchSpace space;
    private final DigestFunctionFactory digestFactory;
    private final TargetSet targets;
    private final long searchStartNanos;
    private final EventSink events;
    private final CancellationToken cancellation;

    /**
     * @param chunk range owned by this worker
     * @param space shared read-only keyspace
     * @param digestFactory creates this worker's digest function
     * @param targets shared read-only target set
     * @param searchStartNanos {@link System#nanoTime()} at global search start
     * @param events channel to the coordinator
     * @param cancellation cancellation signal, polled periodically
     */
    public ChunkSearchTask(Chunk chunk, SearchSpace space, DigestFunctionFactory digestFactory,
                           TargetSet targets, long searchStartNanos,
                           EventSink events, CancellationToken cancellation) {
        this.chunk = chunk;
        this.space = space;
        this.digestFactory = digestFactory;
        this.targets = targets;
        this.searchStartNanos = searchStartNanos;
        this.events = events;
        this.cancellation = cancellation;
    }

    /**
     * @param chunkSize candidates in the chunk
     * @return candidates per batched progress event, at least 1
     */
    public static long progressBatchSize(long chunkSize) {
        return Math.max(1, (chunkSize + MAX_PROGRESS_REPORTS - 1) / MAX_PROGRESS_REPORTS);
    }

    @Override
    public TaskResult call() {
        int workerId = chunk.getWorkerId();

        if (chunk.isEmpty()) {
            log.debug("Worker {} has an empty chunk, nothing to do", workerId);
            return TaskResult.completed(chunk, 0, 0, 0);
        }

        long startTime = System.currentTimeMillis();
        log.info("[START] Worker {} processing range [{}, {}) ({} candidates)",
                 workerId, chunk.getStartIndex(), chunk.getEndIndex(), chunk.size());

        DigestMatcher matcher = new DigestMatcher(digestFactory.newInstance(), targets);
        char[] buffer = new char[space.getLength()];
        long batchSize = progressBatchSize(chunk.size());

        long processed = 0;
        long pending = 0;
        int matches = 0;

        for (long index = chunk.getStartIndex(); index < chunk.getEndIndex(); index++) {
            if (processed % CANCELLATION_CHECK_INTERVAL == 0 && isCancelled()) {
                flush(pending);
                long executionTime = System.currentTimeMillis() - startTime;
                log.info("[CANCELLED] Worker {} stopped after {}/{} candidates in {}ms",
                         workerId, processed, chunk.size(), executionTime);
                return TaskResult.cancelled(chunk, processed, matches, executionTime);
            }

            Indexer.decodeInto(space, index, buffer);
            String candidate = new String(buffer);
            String digest = matcher.digest(candidate);
            processed++;

            if (matcher.isMatch(digest)) {
                matches++;
                log.info("[FOUND] Worker {} matched {} <- '{}'", workerId, digest, candidate);
                events.publish(new MatchEvent(workerId, digest, candidate, elapsedSeconds()));
                events.publish(new ProgressEvent(workerId, 1, chunk.size()));
            } else if (++pending >= batchSize) {
                flush(pending);
                pending = 0;
            }
        }

        flush(pending);
        long executionTime = System.currentTimeMillis() - startTime;
        log.info("[COMPLETE] Worker {} finished {} candidates in {}ms ({} matches)",
                 workerId, processed, executionTime, matches);
        return TaskResult.completed(chunk, processed, matches, executionTime);
    }

    private boolean isCancelled() {
        return cancellation.isCancellationRequested() || Thread.currentThread().isInterrupted();
    }

    private void flush(long pending) {
        if (pending > 0) {
            events.publish(new ProgressEvent(chunk.getWorkerId(), pending, chunk.size()));
        }
    }

    private double elapsedSeconds() {
        return (System.nanoTime() - searchStartNanos) / 1_000_000_000.0;
    }

    public Chunk getChunk() {
        return chunk;
    }

    @Override
    public String toString() {
        return String.format("ChunkSearchTask[worker=%d, range=[%d, %d), candidates=%d]",
                             chunk.getWorkerId(), chunk.getStartIndex(), chunk.getEndIndex(), chunk.size());
    }
}
