package com.hashhunt.scheduler;

import com.hashhunt.config.SearchRequest;
import com.hashhunt.digest.TargetSet;
import com.hashhunt.event.EventChannel;
import com.hashhunt.event.MatchEvent;
import com.hashhunt.event.ProgressEvent;
import com.hashhunt.event.SearchEvent;
import com.hashhunt.keyspace.Chunk;
import com.hashhunt.keyspace.SearchSpace;
import com.hashhunt.task.ChunkSearchTask;
import com.hashhunt.task.TaskResult;
import com.hashhunt.task.splitting.SplittingStrategy;
import com.hashhunt.task.splitting.UniformSplitting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates the entire search lifecycle.
 *
 * Lifecycle:
 *   1. The keyspace is split into one chunk per worker (SplittingStrategy)
 *   2. One ChunkSearchTask per chunk is submitted to a fixed thread pool
 *   3. A single aggregation loop drains progress/match events from the
 *      EventChannel and collects finished workers from the CompletionService
 *   4. When every target digest has been found the CancellationSignal is raised
 *      and the workers wind down on their own
 *   5. After every worker has terminated, residual events are drained and
 *      the SearchResult is built
 *
 * Workers share nothing mutable except the write-once cancellation signal;
 * all other coordination is one-way message passing. The loop waits at most
 * {@value #POLL_TIMEOUT_MS}ms for an event before checking worker liveness, so
 * a crashed worker is noticed even when no events arrive.
 *
 * A worker failure aborts the search with a {@link WorkerFailureException}.
 * There is no retry.
 */
public class SearchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SearchCoordinator.class);

    /**
     * Maximum time the aggregation loop blocks waiting for an event (milliseconds).
     */
    static final long POLL_TIMEOUT_MS = 100;

    /**
     * Maximum time to wait for thread pool shutdown (in seconds).
     */
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final SplittingStrategy splittingStrategy;
    private final SearchListener listener;

    /**
     * Creates a coordinator with uniform splitting and no listener.
     */
    public SearchCoordinator() {
        this(new UniformSplitting(), SearchListener.NONE);
    }

    public SearchCoordinator(SearchListener listener) {
        this(new UniformSplitting(), listener);
    }

    /**
     * @param splittingStrategy strategy to partition the keyspace
     * @param listener progress sink, called on the coordinator thread
     */
    public SearchCoordinator(SplittingStrategy splittingStrategy, SearchListener listener) {
        this.splittingStrategy = splittingStrategy;
        this.listener = listener != null ? listener : SearchListener.NONE;
    }

    /**
     * Runs a search to completion: until every target is found (early exit)
     * or the keyspace is exhausted.
     *
     * @param request validated search configuration
     * @return discovered pre-images and statistics
     * @throws WorkerFailureException if any worker terminates abnormally
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public SearchResult search(SearchRequest request) throws InterruptedException {
        SearchSpace space = request.getSpace();
        TargetSet targets = request.getTargets();

        List<Chunk> chunks = splittingStrategy.split(space.getTotal(), request.getWorkers());
        log.info("[START] Search {} split into {} chunks using {}",
                 request, chunks.size(), splittingStrategy.getName());
        listener.onStart(request, chunks);

        SearchState state = new SearchState(targets, space.getTotal());
        CancellationSignal cancellation = new CancellationSignal();
        EventChannel channel = new EventChannel();

        ExecutorService threadPool = Executors.newFixedThreadPool(chunks.size(), new WorkerThreadFactory());
        CompletionService<TaskResult> completionService = new ExecutorCompletionService<>(threadPool);
        Map<Future<TaskResult>, Chunk> runningTasks = new HashMap<>();
        List<TaskResult> taskResults = new ArrayList<>();

        long startNanos = System.nanoTime();

        try {
            for (Chunk chunk : chunks) {
                ChunkSearchTask task = new ChunkSearchTask(chunk, space, request.getDigestFactory(),
                                                           targets, startNanos, channel, cancellation);
                Future<TaskResult> future = completionService.submit(() -> runGuarded(task));
                runningTasks.put(future, chunk);
            }

            int remaining = chunks.size();
            List<SearchEvent> batch = new ArrayList<>();

            while (remaining > 0) {
                SearchEvent event = channel.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    handleEvent(event, state, cancellation);
                    // Take whatever else is already queued without blocking
                    batch.clear();
                    channel.drainTo(batch);
                    for (SearchEvent queued : batch) {
                        handleEvent(queued, state, cancellation);
                    }
                }

                // Liveness check: collect every worker that has terminated
                Future<TaskResult> done;
                while ((done = completionService.poll()) != null) {
                    remaining--;
                    TaskResult result = collect(done, runningTasks.get(done));
                    taskResults.add(result);
                    listener.onWorkerFinished(result);
                }
            }

            // All workers joined: events published before they returned are still queued
            batch.clear();
            channel.drainTo(batch);
            for (SearchEvent queued : batch) {
                handleEvent(queued, state, cancellation);
            }

        } catch (WorkerFailureException e) {
            cancellation.raise();
            log.error("[ABORT] {}", e.getMessage());
            throw e;
        } catch (InterruptedException e) {
            cancellation.raise();
            log.warn("[ABORT] Search interrupted, cancelling workers");
            throw e;
        } finally {
            shutdown(threadPool);
        }

        double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        SearchResult result = state.toResult(elapsedSeconds, cancellation.isCancellationRequested(), taskResults);

        log.info("[COMPLETE] Found {}/{} pre-images in {} seconds ({} of {} candidates processed{})",
                 result.getFoundCount(), result.getTargetCount(), String.format("%.2f", elapsedSeconds),
                 result.getProcessed(), result.getTotalCombinations(),
                 result.isEarlyExit() ? ", early exit" : "");
        log.info("  Average time per pre-image: {} seconds",
                 String.format("%.2f", result.getAverageSecondsPerPreimage()));
        if (!result.getMissingDigests().isEmpty()) {
            log.info("  Not found: {}", result.getMissingDigests());
        }

        listener.onComplete(result);
        return result;
    }

    /**
     * Runs a worker, converting an exception into a FAILURE result.
     * Errors are left to propagate through the Future.
     */
    private static TaskResult runGuarded(ChunkSearchTask task) {
        try {
            return task.call();
        } catch (Exception e) {
            log.error("Worker {} failed with exception", task.getChunk().getWorkerId(), e);
            return TaskResult.failure(task.getChunk(), e);
        }
    }

    /**
     * Retrieves the terminal result of a finished worker.
     *
     * @throws WorkerFailureException if the worker failed or died
     */
    private TaskResult collect(Future<TaskResult> future, Chunk chunk) throws InterruptedException {
        TaskResult result;
        try {
            result = future.get();
        } catch (ExecutionException e) {
            throw new WorkerFailureException(chunk, e.getCause());
        } catch (CancellationException e) {
            throw new WorkerFailureException(chunk, e);
        }

        if (result.isFailure()) {
            throw new WorkerFailureException(chunk, result.getCause());
        }
        log.debug("Worker {} terminated: {}", chunk.getWorkerId(), result);
        return result;
    }

    private void handleEvent(SearchEvent event, SearchState state, CancellationSignal cancellation) {
        if (event instanceof ProgressEvent) {
            ProgressEvent progress = (ProgressEvent) event;
            state.processed += progress.getDelta();
            listener.onProgress(progress, state.processed, state.total);

        } else if (event instanceof MatchEvent) {
            MatchEvent match = (MatchEvent) event;
            FoundPreimage preimage = new FoundPreimage(match.getDigest(), match.getCandidate(),
                                                       match.getElapsedSeconds());

            // Deduplicate by digest: only the first pre-image of a target counts
            if (state.found.putIfAbsent(match.getDigest(), preimage) != null) {
                log.debug("Ignoring duplicate match for {} ('{}' from worker {})",
                          match.getDigest(), match.getCandidate(), match.getWorkerId());
                return;
            }

            int foundCount = state.found.size();
            log.info("[FOUND] {}/{}: {}", foundCount, state.targets.size(), preimage);
            listener.onMatch(preimage, foundCount, state.targets.size());

            if (foundCount >= state.targets.size() && cancellation.raise()) {
                log.info("[EARLY TERMINATION] All {} targets found, cancelling remaining workers",
                         state.targets.size());
            }
        } else {
            log.warn("Unknown event type: {}", event);
        }
    }

    /**
     * Shuts down the pool. Workers have normally all terminated by now; after a
     * failure the survivors are interrupted.
     */
    private static void shutdown(ExecutorService threadPool) {
        threadPool.shutdownNow();
        try {
            if (!threadPool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Thread pool did not terminate in {} seconds", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            log.error("Thread pool shutdown interrupted", e);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Aggregation state, touched only by the coordinator thread.
     */
    private static final class SearchState {
        final TargetSet targets;
        final long total;
        final Map<String, FoundPreimage> found = new LinkedHashMap<>();
        long processed;

        SearchState(TargetSet targets, long total) {
            this.targets = targets;
            this.total = total;
        }

        SearchResult toResult(double elapsedSeconds, boolean earlyExit, List<TaskResult> taskResults) {
            Set<String> missing = new LinkedHashSet<>(targets.asSet());
            missing.removeAll(found.keySet());

            int completed = 0;
            int cancelled = 0;
            for (TaskResult result : taskResults) {
                if (result.isCompleted()) {
                    completed++;
                } else if (result.isCancelled()) {
                    cancelled++;
                }
            }
            return new SearchResult(new ArrayList<>(found.values()), missing, targets.size(), total,
                                    processed, elapsedSeconds, earlyExit,
                                    taskResults.size(), completed, cancelled);
        }
    }

    /**
     * Names pool threads "hashhunt-worker-N" so log lines identify the worker thread.
     */
    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "hashhunt-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
