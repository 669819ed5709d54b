package com.hashhunt.scheduler;

import com.hashhunt.config.SearchRequest;
import com.hashhunt.event.ProgressEvent;
import com.hashhunt.keyspace.Chunk;
import com.hashhunt.task.TaskResult;

import java.util.List;

/**
 * Call-back sink for search progress, implemented by a front-end (console, tests).
 *
 * All callbacks run on the coordinator thread, one at a time; implementations
 * should return quickly. Every method defaults to a no-op.
 */
public interface SearchListener {

    SearchListener NONE = new SearchListener() { };

    /**
     * Called once after the keyspace has been split, before any worker starts.
     */
    default void onStart(SearchRequest request, List<Chunk> chunks) {
    }

    /**
     * @param event the worker's report
     * @param processed candidates processed so far, all workers
     * @param total candidates in the keyspace
     */
    default void onProgress(ProgressEvent event, long processed, long total) {
    }

    /**
     * Called for each newly found target digest (duplicates are not reported).
     */
    default void onMatch(FoundPreimage preimage, int found, int targetCount) {
    }

    default void onWorkerFinished(TaskResult result) {
    }

    default void onComplete(SearchResult result) {
    }
}
