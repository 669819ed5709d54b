package com.hashhunt.scheduler;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Outcome of a search: discovered pre-images in discovery order plus summary statistics.
 */
public final class SearchResult {

    private final List<FoundPreimage> found;
    private final Set<String> missingDigests;
    private final int targetCount;
    private final long totalCombinations;
    private final long processed;
    private final double elapsedSeconds;
    private final boolean earlyExit;
    private final int totalWorkers;
    private final int completedWorkers;
    private final int cancelledWorkers;

    SearchResult(List<FoundPreimage> found, Set<String> missingDigests, int targetCount,
                 long totalCombinations, long processed, double elapsedSeconds, boolean earlyExit,
                 int totalWorkers, int completedWorkers, int cancelledWorkers) {
        this.found = Collections.unmodifiableList(found);
        this.missingDigests = Collections.unmodifiableSet(missingDigests);
        this.targetCount = targetCount;
        this.totalCombinations = totalCombinations;
        this.processed = processed;
        this.elapsedSeconds = elapsedSeconds;
        this.earlyExit = earlyExit;
        this.totalWorkers = totalWorkers;
        this.completedWorkers = completedWorkers;
        this.cancelledWorkers = cancelledWorkers;
    }

    // ==================== Getters ====================

    public List<FoundPreimage> getFound() {
        return found;
    }

    public int getFoundCount() {
        return found.size();
    }

    /**
     * @return target digests with no pre-image in the keyspace (or not reached before cancellation)
     */
    public Set<String> getMissingDigests() {
        return missingDigests;
    }

    public int getTargetCount() {
        return targetCount;
    }

    public long getTotalCombinations() {
        return totalCombinations;
    }

    /**
     * @return candidates actually hashed, summed over all workers
     */
    public long getProcessed() {
        return processed;
    }

    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    /**
     * @return true if every target was found and cancellation was raised
     */
    public boolean isEarlyExit() {
        return earlyExit;
    }

    public int getTotalWorkers() {
        return totalWorkers;
    }

    public int getCompletedWorkers() {
        return completedWorkers;
    }

    public int getCancelledWorkers() {
        return cancelledWorkers;
    }

    // ==================== Convenience Methods ====================

    public boolean isAllFound() {
        return found.size() >= targetCount;
    }

    /**
     * @return total elapsed divided by pre-images found, 0 if none was found
     */
    public double getAverageSecondsPerPreimage() {
        return found.isEmpty() ? 0 : elapsedSeconds / found.size();
    }

    @Override
    public String toString() {
        return String.format("SearchResult[found=%d/%d, processed=%,d/%,d, time=%.2fs%s, workers=%d/%d completed]",
                             found.size(), targetCount, processed, totalCombinations, elapsedSeconds,
                             earlyExit ? ", early exit" : "", completedWorkers, totalWorkers);
    }
}
