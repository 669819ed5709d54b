package com.hashhunt.event;

/**
 * A candidate whose digest is in the target set. Emitted once per match,
 * as soon as it is found.
 */
public final class MatchEvent implements SearchEvent {

    private final int workerId;
    private final String digest;
    private final String candidate;
    private final double elapsedSeconds;

    /**
     * @param workerId emitting worker
     * @param digest matched target digest
     * @param candidate the pre-image
     * @param elapsedSeconds seconds since the search started (not since the worker started)
     */
    public MatchEvent(int workerId, String digest, String candidate, double elapsedSeconds) {
        this.workerId = workerId;
        this.digest = digest;
        this.candidate = candidate;
        this.elapsedSeconds = elapsedSeconds;
    }

    @Override
    public int getWorkerId() {
        return workerId;
    }

    public String getDigest() {
        return digest;
    }

    public String getCandidate() {
        return candidate;
    }

    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    @Override
    public String toString() {
        return String.format("MatchEvent[worker=%d, %s <- '%s', %.2fs]",
                             workerId, digest, candidate, elapsedSeconds);
    }
}
