package com.hashhunt.cli;

import com.hashhunt.config.SearchRequest;
import com.hashhunt.event.ProgressEvent;
import com.hashhunt.keyspace.Chunk;
import com.hashhunt.scheduler.FoundPreimage;
import com.hashhunt.scheduler.SearchListener;
import com.hashhunt.scheduler.SearchResult;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Prints an overall progress line and the found counter to the console.
 * Progress redraws are throttled to one every {@value #REFRESH_INTERVAL_MS}ms.
 */
public class ConsoleProgressListener implements SearchListener {

    private static final long REFRESH_INTERVAL_MS = 500;

    private final PrintStream out;
    private long lastRefreshNanos;
    private int found;
    private int targetCount;

    public ConsoleProgressListener(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onStart(SearchRequest request, List<Chunk> chunks) {
        targetCount = request.getTargets().size();
        out.printf(Locale.ROOT, "Using %d workers, charset %s (%d symbols), length %d, algorithm %s%n",
                   chunks.size(), request.getCharsetLabel(), request.getSpace().getBase(),
                   request.getSpace().getLength(), request.getAlgorithm());
        out.printf(Locale.ROOT, "Searching %,d combinations for %d target(s)%n",
                   request.getSpace().getTotal(), targetCount);
    }

    @Override
    public void onProgress(ProgressEvent event, long processed, long total) {
        long now = System.nanoTime();
        if (processed < total && now - lastRefreshNanos < REFRESH_INTERVAL_MS * 1_000_000L) {
            return;
        }
        lastRefreshNanos = now;
        double percent = total == 0 ? 100.0 : processed * 100.0 / total;
        out.printf(Locale.ROOT, "\rOverall progress: %,d/%,d (%.1f%%)  Pre-images found: %d/%d",
                   processed, total, percent, found, targetCount);
        out.flush();
    }

    @Override
    public void onMatch(FoundPreimage preimage, int found, int targetCount) {
        this.found = found;
        out.printf(Locale.ROOT, "%n[FOUND %d/%d] %s -> %s (%.2fs)%n",
                   found, targetCount, preimage.getDigest(), preimage.getPreimage(),
                   preimage.getElapsedSeconds());
    }

    @Override
    public void onComplete(SearchResult result) {
        out.println();
        out.printf(Locale.ROOT, "Total elapsed time: %.2f seconds%n", result.getElapsedSeconds());
    }
}
