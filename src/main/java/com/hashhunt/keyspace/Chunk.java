package com.hashhunt.keyspace;

/**
 * Contiguous index range {@code [startIndex, endIndex)} owned by one worker.
 * An empty chunk ({@code start == end}) is legal when there are more workers
 * than candidates.
 */
public final class Chunk {

    private final int workerId;
    private final long startIndex;
    private final long endIndex;

    /**
     * @param workerId worker that owns the chunk
     * @param startIndex inclusive start
     * @param endIndex exclusive end
     * @throws IllegalArgumentException if {@code startIndex < 0} or {@code endIndex < startIndex}
     */
    public Chunk(int workerId, long startIndex, long endIndex) {
        if (startIndex < 0 || endIndex < startIndex) {
            throw new IllegalArgumentException(
                String.format("Invalid chunk range [%d, %d)", startIndex, endIndex));
        }
        this.workerId = workerId;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
    }

    public int getWorkerId() {
        return workerId;
    }

    public long getStartIndex() {
        return startIndex;
    }

    public long getEndIndex() {
        return endIndex;
    }

    public long size() {
        return endIndex - startIndex;
    }

    public boolean isEmpty() {
        return startIndex == endIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Chunk)) {
            return false;
        }
        Chunk other = (Chunk) o;
        return workerId == other.workerId
            && startIndex == other.startIndex
            && endIndex == other.endIndex;
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(workerId);
        result = 31 * result + Long.hashCode(startIndex);
        result = 31 * result + Long.hashCode(endIndex);
        return result;
    }

    @Override
    public String toString() {
        return String.format("Chunk[worker=%d, range=[%d, %d), size=%d]",
                             workerId, startIndex, endIndex, size());
    }
}
