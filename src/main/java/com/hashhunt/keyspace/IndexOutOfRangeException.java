package com.hashhunt.keyspace;

import com.hashhunt.HashhuntException;

/**
 * Thrown when an index outside {@code [0, total)} is decoded.
 * Never expected in normal operation: it means a chunk was built wrong.
 */
public class IndexOutOfRangeException extends HashhuntException {

    private static final long serialVersionUID = 1L;

    private final long index;
    private final long total;

    public IndexOutOfRangeException(long index, long total) {
        super(String.format("Index %d outside keyspace [0, %d)", index, total));
        this.index = index;
        this.total = total;
    }

    public long getIndex() {
        return index;
    }

    public long getTotal() {
        return total;
    }
}
