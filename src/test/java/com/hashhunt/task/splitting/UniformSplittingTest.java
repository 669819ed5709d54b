package com.hashhunt.task.splitting;

import com.hashhunt.keyspace.Chunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UniformSplitting")
class UniformSplittingTest {

    private final UniformSplitting splitting = new UniformSplitting();

    @Test
    @DisplayName("splits 10000 candidates across 4 workers at quarter boundaries")
    void quarterBoundaries() {
        List<Chunk> chunks = splitting.split(10_000, 4);

        assertEquals(List.of(
            new Chunk(0, 0, 2500),
            new Chunk(1, 2500, 5000),
            new Chunk(2, 5000, 7500),
            new Chunk(3, 7500, 10_000)
        ), chunks);
    }

    @Test
    @DisplayName("last chunk absorbs the remainder")
    void remainderGoesLast() {
        List<Chunk> chunks = splitting.split(10, 3);

        assertEquals(3, chunks.get(0).size());
        assertEquals(3, chunks.get(1).size());
        assertEquals(4, chunks.get(2).size());
    }

    @ParameterizedTest(name = "total={0}, workers={1}")
    @CsvSource({
        "1,     1",
        "4,     4",
        "4,     3",
        "100,   7",
        "10000, 4",
        "99991, 16",
        "3,     8",
        "1,     5"
    })
    @DisplayName("chunks cover [0, total) exactly, one per worker")
    void coverage(long total, int workers) {
        List<Chunk> chunks = splitting.split(total, workers);

        assertEquals(workers, chunks.size());
        long expectedStart = 0;
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            assertEquals(i, chunk.getWorkerId());
            assertEquals(expectedStart, chunk.getStartIndex(), "gap or overlap before " + chunk);
            assertTrue(chunk.getEndIndex() >= chunk.getStartIndex());
            expectedStart = chunk.getEndIndex();
        }
        assertEquals(total, expectedStart);
    }

    @Test
    @DisplayName("more workers than candidates yields empty chunks")
    void degenerateChunks() {
        List<Chunk> chunks = splitting.split(3, 8);

        assertEquals(8, chunks.size());
        assertEquals(7, chunks.stream().filter(Chunk::isEmpty).count());
        assertEquals(new Chunk(7, 0, 3), chunks.get(7));
    }

    @Test
    @DisplayName("rejects non-positive worker count")
    void invalidWorkers() {
        assertThrows(IllegalArgumentException.class, () -> splitting.split(10, 0));
    }
}
