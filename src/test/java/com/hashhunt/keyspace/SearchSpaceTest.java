package com.hashhunt.keyspace;

import com.hashhunt.config.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SearchSpace")
class SearchSpaceTest {

    @Test
    @DisplayName("total is charset size to the power of length")
    void totalIsPower() {
        assertEquals(4, SearchSpace.of("01", 2).getTotal());
        assertEquals(10_000, SearchSpace.of("0123456789", 4).getTotal());
        assertEquals(26L * 26 * 26 * 26 * 26, SearchSpace.of("abcdefghijklmnopqrstuvwxyz", 5).getTotal());
    }

    @Test
    @DisplayName("largest representable keyspace is accepted")
    void largestAccepted() {
        // 2^62 fits, 2^63 does not
        assertEquals(1L << 62, SearchSpace.of("01", 62).getTotal());
    }

    @Test
    @DisplayName("overflowing keyspace is rejected, not wrapped")
    void overflowRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> SearchSpace.of("01", 63));
        assertTrue(e.getMessage().contains("too large"));
        assertThrows(ConfigurationException.class, () -> SearchSpace.of("0123456789", 19));
    }

    @Test
    @DisplayName("rejects empty charset, duplicate symbols and non-positive length")
    void invalidInput() {
        assertThrows(ConfigurationException.class, () -> SearchSpace.of("", 3));
        assertThrows(ConfigurationException.class, () -> SearchSpace.of(null, 3));
        assertThrows(ConfigurationException.class, () -> SearchSpace.of("0120", 3));
        assertThrows(ConfigurationException.class, () -> SearchSpace.of("01", 0));
    }

    @Test
    @DisplayName("rejects symbols outside the Basic Multilingual Plane")
    void surrogatePairsRejected() {
        String withEmoji = "ab\uD83D\uDE00";

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> SearchSpace.of(withEmoji, 2));
        assertTrue(e.getMessage().contains("position 2"));
        assertThrows(ConfigurationException.class, () -> SearchSpace.of("a\uDC00", 1));
        // Non-ASCII BMP symbols are fine
        assertEquals(9, SearchSpace.of("\u00e9\u00e8\u00ea", 2).getTotal());
    }
}
