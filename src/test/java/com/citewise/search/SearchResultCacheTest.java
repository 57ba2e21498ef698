package com.citewise.search;

import com.citewise.model.SearchResult;
import com.citewise.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SearchResultCache.
 */
class SearchResultCacheTest {

    private static final Duration TTL = Duration.ofSeconds(180);

    private MutableClock clock;
    private SearchResultCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = new SearchResultCache(3, clock);
    }

    @Test
    void testKeyNormalisesCaseAndWhitespace() {
        assertEquals(SearchResultCache.keyFor("python asyncio"), SearchResultCache.keyFor("  Python AsyncIO "));
        assertNotEquals(SearchResultCache.keyFor("python asyncio"), SearchResultCache.keyFor("python trio"));
        assertEquals(32, SearchResultCache.keyFor("anything").length());
    }

    @Test
    void testFreshEntryIsReturned() {
        cache.put("k", List.of(result("https://a.example")), TTL);

        clock.advance(TTL.minusSeconds(1));

        assertEquals(List.of(result("https://a.example")), cache.get("k").orElseThrow());
    }

    @Test
    void testEntryExpiresAtTtl() {
        cache.put("k", List.of(result("https://a.example")), TTL);

        clock.advance(TTL);

        assertTrue(cache.get("k").isEmpty());
    }

    @Test
    void testZeroTtlIsNeverFresh() {
        cache.put("k", List.of(result("https://a.example")), Duration.ZERO);

        assertTrue(cache.get("k").isEmpty());
    }

    @Test
    void testEmptyResultsAreCached() {
        cache.put("k", List.of(), TTL);

        assertEquals(List.of(), cache.get("k").orElseThrow());
    }

    @Test
    void testPutReplacesExistingEntry() {
        cache.put("k", List.of(result("https://old.example")), TTL);
        cache.put("k", List.of(result("https://new.example")), TTL);

        assertEquals("https://new.example", cache.get("k").orElseThrow().get(0).getUrl());
        assertEquals(1, cache.size());
    }

    @Test
    void testExpiredEntriesEvictedWhenAtCapacity() {
        cache.put("short", List.of(), Duration.ofSeconds(10));
        cache.put("long-1", List.of(), TTL);
        cache.put("long-2", List.of(), TTL);

        clock.advance(Duration.ofSeconds(20));
        cache.put("new", List.of(), TTL);

        assertEquals(3, cache.size());
        assertTrue(cache.get("new").isPresent());
        assertTrue(cache.get("long-1").isPresent());
    }

    @Test
    void testCapacityIsSoftWhenNothingExpired() {
        cache.put("a", List.of(), TTL);
        cache.put("b", List.of(), TTL);
        cache.put("c", List.of(), TTL);
        cache.put("d", List.of(), TTL);

        assertEquals(4, cache.size());
    }

    @Test
    void testExpiredEntriesKeptBelowCapacity() {
        cache.put("a", List.of(), Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(5));
        cache.put("b", List.of(), TTL);

        assertEquals(2, cache.size());
        assertEquals(1, cache.evictExpired());
        assertEquals(1, cache.size());
    }

    @Test
    void testClear() {
        cache.put("a", List.of(), TTL);
        cache.clear();

        assertEquals(0, cache.size());
        assertTrue(cache.get("a").isEmpty());
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new SearchResultCache(0, clock));
    }

    @Test
    void testConcurrentAccess() throws Exception {
        SearchResultCache shared = new SearchResultCache(64, clock);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        String key = SearchResultCache.keyFor("query " + ((thread * 31 + i) % 40));
                        shared.put(key, List.of(result("https://example.com/" + i)), TTL);
                        shared.get(key).ifPresent(results -> assertEquals(1, results.size()));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(40, shared.size());
    }

    private static SearchResult result(String url) {
        return SearchResult.builder().url(url).title("Title").snippet("Snippet").build();
    }
}
