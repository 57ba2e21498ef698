package com.citewise.search;

import com.citewise.config.CitewiseProperties;
import com.citewise.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide TTL cache of search results keyed by normalised query.
 *
 * Shared by all concurrent research invocations; every read and write, including
 * the eviction sweep, happens under a single lock. Expired entries are only
 * purged when an insert finds the cache at capacity. The capacity is soft: if
 * nothing has expired yet, the insert still succeeds.
 */
@Slf4j
@Component
public class SearchResultCache {

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int capacity;
    private final Clock clock;

    @Autowired
    public SearchResultCache(CitewiseProperties properties, Clock clock) {
        this(properties.getSearch().getCacheMaxEntries(), clock);
    }

    public SearchResultCache(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    /**
     * Cache key for a query: MD5 of the trimmed, lower-cased text.
     */
    public static String keyFor(String query) {
        String normalized = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        return DigestUtils.md5Hex(normalized);
    }

    /**
     * @return the cached results while the entry is still fresh
     */
    public Optional<List<SearchResult>> get(String key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry != null && entry.isFresh(clock.instant())) {
                return Optional.of(entry.results());
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store (or replace) the results for a key.
     */
    public void put(String key, List<SearchResult> results, Duration ttl) {
        lock.lock();
        try {
            if (entries.size() >= capacity && !entries.containsKey(key)) {
                int evicted = evictExpiredLocked();
                log.debug("Search cache at capacity {}, evicted {} expired entries", capacity, evicted);
            }
            Instant expiresAt = clock.instant().plus(ttl);
            entries.put(key, new CacheEntry(List.copyOf(results), expiresAt));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove expired entries now.
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        lock.lock();
        try {
            return evictExpiredLocked();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.info("Search cache cleared");
    }

    private int evictExpiredLocked() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<CacheEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (!iterator.next().isFresh(now)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Immutable cache entry; replaced, never mutated.
     */
    record CacheEntry(List<SearchResult> results, Instant expiresAt) {

        boolean isFresh(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
