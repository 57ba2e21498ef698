package com.citewise.controller;

import com.citewise.search.SearchResultCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Search cache management controller.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final SearchResultCache cache;

    public CacheController(SearchResultCache cache) {
        this.cache = cache;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of(
                "entries", cache.size(),
                "capacity", cache.getCapacity(),
                "status", "healthy"
        ));
    }

    /**
     * Drop every cached search result.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        cache.clear();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Search cache cleared"
        ));
    }
}
