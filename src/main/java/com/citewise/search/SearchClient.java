package com.citewise.search;

import com.citewise.config.CitewiseProperties;
import com.citewise.http.ErrorCategory;
import com.citewise.http.RetryPolicy;
import com.citewise.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Keyword search against the search engine's public HTML endpoint (no API key).
 *
 * Results are cached per normalised query for the caller's TTL. The client never
 * fails: permanent errors, exhausted retries and unparseable pages all yield an
 * empty list. If the engine changes its markup, searches silently return nothing
 * and a WARN hint is logged.
 */
@Slf4j
@Service
public class SearchClient {

    private final WebClient webClient;
    private final SearchResultCache cache;
    private final CitewiseProperties.SearchConfig config;
    private final RetryPolicy retryPolicy;

    public SearchClient(
            @Qualifier("browserWebClient") WebClient webClient,
            SearchResultCache cache,
            CitewiseProperties properties) {
        this.webClient = webClient;
        this.cache = cache;
        this.config = properties.getSearch();
        this.retryPolicy = RetryPolicy.forScraping("Search", config.getRetry());
    }

    /**
     * Search and return up to {@code maxResults} results, possibly empty.
     *
     * @param query      keyword query
     * @param ttl        how long the outcome stays cached
     * @param maxResults maximum number of results to return
     */
    public Mono<List<SearchResult>> search(String query, Duration ttl, int maxResults) {
        return Mono.defer(() -> {
            String key = SearchResultCache.keyFor(query);
            Optional<List<SearchResult>> cached = cache.get(key);
            if (cached.isPresent()) {
                log.debug("Cache hit for query '{}'", query);
                return Mono.just(limit(cached.get(), maxResults));
            }

            return fetchResults(query)
                    .map(results -> limit(results, maxResults))
                    .doOnNext(results -> cache.put(key, results, ttl));
        });
    }

    private static List<SearchResult> limit(List<SearchResult> results, int maxResults) {
        return results.size() > maxResults ? List.copyOf(results.subList(0, maxResults)) : results;
    }

    private Mono<List<SearchResult>> fetchResults(String query) {
        return Mono.defer(() -> webClient.get()
                        .uri(buildSearchUri(query))
                        .retrieve()
                        .bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .timeout(config.getTimeout()))
                .retryWhen(retryPolicy.toRetry())
                .map(html -> {
                    List<SearchResult> results = SearchResultParser.parse(html);
                    if (results.isEmpty()) {
                        log.warn("Search returned 0 parsed results for '{}' (HTML structure may have changed)", query);
                    }
                    return results;
                })
                .onErrorResume(error -> {
                    logFailure(query, error);
                    return Mono.just(List.of());
                });
    }

    URI buildSearchUri(String query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(config.getEndpoint())
                .queryParam("q", URLEncoder.encode(query == null ? "" : query, StandardCharsets.UTF_8));
        if (config.getRegion() != null && !config.getRegion().isBlank()) {
            builder.queryParam("kl", URLEncoder.encode(config.getRegion(), StandardCharsets.UTF_8));
        }
        return builder.build(true).toUri();
    }

    private void logFailure(String query, Throwable error) {
        ErrorCategory category = ErrorCategory.of(error);
        switch (category) {
            case CLIENT, PERMISSION_DENIED, RATE_LIMITED -> log.error("Search HTTP {} for query '{}'",
                    statusOf(error), query);
            case TRANSIENT_NETWORK, SERVER -> log.error("Search failed after {} attempts for query '{}': {}",
                    retryPolicy.getMaxAttempts(), query, RetryPolicy.describe(error));
            default -> log.error("Unexpected search failure for query '{}'", query, error);
        }
    }

    private static String statusOf(Throwable error) {
        return error instanceof WebClientResponseException responseException
                ? String.valueOf(responseException.getStatusCode().value())
                : ErrorCategory.of(error).name();
    }
}
