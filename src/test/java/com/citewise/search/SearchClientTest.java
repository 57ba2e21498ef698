package com.citewise.search;

import com.citewise.config.CitewiseProperties;
import com.citewise.config.WebClientConfiguration;
import com.citewise.model.SearchResult;
import com.citewise.support.MutableClock;
import com.citewise.support.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SearchClient against a local HTTP stub.
 */
class SearchClientTest {

    private static final Duration TTL = Duration.ofSeconds(180);
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private StubHttpServer server;
    private CitewiseProperties properties;
    private MutableClock clock;
    private SearchResultCache cache;
    private String fixture;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/search-results.html")) {
            assertNotNull(in, "fixture missing");
            fixture = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        server = new StubHttpServer();
        properties = new CitewiseProperties();
        properties.getSearch().setEndpoint(server.url("/html/"));
        properties.getSearch().setRetry(new CitewiseProperties.RetryConfig(3, Duration.ofMillis(10), 2.0));
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = new SearchResultCache(16, clock);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private SearchClient newClient() {
        return new SearchClient(new WebClientConfiguration(properties).browserWebClient(), cache, properties);
    }

    private void serveFixture() {
        server.route("/html/", exchange -> StubHttpServer.respond(exchange, 200, "text/html; charset=utf-8", fixture));
    }

    @Test
    void testSearchParsesResults() {
        serveFixture();

        List<SearchResult> results = newClient().search("python asyncio", TTL, 10).block(TIMEOUT);

        assertNotNull(results);
        assertEquals(4, results.size());
        assertEquals("https://docs.python.org/3/library/asyncio.html", results.get(0).getUrl());
    }

    @Test
    void testResultsTruncatedToMaximum() {
        serveFixture();

        List<SearchResult> results = newClient().search("python asyncio", TTL, 2).block(TIMEOUT);

        assertEquals(2, results.size());
        assertEquals("https://realpython.com/async-io-python/", results.get(1).getUrl());
    }

    @Test
    void testRequestCarriesQueryAndBrowserHeaders() {
        AtomicReference<String> rawQuery = new AtomicReference<>();
        AtomicReference<String> userAgent = new AtomicReference<>();
        server.route("/html/", exchange -> {
            rawQuery.set(exchange.getRequestURI().getRawQuery());
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            StubHttpServer.respond(exchange, 200, "text/html", fixture);
        });

        newClient().search("c++ & rust", TTL, 5).block(TIMEOUT);

        assertEquals("q=c%2B%2B+%26+rust&kl=us-en", rawQuery.get());
        assertNotNull(userAgent.get());
        assertTrue(userAgent.get().contains("Firefox"));
    }

    @Test
    void testSecondSearchServedFromCache() {
        serveFixture();
        SearchClient client = newClient();

        List<SearchResult> first = client.search("python asyncio", TTL, 10).block(TIMEOUT);
        List<SearchResult> second = client.search("  Python Asyncio ", TTL, 10).block(TIMEOUT);

        assertEquals(1, server.hits());
        assertEquals(first, second);
    }

    @Test
    void testCachedListIsSharedAcrossResultLimits() {
        serveFixture();
        SearchClient client = newClient();

        List<SearchResult> quick = client.search("python asyncio", TTL, 2).block(TIMEOUT);
        List<SearchResult> deep = client.search("python asyncio", TTL, 10).block(TIMEOUT);
        List<SearchResult> single = client.search("python asyncio", TTL, 1).block(TIMEOUT);

        assertEquals(1, server.hits());
        assertEquals(2, quick.size());
        assertEquals(quick, deep);
        assertEquals(List.of(quick.get(0)), single);
    }

    @Test
    void testCacheExpiresAfterTtl() {
        serveFixture();
        SearchClient client = newClient();

        client.search("python asyncio", TTL, 10).block(TIMEOUT);
        clock.advance(TTL.plusSeconds(1));
        client.search("python asyncio", TTL, 10).block(TIMEOUT);

        assertEquals(2, server.hits());
    }

    @Test
    void testClientErrorIsNotRetried() {
        server.route("/html/", exchange -> StubHttpServer.respondStatus(exchange, 403));

        List<SearchResult> results = newClient().search("blocked", TTL, 10).block(TIMEOUT);

        assertEquals(List.of(), results);
        assertEquals(1, server.hits());
    }

    @Test
    void testRateLimitIsNotRetried() {
        server.route("/html/", exchange -> StubHttpServer.respondStatus(exchange, 429));

        assertEquals(List.of(), newClient().search("limited", TTL, 10).block(TIMEOUT));
        assertEquals(1, server.hits());
    }

    @Test
    void testServerErrorRetriedThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        server.route("/html/", exchange -> {
            if (calls.incrementAndGet() == 1) {
                StubHttpServer.respondStatus(exchange, 503);
            } else {
                StubHttpServer.respond(exchange, 200, "text/html", fixture);
            }
        });

        List<SearchResult> results = newClient().search("flaky", TTL, 10).block(TIMEOUT);

        assertEquals(4, results.size());
        assertEquals(2, server.hits());
    }

    @Test
    void testServerErrorExhaustsRetries() {
        server.route("/html/", exchange -> StubHttpServer.respondStatus(exchange, 500));

        List<SearchResult> results = newClient().search("down", TTL, 10).block(TIMEOUT);

        assertEquals(List.of(), results);
        assertEquals(3, server.hits());
    }

    @Test
    void testFailureOutcomeIsCached() {
        server.route("/html/", exchange -> StubHttpServer.respondStatus(exchange, 404));
        SearchClient client = newClient();

        client.search("missing", TTL, 10).block(TIMEOUT);
        client.search("missing", TTL, 10).block(TIMEOUT);

        assertEquals(1, server.hits());
    }

    @Test
    void testChangedMarkupYieldsEmptyResults() {
        server.route("/html/", exchange -> StubHttpServer.respond(exchange, 200, "text/html",
                "<html><body><div class=\"new-layout\">Nothing we recognise</div></body></html>"));

        assertEquals(List.of(), newClient().search("python", TTL, 10).block(TIMEOUT));
    }

    @Test
    void testConnectionRefusedYieldsEmptyResults() {
        properties.getSearch().setEndpoint("http://127.0.0.1:1/html/");
        properties.getSearch().setRetry(new CitewiseProperties.RetryConfig(2, Duration.ofMillis(1), 2.0));

        assertEquals(List.of(), newClient().search("offline", TTL, 10).block(TIMEOUT));
    }

    @Test
    void testBuildSearchUriWithoutRegion() {
        properties.getSearch().setRegion("");

        assertEquals(server.url("/html/") + "?q=hello+world", newClient().buildSearchUri("hello world").toString());
    }
}
