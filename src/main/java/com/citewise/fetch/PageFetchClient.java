package com.citewise.fetch;

import com.citewise.config.CitewiseProperties;
import com.citewise.http.ErrorCategory;
import com.citewise.http.RetryPolicy;
import com.citewise.model.PageText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Downloads a single page and extracts clipped, readable text.
 *
 * Never fails: network trouble, 4xx responses, non-HTML content and parse
 * problems all produce {@link PageText#empty(String)} so the research pipeline
 * can fall back to the search snippet.
 */
@Slf4j
@Service
public class PageFetchClient {

    private static final int GZIP_MAGIC_FIRST = 0x1f;
    private static final int GZIP_MAGIC_SECOND = 0x8b;

    private final WebClient webClient;
    private final CitewiseProperties.FetchConfig config;
    private final RetryPolicy retryPolicy;

    public PageFetchClient(@Qualifier("browserWebClient") WebClient webClient, CitewiseProperties properties) {
        this.webClient = webClient;
        this.config = properties.getFetch();
        this.retryPolicy = RetryPolicy.forScraping("Page fetch", config.getRetry());
    }

    /**
     * Fetch {@code url} and return its title and body text clipped to {@code maxChars}.
     */
    public Mono<PageText> fetchPage(String url, int maxChars) {
        return Mono.defer(() -> download(url).timeout(config.getTimeout()))
                .retryWhen(retryPolicy.toRetry())
                .map(body -> toPageText(url, body, maxChars))
                .onErrorResume(error -> {
                    logFailure(url, error);
                    return Mono.just(PageText.empty(url));
                });
    }

    private Mono<DownloadedBody> download(String url) {
        return webClient.get()
                .uri(URI.create(url))
                .exchangeToMono(response -> readBody(url, response));
    }

    private Mono<DownloadedBody> readBody(String url, ClientResponse response) {
        if (response.statusCode().isError()) {
            return response.createException().flatMap(Mono::error);
        }

        String contentType = firstHeader(response, HttpHeaders.CONTENT_TYPE);
        if (!isTextual(contentType)) {
            log.debug("Skipping non-HTML page: {} ({})", url, contentType);
            return response.releaseBody().thenReturn(DownloadedBody.skipped(contentType));
        }

        String contentEncoding = firstHeader(response, HttpHeaders.CONTENT_ENCODING);
        return DataBufferUtils.join(DataBufferUtils.takeUntilByteCount(
                        response.bodyToFlux(DataBuffer.class), config.getMaxDownloadBytes()))
                .map(PageFetchClient::drain)
                .defaultIfEmpty(new byte[0])
                .map(bytes -> new DownloadedBody(contentType, contentEncoding, bytes));
    }

    private PageText toPageText(String url, DownloadedBody body, int maxChars) {
        if (body.isSkipped()) {
            return PageText.empty(url);
        }

        String html = decode(body);
        PageTextExtractor extractor = PageTextExtractor.extract(html);
        return PageText.builder()
                .url(url)
                .title(extractor.getTitle())
                .text(extractor.getText(maxChars))
                .build();
    }

    static boolean isTextual(String contentType) {
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("text/html") || lower.contains("text/plain");
    }

    /**
     * Decode the body as UTF-8, gunzipping it first when the server declared gzip
     * and the bytes were not already decompressed by the transport.
     */
    static String decode(DownloadedBody body) {
        byte[] bytes = body.bytes();
        boolean declaredGzip = body.contentEncoding().toLowerCase(Locale.ROOT).contains("gzip");
        if (declaredGzip && looksGzipped(bytes)) {
            bytes = gunzip(bytes);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static boolean looksGzipped(byte[] bytes) {
        return bytes.length >= 2
                && (bytes[0] & 0xff) == GZIP_MAGIC_FIRST
                && (bytes[1] & 0xff) == GZIP_MAGIC_SECOND;
    }

    /**
     * Gunzip as much as possible; the download cap may have cut the stream short.
     */
    private static byte[] gunzip(byte[] compressed) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 4);
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            byte[] chunk = new byte[8192];
            int read;
            while ((read = in.read(chunk)) != -1) {
                out.write(chunk, 0, read);
            }
        } catch (EOFException e) {
            log.debug("Truncated gzip body, keeping {} decompressed bytes", out.size());
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt gzip body", e);
        }
        return out.toByteArray();
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private static String firstHeader(ClientResponse response, String name) {
        return response.headers().header(name).stream().findFirst().orElse("");
    }

    private void logFailure(String url, Throwable error) {
        ErrorCategory category = ErrorCategory.of(error);
        switch (category) {
            case PERMISSION_DENIED -> log.warn("{} fetching {} - skipping", statusOf(error), url);
            case CLIENT, RATE_LIMITED -> log.debug("HTTP {} fetching {} - skipping", statusOf(error), url);
            case TRANSIENT_NETWORK, SERVER -> log.warn("Giving up on {} after {} attempts: {}",
                    url, retryPolicy.getMaxAttempts(), RetryPolicy.describe(error));
            default -> log.warn("Unexpected error fetching {}: {}", url, RetryPolicy.describe(error));
        }
    }

    private static String statusOf(Throwable error) {
        return error instanceof WebClientResponseException responseException
                ? String.valueOf(responseException.getStatusCode().value())
                : ErrorCategory.of(error).name();
    }

    /**
     * Raw page body as downloaded, before decoding.
     */
    record DownloadedBody(String contentType, String contentEncoding, byte[] bytes) {

        static DownloadedBody skipped(String contentType) {
            return new DownloadedBody(contentType, "", null);
        }

        boolean isSkipped() {
            return bytes == null;
        }
    }
}
