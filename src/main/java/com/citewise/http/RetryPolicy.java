package com.citewise.http;

import com.citewise.config.CitewiseProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Bounded retry with exponential backoff, shared by every outbound client.
 * Attempt n (1-based) that fails with a retryable category waits
 * {@code baseDelay * factor^(n-1)} before attempt n+1, up to {@code maxAttempts} in total.
 */
@Slf4j
@Getter
public class RetryPolicy {

    private final String name;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final double factor;
    private final Set<ErrorCategory> retryable;

    public RetryPolicy(String name, int maxAttempts, Duration baseDelay, double factor, Set<ErrorCategory> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.name = name;
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay != null ? baseDelay : Duration.ZERO;
        this.factor = factor > 0 ? factor : 2.0;
        this.retryable = retryable.isEmpty()
                ? EnumSet.noneOf(ErrorCategory.class)
                : EnumSet.copyOf(retryable);
    }

    /**
     * Policy for scraping clients: network errors and 5xx are retried, 4xx never.
     */
    public static RetryPolicy forScraping(String name, CitewiseProperties.RetryConfig config) {
        return new RetryPolicy(name, config.getMaxAttempts(), config.getBaseDelay(), config.getFactor(),
                EnumSet.of(ErrorCategory.TRANSIENT_NETWORK, ErrorCategory.SERVER));
    }

    /**
     * Policy for language-model providers: rate limiting is transient as well.
     */
    public static RetryPolicy forProvider(String name, CitewiseProperties.RetryConfig config) {
        return new RetryPolicy(name, config.getMaxAttempts(), config.getBaseDelay(), config.getFactor(),
                EnumSet.of(ErrorCategory.TRANSIENT_NETWORK, ErrorCategory.SERVER, ErrorCategory.RATE_LIMITED));
    }

    public boolean isRetryable(Throwable error) {
        return retryable.contains(ErrorCategory.of(error));
    }

    /**
     * Delay after the given failed attempt (1-based).
     */
    public Duration delayAfterAttempt(long attempt) {
        double multiplier = Math.pow(factor, Math.max(0, attempt - 1));
        return Duration.ofNanos((long) (baseDelay.toNanos() * multiplier));
    }

    /**
     * Reactor {@link Retry} for this policy. The last failure is propagated unchanged once the
     * policy gives up, so callers can still classify it.
     */
    public Retry toRetry() {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries() + 1;

            if (!isRetryable(failure) || attempt >= maxAttempts) {
                return Mono.error(failure);
            }

            Duration delay = delayAfterAttempt(attempt);
            log.warn("{} attempt {}/{} failed ({}), retrying in {}ms",
                    name, attempt, maxAttempts, describe(failure), delay.toMillis());
            return Mono.delay(delay).thenReturn(attempt);
        }));
    }

    /**
     * Short description of a failure for log lines.
     */
    public static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? error.getClass().getSimpleName() + ": " + message : error.getClass().getSimpleName();
    }
}
