package com.citewise.provider;

import com.citewise.config.CitewiseProperties;
import com.citewise.exception.PermissionDeniedException;
import com.citewise.http.ErrorCategory;
import com.citewise.http.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Abstract base class for chat providers with common functionality.
 */
@Slf4j
public abstract class AbstractChatProvider implements ChatProvider {

    protected final WebClient webClient;
    protected final CitewiseProperties properties;
    protected final CitewiseProperties.ProviderConfig config;
    private final RetryPolicy retryPolicy;

    protected AbstractChatProvider(
            WebClient webClient,
            CitewiseProperties properties,
            String providerName) {
        this.webClient = webClient;
        this.properties = properties;
        this.config = properties.getProviders().get(providerName);
        this.retryPolicy = RetryPolicy.forProvider(providerName, properties.getLlm().getRetry());
    }

    @Override
    public boolean isEnabled() {
        return config != null
                && config.isEnabled()
                && config.getApiKey() != null
                && !config.getApiKey().isBlank();
    }

    @Override
    public String getModel() {
        return config != null && config.getModel() != null ? config.getModel() : defaultModel();
    }

    /**
     * The requested model, or {@link #getModel()} when none was requested.
     */
    protected String resolveModel(String model) {
        return model != null && !model.isBlank() ? model : getModel();
    }

    /**
     * Model used when none is configured.
     */
    protected abstract String defaultModel();

    /**
     * Execute request with retry logic. Transient failures are retried inside the
     * transport; 401/403 surface as {@link PermissionDeniedException} without retry.
     */
    protected <T> Mono<T> executeWithRetry(Mono<T> request) {
        return request
                .retryWhen(retryPolicy.toRetry())
                .onErrorMap(this::isPermissionDenied, this::toPermissionDenied)
                .doOnSuccess(response -> log.debug("Request succeeded for provider: {}", getName()))
                .doOnError(error -> log.error("Request failed for provider {}: {}",
                        getName(), RetryPolicy.describe(error)));
    }

    private boolean isPermissionDenied(Throwable error) {
        return !(error instanceof PermissionDeniedException)
                && ErrorCategory.of(error) == ErrorCategory.PERMISSION_DENIED;
    }

    private Throwable toPermissionDenied(Throwable error) {
        int status = error instanceof WebClientResponseException responseException
                ? responseException.getStatusCode().value()
                : 403;
        return new PermissionDeniedException(status + " from " + getName(), status, error);
    }
}
