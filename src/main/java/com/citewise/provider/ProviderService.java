package com.citewise.provider;

import com.citewise.config.CitewiseProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resolves which provider performs research summarisation.
 */
@Slf4j
@Service
public class ProviderService {

    private final List<ChatProvider> providers;
    private final CitewiseProperties properties;

    public ProviderService(List<ChatProvider> providers, CitewiseProperties properties) {
        this.providers = providers;
        this.properties = properties;
        log.info("Initialized ProviderService with {} providers: {}",
                providers.size(),
                providers.stream().map(ChatProvider::getName).toList());
    }

    /**
     * The configured research provider, or the first enabled one when the
     * configured provider is unavailable.
     *
     * @throws IllegalStateException when no provider is enabled
     */
    public ChatProvider getResearchProvider() {
        String preferred = properties.getResearch().getProvider();

        ChatProvider configured = getProvider(preferred);
        if (configured != null && configured.isEnabled()) {
            return configured;
        }

        ChatProvider fallback = providers.stream()
                .filter(ChatProvider::isEnabled)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No enabled provider available. Configured research provider: " + preferred));

        log.warn("Research provider '{}' is not enabled, using '{}'", preferred, fallback.getName());
        return fallback;
    }

    /**
     * Get list of available providers.
     */
    public List<ChatProvider> getProviders() {
        return providers;
    }

    /**
     * Get a specific provider by name.
     */
    public ChatProvider getProvider(String name) {
        return providers.stream()
                .filter(p -> p.getName().equals(name))
                .findFirst()
                .orElse(null);
    }
}
