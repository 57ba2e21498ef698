package com.citewise.provider;

import com.citewise.model.Message;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for chat completion providers.
 * Implementations handle provider-specific authentication, request/response mapping,
 * and API communication.
 */
public interface ChatProvider extends LlmCapability {

    /**
     * Get provider name (e.g., "openai", "anthropic").
     *
     * @return provider name
     */
    String getName();

    /**
     * Model identifier sent when the caller names none.
     *
     * @return model name
     */
    String getModel();

    /**
     * Generate a reply with an explicit model instead of {@link #getModel()}.
     *
     * @param model model identifier; blank means {@link #getModel()}
     */
    Mono<String> complete(List<Message> messages, String system, String model);

    @Override
    default Mono<String> complete(List<Message> messages, String system) {
        return complete(messages, system, getModel());
    }

    /**
     * Check if provider is enabled and configured.
     *
     * @return true if ready to use
     */
    boolean isEnabled();
}
