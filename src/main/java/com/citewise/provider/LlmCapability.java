package com.citewise.provider;

import com.citewise.model.Message;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The single operation the research pipeline needs from a language model.
 */
@FunctionalInterface
public interface LlmCapability {

    /**
     * Generate a reply for a conversation.
     *
     * @param messages ordered messages, oldest first
     * @param system   system instruction
     * @return reply text; fails with {@link com.citewise.exception.PermissionDeniedException}
     *         when the provider refuses access
     */
    Mono<String> complete(List<Message> messages, String system);
}
