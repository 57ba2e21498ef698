package com.citewise.provider;

import com.citewise.config.CitewiseProperties;
import com.citewise.model.Message;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * OpenAI chat completion provider.
 * The system instruction is sent as the first message of the conversation.
 */
@Slf4j
@Component
public class OpenAIProvider extends AbstractChatProvider {

    static final String NAME = "openai";
    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private final ObjectMapper objectMapper;

    public OpenAIProvider(WebClient webClient, CitewiseProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, NAME);
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected String defaultModel() {
        return "gpt-4o-mini";
    }

    @Override
    public Mono<String> complete(List<Message> messages, String system, String model) {
        if (!isEnabled()) {
            return Mono.error(new IllegalStateException("OpenAI provider is not enabled"));
        }

        String requestModel = resolveModel(model);
        log.info("Forwarding request to OpenAI: model={}, messages={}", requestModel, messages.size());

        String baseUrl = config.getBaseUrl() != null ? config.getBaseUrl() : DEFAULT_BASE_URL;
        String endpoint = baseUrl + "/chat/completions";

        Mono<String> responseMono = Mono.defer(() -> webClient.post()
                .uri(endpoint)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(buildRequest(messages, system, requestModel).toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::extractContent));

        return executeWithRetry(responseMono);
    }

    private ObjectNode buildRequest(List<Message> messages, String system, String model) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);

        ArrayNode payload = objectMapper.createArrayNode();
        if (system != null && !system.isBlank()) {
            payload.add(toNode(Message.system(system)));
        }
        for (Message message : messages) {
            payload.add(toNode(message));
        }
        request.set("messages", payload);
        return request;
    }

    private ObjectNode toNode(Message message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("role", message.getRole());
        node.put("content", message.getContent());
        return node;
    }

    /**
     * First choice's message content; an empty string when the model returned none.
     */
    private String extractContent(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : "";
    }
}
