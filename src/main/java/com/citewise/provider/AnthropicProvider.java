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
 * Anthropic (Claude) chat completion provider using the Messages API.
 */
@Slf4j
@Component
public class AnthropicProvider extends AbstractChatProvider {

    static final String NAME = "anthropic";
    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    private static final int MAX_TOKENS = 4096;

    private final ObjectMapper objectMapper;

    public AnthropicProvider(
            WebClient webClient,
            CitewiseProperties properties,
            ObjectMapper objectMapper) {
        super(webClient, properties, NAME);
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected String defaultModel() {
        return "claude-3-5-haiku-latest";
    }

    @Override
    public Mono<String> complete(List<Message> messages, String system, String model) {
        if (!isEnabled()) {
            return Mono.error(new IllegalStateException("Anthropic provider is not enabled"));
        }

        String requestModel = resolveModel(model);
        log.info("Forwarding request to Anthropic: model={}, messages={}", requestModel, messages.size());

        String baseUrl = config.getBaseUrl() != null ? config.getBaseUrl() : DEFAULT_BASE_URL;
        String endpoint = baseUrl + "/v1/messages";

        Mono<String> responseMono = Mono.defer(() -> webClient.post()
                .uri(endpoint)
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(buildRequest(messages, system, requestModel).toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::extractText));

        return executeWithRetry(responseMono);
    }

    /**
     * Messages API request: the system instruction is a top-level field and
     * each message body is an array of content blocks.
     */
    private ObjectNode buildRequest(List<Message> messages, String system, String model) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);
        request.put("max_tokens", MAX_TOKENS);

        if (system != null && !system.isBlank()) {
            request.put("system", system);
        }

        ArrayNode messagesArray = objectMapper.createArrayNode();
        for (Message message : messages) {
            if (Message.ROLE_SYSTEM.equals(message.getRole())) {
                continue;
            }
            ObjectNode anthropicMessage = objectMapper.createObjectNode();
            anthropicMessage.put("role", message.getRole());

            ArrayNode contentArray = objectMapper.createArrayNode();
            ObjectNode textContent = objectMapper.createObjectNode();
            textContent.put("type", "text");
            textContent.put("text", message.getContent());
            contentArray.add(textContent);

            anthropicMessage.set("content", contentArray);
            messagesArray.add(anthropicMessage);
        }
        request.set("messages", messagesArray);

        return request;
    }

    private String extractText(JsonNode response) {
        StringBuilder text = new StringBuilder();
        JsonNode content = response.get("content");
        if (content != null && content.isArray()) {
            for (JsonNode item : content) {
                if ("text".equals(item.path("type").asText())) {
                    text.append(item.path("text").asText());
                }
            }
        }
        return text.toString();
    }
}
