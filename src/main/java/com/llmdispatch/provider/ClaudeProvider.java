package com.llmdispatch.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmdispatch.config.DispatchProperties;
import com.llmdispatch.model.CompletionResult;
import com.llmdispatch.model.GenerationOptions;
import com.llmdispatch.model.Message;
import com.llmdispatch.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic (Claude) messages API provider.
 * Claude has no system role in the message list, so system messages are lifted into the
 * top-level {@code system} field.
 */
@Slf4j
@Component
public class ClaudeProvider extends AbstractLlmProvider {

    public static final String NAME = "claude";
    static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    static final String DEFAULT_MODEL = "claude-3-5-sonnet-latest";
    static final int DEFAULT_MAX_TOKENS = 4096;
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    public ClaudeProvider(WebClient webClient, DispatchProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, objectMapper, NAME);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return super.isEnabled() && config.hasApiKey();
    }

    @Override
    protected Mono<?> probe() {
        return webClient.get()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/v1/models")
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .retrieve()
                .toBodilessEntity();
    }

    @Override
    protected Mono<CompletionResult> call(List<Message> messages, GenerationOptions options) {
        ObjectNode body = buildRequest(messages, options);
        log.info("Forwarding request to Anthropic: model={}", body.get("model").asText());

        return webClient.post()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/v1/messages")
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(body.toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::toResult);
    }

    ObjectNode buildRequest(List<Message> messages, GenerationOptions options) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", resolveModel(options, DEFAULT_MODEL));

        List<String> systemParts = new ArrayList<>();
        ArrayNode messagesArray = objectMapper.createArrayNode();
        for (Message msg : messages) {
            if (msg.getRole() == Message.Role.SYSTEM) {
                systemParts.add(msg.getContent());
                continue;
            }
            ObjectNode claudeMsg = messagesArray.addObject();
            claudeMsg.put("role", msg.getRole() == Message.Role.USER ? "user" : "assistant");
            claudeMsg.put("content", msg.getContent());
        }

        if (!systemParts.isEmpty()) {
            request.put("system", String.join("\n\n", systemParts));
        }
        request.set("messages", messagesArray);

        request.put("max_tokens", options.getMaxTokens() != null ? options.getMaxTokens() : DEFAULT_MAX_TOKENS);
        request.put("temperature", options.temperatureOr(DEFAULT_TEMPERATURE));
        if (options.getTopP() != null) {
            request.put("top_p", options.getTopP());
        }
        return request;
    }

    private CompletionResult toResult(JsonNode response) {
        JsonNode content = response.get("content");
        if (content == null || !content.isArray()) {
            throw malformed("no content blocks in Anthropic response");
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }

        TokenUsage usage = null;
        JsonNode usageNode = response.get("usage");
        if (usageNode != null && usageNode.isObject()) {
            Integer input = intOrNull(usageNode, "input_tokens");
            Integer output = intOrNull(usageNode, "output_tokens");
            usage = TokenUsage.of(input != null ? input : 0, output != null ? output : 0);
        }

        return CompletionResult.builder()
                .content(text.toString())
                .usage(usage)
                .provider(NAME)
                .build();
    }
}
