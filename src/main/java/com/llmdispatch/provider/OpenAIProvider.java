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

import java.util.List;

/**
 * OpenAI chat completion provider. Roles map one-to-one onto the chat completions API.
 */
@Slf4j
@Component
public class OpenAIProvider extends AbstractLlmProvider {

    public static final String NAME = "openai";
    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    static final String DEFAULT_MODEL = "gpt-4o-mini";

    public OpenAIProvider(WebClient webClient, DispatchProperties properties, ObjectMapper objectMapper) {
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
                .uri(baseUrl(DEFAULT_BASE_URL) + "/models")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .retrieve()
                .toBodilessEntity();
    }

    @Override
    protected Mono<CompletionResult> call(List<Message> messages, GenerationOptions options) {
        ObjectNode body = buildRequest(messages, options);
        log.info("Forwarding request to OpenAI: model={}", body.get("model").asText());

        return webClient.post()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(body.toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::toResult);
    }

    ObjectNode buildRequest(List<Message> messages, GenerationOptions options) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", resolveModel(options, DEFAULT_MODEL));

        ArrayNode messagesArray = request.putArray("messages");
        for (Message msg : messages) {
            messagesArray.addObject()
                    .put("role", msg.getRole().getValue())
                    .put("content", msg.getContent());
        }

        request.put("temperature", options.temperatureOr(DEFAULT_TEMPERATURE));
        if (options.getMaxTokens() != null) {
            request.put("max_tokens", options.getMaxTokens());
        }
        if (options.getTopP() != null) {
            request.put("top_p", options.getTopP());
        }
        request.put("stream", false);
        return request;
    }

    private CompletionResult toResult(JsonNode response) {
        JsonNode choices = response.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw malformed("no choices in OpenAI response");
        }
        JsonNode content = choices.get(0).path("message").get("content");

        TokenUsage usage = null;
        JsonNode usageNode = response.get("usage");
        if (usageNode != null && usageNode.isObject()) {
            Integer prompt = intOrNull(usageNode, "prompt_tokens");
            Integer completion = intOrNull(usageNode, "completion_tokens");
            Integer total = intOrNull(usageNode, "total_tokens");
            int promptTokens = prompt != null ? prompt : 0;
            int completionTokens = completion != null ? completion : 0;
            usage = TokenUsage.builder()
                    .promptTokens(promptTokens)
                    .completionTokens(completionTokens)
                    .totalTokens(total != null ? total : promptTokens + completionTokens)
                    .build();
        }

        return CompletionResult.builder()
                .content(content != null && !content.isNull() ? content.asText() : "")
                .usage(usage)
                .provider(NAME)
                .build();
    }
}
