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
 * Local Ollama runtime provider. Needs no credentials; liveness is the {@code /api/tags} endpoint.
 */
@Slf4j
@Component
public class OllamaProvider extends AbstractLlmProvider {

    public static final String NAME = "ollama";
    static final String DEFAULT_BASE_URL = "http://localhost:11434";
    static final String DEFAULT_MODEL = "llama3.2";

    public OllamaProvider(WebClient webClient, DispatchProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, objectMapper, NAME);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected Mono<?> probe() {
        return webClient.get()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/api/tags")
                .retrieve()
                .toBodilessEntity();
    }

    @Override
    protected Mono<CompletionResult> call(List<Message> messages, GenerationOptions options) {
        ObjectNode body = buildRequest(messages, options);
        log.info("Forwarding request to Ollama: model={}", body.get("model").asText());

        return webClient.post()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/api/chat")
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
        request.put("stream", false);

        ObjectNode modelOptions = request.putObject("options");
        modelOptions.put("temperature", options.temperatureOr(DEFAULT_TEMPERATURE));
        if (options.getMaxTokens() != null) {
            modelOptions.put("num_predict", options.getMaxTokens());
        }
        if (options.getTopP() != null) {
            modelOptions.put("top_p", options.getTopP());
        }
        return request;
    }

    private CompletionResult toResult(JsonNode response) {
        JsonNode message = response.get("message");
        if (message == null || !message.isObject()) {
            throw malformed("no message in Ollama response");
        }

        // Ollama only reports counts when evaluation actually ran
        TokenUsage usage = null;
        Integer evalCount = intOrNull(response, "eval_count");
        if (evalCount != null && evalCount > 0) {
            Integer promptEvalCount = intOrNull(response, "prompt_eval_count");
            usage = TokenUsage.of(promptEvalCount != null ? promptEvalCount : 0, evalCount);
        }

        return CompletionResult.builder()
                .content(message.path("content").asText(""))
                .usage(usage)
                .provider(NAME)
                .build();
    }
}
