package com.llmdispatch.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmdispatch.config.DispatchProperties;
import com.llmdispatch.exception.ProviderCallException;
import com.llmdispatch.model.CompletionResult;
import com.llmdispatch.model.GenerationOptions;
import com.llmdispatch.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for providers with the probe and error mapping they share.
 */
@Slf4j
public abstract class AbstractLlmProvider implements LlmProvider {

    protected static final double DEFAULT_TEMPERATURE = 0.7;
    private static final int MAX_ERROR_BODY_LENGTH = 500;

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final DispatchProperties.ProviderConfig config;
    private final Duration probeTimeout;

    protected AbstractLlmProvider(
            WebClient webClient,
            DispatchProperties properties,
            ObjectMapper objectMapper,
            String providerName) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.config = properties.getProviders().getOrDefault(providerName, new DispatchProperties.ProviderConfig());
        this.probeTimeout = properties.getProbeTimeout();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public Mono<Boolean> isAvailable() {
        if (!isEnabled()) {
            return Mono.just(false);
        }
        return Mono.defer(this::probe)
                .timeout(probeTimeout)
                .thenReturn(true)
                .onErrorResume(error -> {
                    log.debug("Provider {} failed its liveness probe: {}", getName(), error.toString());
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<CompletionResult> generateCompletion(List<Message> messages, GenerationOptions options) {
        if (!isEnabled()) {
            return Mono.error(new ProviderCallException(getName(), "provider is not enabled"));
        }
        GenerationOptions effective = options != null ? options : GenerationOptions.none();
        return Mono.defer(() -> call(messages, effective))
                .onErrorMap(error -> !(error instanceof ProviderCallException), this::toCallException);
    }

    /**
     * Lightweight request that completes if the provider is reachable and accepts our credentials.
     */
    protected abstract Mono<?> probe();

    /**
     * One vendor request, mapped to a {@link CompletionResult}.
     */
    protected abstract Mono<CompletionResult> call(List<Message> messages, GenerationOptions options);

    /**
     * Model to use when the caller did not ask for one.
     */
    protected String resolveModel(GenerationOptions options, String builtInDefault) {
        String configured = config.getDefaultModel() != null && !config.getDefaultModel().isBlank()
                ? config.getDefaultModel()
                : builtInDefault;
        return options.modelOr(configured);
    }

    protected String baseUrl(String fallback) {
        String url = config.getBaseUrl() != null && !config.getBaseUrl().isBlank() ? config.getBaseUrl() : fallback;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    protected ProviderCallException malformed(String detail) {
        return new ProviderCallException(getName(), "unexpected response: " + detail);
    }

    protected static Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asInt() : null;
    }

    private ProviderCallException toCallException(Throwable error) {
        if (error instanceof WebClientResponseException responseError) {
            String body = responseError.getResponseBodyAsString();
            if (body.length() > MAX_ERROR_BODY_LENGTH) {
                body = body.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
            }
            log.debug("Provider {} returned {}: {}", getName(), responseError.getStatusCode(), body);
            return new ProviderCallException(getName(),
                    "HTTP " + responseError.getStatusCode().value() + " " + body,
                    responseError.getStatusCode().value(),
                    responseError);
        }
        if (error instanceof TimeoutException) {
            return new ProviderCallException(getName(), "request timed out", error);
        }
        return new ProviderCallException(getName(), "request failed: " + error.getMessage(), error);
    }
}
