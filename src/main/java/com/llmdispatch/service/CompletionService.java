package com.llmdispatch.service;

import com.llmdispatch.model.CompletionResult;
import com.llmdispatch.model.DispatchConfig;
import com.llmdispatch.model.GenerationOptions;
import com.llmdispatch.model.Message;
import com.llmdispatch.provider.LlmProvider;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for the serving layer. Owns the provider registry and the dispatch policy;
 * errors from the policy pass through untouched.
 */
@Slf4j
public class CompletionService {

    private final ProviderRegistry registry;
    private final DispatchPolicy policy;
    private final AtomicReference<DispatchConfig> config = new AtomicReference<>(DispatchConfig.defaults());

    public CompletionService() {
        this(new ProviderRegistry(), new DispatchPolicy());
    }

    public CompletionService(ProviderRegistry registry, DispatchPolicy policy) {
        this.registry = registry;
        this.policy = policy;
    }

    /**
     * Replace the dispatch configuration. Calls already in flight keep the snapshot they started with.
     */
    public void configure(DispatchConfig configuration) {
        this.config.set(Objects.requireNonNull(configuration, "configuration"));
        log.info("Dispatch configured: default={}, fallback={}, retryAttempts={}, retryBaseDelay={}",
                configuration.getDefaultProvider(), configuration.getFallbackOrder(),
                configuration.getRetryAttempts(), configuration.getRetryBaseDelay());
    }

    public DispatchConfig getConfiguration() {
        return config.get();
    }

    public void registerProvider(LlmProvider provider) {
        registry.register(provider);
    }

    /**
     * Generate a completion, retrying the primary provider and then walking the fallback chain.
     */
    public Mono<CompletionResult> complete(List<Message> messages, GenerationOptions options) {
        if (messages == null) {
            return Mono.error(new IllegalArgumentException("messages must not be null"));
        }
        return Mono.defer(() -> policy.dispatch(registry, config.get(), messages, options));
    }

    public Mono<CompletionResult> complete(List<Message> messages) {
        return complete(messages, GenerationOptions.none());
    }

    public List<String> listProviders() {
        return registry.listNames();
    }

    public Mono<Map<String, Boolean>> checkAvailability() {
        return registry.availability();
    }
}
