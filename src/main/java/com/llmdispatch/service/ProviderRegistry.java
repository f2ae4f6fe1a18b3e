package com.llmdispatch.service;

import com.llmdispatch.provider.LlmProvider;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuples;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name-keyed set of providers. Registration may race with lookups during startup wiring,
 * so every access to the map goes through the instance lock; probes run outside it.
 */
@Slf4j
public class ProviderRegistry {

    // Insertion-ordered; re-registering a name keeps its original position
    private final Map<String, LlmProvider> providers = new LinkedHashMap<>();

    /**
     * Register a provider, replacing any earlier provider with the same name.
     */
    public void register(LlmProvider provider) {
        String name = provider.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        LlmProvider previous;
        synchronized (this) {
            previous = providers.put(name, provider);
        }
        if (previous != null && previous != provider) {
            log.info("Replaced LLM provider: {}", name);
        } else {
            log.info("Registered LLM provider: {}", name);
        }
    }

    public synchronized Optional<LlmProvider> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(name));
    }

    /**
     * Registered names in registration order.
     */
    public synchronized List<String> listNames() {
        return List.copyOf(providers.keySet());
    }

    /**
     * Probe every registered provider. A probe that errors or completes empty counts as
     * unavailable and does not affect the others.
     *
     * @return name to liveness, in registration order
     */
    public Mono<Map<String, Boolean>> availability() {
        List<LlmProvider> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(providers.values());
        }
        return Flux.fromIterable(snapshot)
                .flatMapSequential(provider -> probe(provider).map(up -> Tuples.of(provider.getName(), up)))
                .collect(() -> new LinkedHashMap<String, Boolean>(), (map, entry) -> map.put(entry.getT1(), entry.getT2()))
                .map(Collections::unmodifiableMap);
    }

    static Mono<Boolean> probe(LlmProvider provider) {
        return Mono.defer(provider::isAvailable)
                .onErrorResume(error -> {
                    log.warn("Liveness probe for provider {} failed: {}", provider.getName(), error.toString());
                    return Mono.just(false);
                })
                .defaultIfEmpty(false);
    }
}
