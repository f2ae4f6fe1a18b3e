package com.llmdispatch.provider;

import com.llmdispatch.model.CompletionResult;
import com.llmdispatch.model.GenerationOptions;
import com.llmdispatch.model.Message;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for chat completion providers.
 * Implementations handle vendor-specific authentication, request/response mapping,
 * and API communication. The dispatch layer only ever sees this interface.
 */
public interface LlmProvider {

    /**
     * Get provider name (e.g., "openai", "claude", "ollama"). Used as the registry key.
     *
     * @return provider name
     */
    String getName();

    /**
     * Cheap liveness probe. Never signals an error: any transport or auth failure
     * completes with {@code false}. Not a guarantee that the next call succeeds.
     *
     * @return true if the provider answered the probe
     */
    Mono<Boolean> isAvailable();

    /**
     * Perform exactly one outbound completion call.
     *
     * @param messages conversation in chronological order
     * @param options  generation options; unset fields use the adapter's defaults
     * @return the completion, or an error describing the transport or vendor failure
     */
    Mono<CompletionResult> generateCompletion(List<Message> messages, GenerationOptions options);

    /**
     * Check if the provider has what it needs (credentials, endpoint) to be registered.
     *
     * @return true if ready to use
     */
    default boolean isEnabled() {
        return true;
    }
}
