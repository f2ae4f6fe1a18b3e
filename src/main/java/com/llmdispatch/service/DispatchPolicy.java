package com.llmdispatch.service;

import com.llmdispatch.exception.AllProvidersExhaustedException;
import com.llmdispatch.exception.ConfigurationException;
import com.llmdispatch.exception.ProviderCallException;
import com.llmdispatch.exception.ProviderUnavailableException;
import com.llmdispatch.model.CompletionResult;
import com.llmdispatch.model.DispatchConfig;
import com.llmdispatch.model.GenerationOptions;
import com.llmdispatch.model.Message;
import com.llmdispatch.provider.LlmProvider;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Turns one completion request into a strictly sequential series of provider calls.
 *
 * <p>The primary provider (explicit in the options, else the configured default) gets up to
 * {@code retryAttempts} tries with linear backoff ({@code retryBaseDelay * attempt}). After that
 * each registered entry of {@code fallbackOrder} other than the primary is probed and, if up,
 * called once. The first success wins. If nothing succeeds the caller gets a single
 * {@link AllProvidersExhaustedException} caused by the primary's last error.
 *
 * <p>Every failure class is retried the same way; a 400 is retried like a 503.
 * The policy keeps no state between calls.
 */
@Slf4j
public class DispatchPolicy {

    private final Scheduler scheduler;

    public DispatchPolicy() {
        this(Schedulers.parallel());
    }

    /**
     * @param scheduler used for backoff delays and attempt timeouts
     */
    public DispatchPolicy(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Mono<CompletionResult> dispatch(ProviderRegistry registry,
                                           DispatchConfig config,
                                           List<Message> messages,
                                           GenerationOptions options) {
        return Mono.defer(() -> {
            GenerationOptions effective = options != null ? options : GenerationOptions.none();
            String primaryName = effective.requestedProvider() != null
                    ? effective.requestedProvider()
                    : config.getDefaultProvider();

            if (primaryName == null) {
                return Mono.error(new ConfigurationException(
                        "No provider specified and no default provider configured"));
            }
            LlmProvider primary = registry.get(primaryName).orElse(null);
            if (primary == null) {
                return Mono.error(new ConfigurationException("Provider " + primaryName + " is not registered"
                        + " (registered: " + registry.listNames() + ")"));
            }

            Dispatch dispatch = new Dispatch(config, messages, effective, primary, fallbackCandidates(registry, config, primaryName));
            log.info("Routing request to provider {} (fallbacks: {})", primaryName, dispatch.fallbackNames());
            return dispatch.retryPrimary(1);
        });
    }

    private static List<LlmProvider> fallbackCandidates(ProviderRegistry registry, DispatchConfig config, String primaryName) {
        Set<String> seen = new LinkedHashSet<>();
        List<LlmProvider> candidates = new ArrayList<>();
        for (String name : config.getFallbackOrder()) {
            if (name == null || name.equals(primaryName) || !seen.add(name)) {
                continue;
            }
            registry.get(name).ifPresentOrElse(
                    candidates::add,
                    () -> log.debug("Fallback provider {} is not registered, skipping", name));
        }
        return candidates;
    }

    /**
     * State of one dispatch: the attempt counter for the primary and the index into the
     * fallback candidates. Each step returns an {@link Outcome} instead of throwing.
     */
    private final class Dispatch {

        private final DispatchConfig config;
        private final List<Message> messages;
        private final GenerationOptions options;
        private final LlmProvider primary;
        private final List<LlmProvider> fallbacks;
        private final Duration attemptTimeout;
        private final List<String> attempted = new ArrayList<>();

        private Dispatch(DispatchConfig config,
                         List<Message> messages,
                         GenerationOptions options,
                         LlmProvider primary,
                         List<LlmProvider> fallbacks) {
            this.config = config;
            this.messages = List.copyOf(messages);
            this.options = options;
            this.primary = primary;
            this.fallbacks = fallbacks;
            this.attemptTimeout = options.getTimeout() != null ? options.getTimeout() : config.getAttemptTimeout();
        }

        Mono<CompletionResult> retryPrimary(int attempt) {
            return attempt(primary).flatMap(outcome -> {
                if (outcome.isSuccess()) {
                    return Mono.just(outcome.getResult());
                }
                log.warn("Attempt {}/{} failed for provider {}: {}",
                        attempt, config.getRetryAttempts(), primary.getName(), outcome.getError().getMessage());

                if (attempt < config.getRetryAttempts()) {
                    Duration backoff = config.backoffAfter(attempt);
                    return Mono.delay(backoff, scheduler).then(Mono.defer(() -> retryPrimary(attempt + 1)));
                }
                log.warn("Failed to generate completion with {} after {} attempts, trying fallbacks",
                        primary.getName(), config.getRetryAttempts());
                return fallback(0, outcome.getError());
            });
        }

        Mono<CompletionResult> fallback(int index, Throwable primaryError) {
            if (index >= fallbacks.size()) {
                log.error("All providers exhausted; primary {} failed with: {}",
                        primary.getName(), primaryError.getMessage());
                return Mono.error(new AllProvidersExhaustedException(primary.getName(), attempted, primaryError));
            }
            LlmProvider candidate = fallbacks.get(index);
            return attempt(candidate).flatMap(outcome -> {
                if (outcome.isSuccess()) {
                    log.info("Falling back to provider {} succeeded", candidate.getName());
                    return Mono.just(outcome.getResult());
                }
                if (outcome.getError() instanceof ProviderUnavailableException) {
                    log.warn("Fallback provider {} is not available, skipping", candidate.getName());
                } else {
                    log.warn("Fallback provider {} also failed: {}", candidate.getName(), outcome.getError().getMessage());
                }
                return fallback(index + 1, primaryError);
            });
        }

        /**
         * Probe, then call once. Never errors: failures come back as an {@link Outcome}.
         */
        private Mono<Outcome> attempt(LlmProvider provider) {
            String name = provider.getName();
            return ProviderRegistry.probe(provider).flatMap(available -> {
                if (!available) {
                    return Mono.just(Outcome.failure(new ProviderUnavailableException(name)));
                }
                attempted.add(name);
                Mono<CompletionResult> call = Mono.defer(() -> provider.generateCompletion(messages, options));
                if (attemptTimeout != null) {
                    call = call.timeout(attemptTimeout, scheduler);
                }
                return call
                        .map(result -> Outcome.success(result.toBuilder().provider(name).build()))
                        .switchIfEmpty(Mono.fromSupplier(() ->
                                Outcome.failure(new ProviderCallException(name, "completion returned no result"))))
                        .onErrorResume(error -> Mono.just(Outcome.failure(asCallError(name, error))));
            });
        }

        List<String> fallbackNames() {
            return fallbacks.stream().map(LlmProvider::getName).toList();
        }
    }

    private static Throwable asCallError(String provider, Throwable error) {
        if (error instanceof TimeoutException) {
            return new ProviderCallException(provider, "attempt timed out", error);
        }
        return error;
    }

    /**
     * Result of a single attempt: either a completion or the error that ended it.
     */
    private static final class Outcome {

        private final CompletionResult result;
        private final Throwable error;

        private Outcome(CompletionResult result, Throwable error) {
            this.result = result;
            this.error = error;
        }

        static Outcome success(CompletionResult result) {
            return new Outcome(result, null);
        }

        static Outcome failure(Throwable error) {
            return new Outcome(null, error);
        }

        boolean isSuccess() {
            return result != null;
        }

        CompletionResult getResult() {
            return result;
        }

        Throwable getError() {
            return error;
        }
    }
}
