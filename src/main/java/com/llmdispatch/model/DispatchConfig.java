package com.llmdispatch.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Process-wide dispatch settings. Immutable; the completion service swaps whole instances.
 *
 * <p>{@code defaultProvider} does not have to appear in {@code fallbackOrder}, and
 * {@code fallbackOrder} may name providers that were never registered (they are skipped).
 */
@Value
public class DispatchConfig {

    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_BASE_DELAY = Duration.ofSeconds(1);

    String defaultProvider;
    List<String> fallbackOrder;
    int retryAttempts;
    Duration retryBaseDelay;

    // Null means attempts are not bounded beyond the HTTP client's own timeouts
    Duration attemptTimeout;

    @Builder(toBuilder = true)
    private DispatchConfig(String defaultProvider,
                           List<String> fallbackOrder,
                           int retryAttempts,
                           Duration retryBaseDelay,
                           Duration attemptTimeout) {
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be >= 1, was " + retryAttempts);
        }
        if (retryBaseDelay != null && retryBaseDelay.isNegative()) {
            throw new IllegalArgumentException("retryBaseDelay must not be negative, was " + retryBaseDelay);
        }
        if (attemptTimeout != null && (attemptTimeout.isNegative() || attemptTimeout.isZero())) {
            throw new IllegalArgumentException("attemptTimeout must be positive, was " + attemptTimeout);
        }
        this.defaultProvider = defaultProvider == null || defaultProvider.isBlank() ? null : defaultProvider.trim();
        this.fallbackOrder = fallbackOrder == null ? List.of() : List.copyOf(fallbackOrder);
        this.retryAttempts = retryAttempts;
        this.retryBaseDelay = retryBaseDelay == null ? Duration.ZERO : retryBaseDelay;
        this.attemptTimeout = attemptTimeout;
    }

    /**
     * No default provider, no fallbacks, library retry defaults.
     */
    public static DispatchConfig defaults() {
        return DispatchConfig.builder().build();
    }

    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    public Duration backoffAfter(int attempt) {
        return retryBaseDelay.multipliedBy(attempt);
    }

    public static class DispatchConfigBuilder {
        private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        private Duration retryBaseDelay = DEFAULT_RETRY_BASE_DELAY;
    }
}
