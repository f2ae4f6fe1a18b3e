package com.llmdispatch.exception;

import lombok.Getter;

import java.util.List;

/**
 * Every retry of the primary provider and every fallback candidate failed.
 * The cause is always the primary provider's last error, never a fallback's.
 */
@Getter
public class AllProvidersExhaustedException extends DispatchException {

    private final String primaryProvider;
    private final List<String> attemptedProviders;

    public AllProvidersExhaustedException(String primaryProvider, List<String> attemptedProviders, Throwable primaryError) {
        super("All providers exhausted (primary: " + primaryProvider + ", attempted: " + attemptedProviders + "): "
                + primaryError.getMessage(), primaryError);
        this.primaryProvider = primaryProvider;
        this.attemptedProviders = List.copyOf(attemptedProviders);
    }
}
