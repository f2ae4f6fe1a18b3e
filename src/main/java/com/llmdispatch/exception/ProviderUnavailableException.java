package com.llmdispatch.exception;

import lombok.Getter;

/**
 * A provider's liveness probe reported it down at dispatch time.
 */
@Getter
public class ProviderUnavailableException extends DispatchException {

    private final String provider;

    public ProviderUnavailableException(String provider) {
        super("Provider " + provider + " is not available");
        this.provider = provider;
    }
}
