package com.llmdispatch.exception;

import lombok.Getter;

/**
 * A completion call to a vendor failed: transport error, timeout, non-2xx status or an
 * unreadable response body.
 */
@Getter
public class ProviderCallException extends DispatchException {

    private final String provider;

    // HTTP status when the vendor answered, otherwise null
    private final Integer statusCode;

    public ProviderCallException(String provider, String message) {
        this(provider, message, null, null);
    }

    public ProviderCallException(String provider, String message, Throwable cause) {
        this(provider, message, null, cause);
    }

    public ProviderCallException(String provider, String message, Integer statusCode, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }
}
