package com.llmdispatch.exception;

/**
 * No usable primary provider: neither the requested nor the default name is registered.
 * Raised before any network call is made.
 */
public class ConfigurationException extends DispatchException {

    public ConfigurationException(String message) {
        super(message);
    }
}
