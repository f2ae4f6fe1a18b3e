package com.llmdispatch.exception;

/**
 * Base type for every error raised by the dispatch layer.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
