package com.autohistorian.service.generation;

/** Throttling or quota signal from the backend; the gateway retries these with backoff. */
public class TransientBackendException extends GenerationException {
    public TransientBackendException(String message) {
        super(message);
    }

    public TransientBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
