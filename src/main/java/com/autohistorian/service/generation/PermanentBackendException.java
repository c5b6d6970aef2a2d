package com.autohistorian.service.generation;

/** Any backend failure other than throttling. Never retried. */
public class PermanentBackendException extends GenerationException {
    public PermanentBackendException(String message) {
        super(message);
    }

    public PermanentBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
