package com.autohistorian.service.generation;

/** Base type for failures of a call to the text-generation backend. */
public class GenerationException extends RuntimeException {
    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
