package com.autohistorian.service.generation;

/** Raised when every retry after a throttling response has been used up. */
public class RetriesExhaustedException extends GenerationException {
    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastFailure) {
        super("Generation still throttled after " + attempts + " attempts", lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
