package com.autohistorian.service.generation;

import com.autohistorian.config.GenerationProperties;
import com.autohistorian.util.RequestRateLimiter;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Optional;

/**
 * Single entry point to the generation backend.
 *
 * <p>Every attempt, retries included, first takes a slot from the shared {@link RequestRateLimiter},
 * so all concurrent callers in the process share one outbound rate. Throttling failures
 * ({@link TransientBackendException}) are retried up to {@code maxRetries} times with a linear
 * backoff of {@code attempt × backoffUnit}; anything else propagates on the first failure.
 * An exhausted budget surfaces as {@link RetriesExhaustedException}.
 */
@Service
public class GenerationGateway {
    private static final Logger log = LoggerFactory.getLogger(GenerationGateway.class);

    private final GenerationBackend backend;
    private final RequestRateLimiter rateLimiter;
    private final StructuredOutputParser parser;
    private final int maxRetries;
    private final Duration backoffUnit;

    @Autowired
    public GenerationGateway(GenerationBackend backend, StructuredOutputParser parser, GenerationProperties properties) {
        this(backend, parser, new RequestRateLimiter("generation", properties.getRequestsPerMinute()),
                properties.getMaxRetries(), properties.getBackoffUnit());
    }

    public GenerationGateway(GenerationBackend backend, StructuredOutputParser parser, RequestRateLimiter rateLimiter,
                             int maxRetries, Duration backoffUnit) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.backend = backend;
        this.parser = parser;
        this.rateLimiter = rateLimiter;
        this.maxRetries = maxRetries;
        this.backoffUnit = backoffUnit;
    }

    /** Text completion; empty backend output becomes "". */
    public Mono<String> generate(String prompt, String systemPrompt) {
        return Mono.defer(() -> rateLimiter.acquire()
                        .then(Mono.defer(() -> backend.complete(prompt, systemPrompt))))
                .defaultIfEmpty("")
                .retryWhen(throttlingRetry());
    }

    /**
     * Completion parsed as JSON. An answer that cannot be parsed yields an empty Optional; a failed
     * call still fails the returned Mono.
     */
    public Mono<Optional<JsonNode>> generateStructured(String prompt) {
        return generate(prompt, Prompts.SYSTEM).map(parser::parse);
    }

    private Retry throttlingRetry() {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            if (!(failure instanceof TransientBackendException)) {
                return Mono.error(failure);
            }
            long retry = signal.totalRetries() + 1;
            if (retry > maxRetries) {
                log.warn("Generation throttled {} times in a row; giving up", retry);
                return Mono.error(new RetriesExhaustedException((int) retry, failure));
            }
            Duration backoff = backoffUnit.multipliedBy(retry);
            log.warn("Generation throttled ({}); retry {}/{} in {} ms", failure.getMessage(), retry, maxRetries, backoff.toMillis());
            return Mono.delay(backoff);
        }));
    }

    public RequestRateLimiter getRateLimiter() {
        return rateLimiter;
    }
}
