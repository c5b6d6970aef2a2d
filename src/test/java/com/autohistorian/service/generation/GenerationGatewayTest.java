package com.autohistorian.service.generation;

import com.autohistorian.config.WebClientConfig;
import com.autohistorian.util.RequestRateLimiter;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenerationGatewayTest {
    private final StructuredOutputParser parser = new StructuredOutputParser(WebClientConfig.newObjectMapper());

    private GenerationGateway gateway(StubBackend backend, int requestsPerMinute, int maxRetries) {
        return new GenerationGateway(backend, parser, new RequestRateLimiter("test", requestsPerMinute),
                maxRetries, Duration.ofMillis(5));
    }

    @Test
    void throttlingIsRetriedUntilSuccess() {
        StubBackend backend = StubBackend.answering("ok")
                .then(Mono.error(new TransientBackendException("429")))
                .then(Mono.error(new TransientBackendException("429")));

        assertEquals("ok", gateway(backend, 60_000, 3).generate("p", "s").block());
        assertEquals(3, backend.calls());
    }

    @Test
    void exhaustedRetriesFailExplicitly() {
        StubBackend backend = new StubBackend(p -> Mono.error(new TransientBackendException("quota")));

        RuntimeException ex = assertThrows(RuntimeException.class,
                () -> gateway(backend, 60_000, 2).generate("p", "s").block());
        RetriesExhaustedException exhausted = assertInstanceOf(RetriesExhaustedException.class, ex);
        assertEquals(3, exhausted.getAttempts());
        assertInstanceOf(TransientBackendException.class, exhausted.getCause());
        assertEquals(3, backend.calls()); // 1 attempt + 2 retries
    }

    @Test
    void permanentFailureIsNotRetried() {
        StubBackend backend = new StubBackend(p -> Mono.error(new PermanentBackendException("HTTP 400")));

        assertThrows(PermanentBackendException.class, () -> gateway(backend, 60_000, 3).generate("p", "s").block());
        assertEquals(1, backend.calls());
    }

    @Test
    void emptyBackendAnswerBecomesEmptyText() {
        StubBackend backend = new StubBackend(p -> Mono.empty());
        assertEquals("", gateway(backend, 60_000, 0).generate("p", "s").block());
    }

    @Test
    void unparseableAnswerIsEmptyStructuredResult() {
        StubBackend backend = StubBackend.answering("Sure! Here's the data: not json");
        assertTrue(gateway(backend, 60_000, 0).generateStructured("p").block().isEmpty());
    }

    @Test
    void concurrentCallersAreSpacedByTheMinimumInterval() {
        StubBackend backend = StubBackend.answering("[]");
        GenerationGateway gateway = gateway(backend, 600, 0); // 100 ms apart

        Flux.range(0, 4)
                .flatMap(i -> gateway.generate("p" + i, "s"), 4)
                .collectList()
                .block(Duration.ofSeconds(5));

        List<Long> sorted = new ArrayList<>(backend.callNanos());
        sorted.sort(Long::compare);
        assertEquals(4, sorted.size());
        for (int i = 1; i < sorted.size(); i++) {
            long gapMs = Duration.ofNanos(sorted.get(i) - sorted.get(i - 1)).toMillis();
            // timer jitter allowance
            assertTrue(gapMs >= 75, "calls " + (i - 1) + " and " + i + " only " + gapMs + " ms apart");
        }
    }

    @Test
    void retriesAlsoWaitForTheLimiter() {
        StubBackend backend = StubBackend.answering("ok")
                .then(Mono.error(new TransientBackendException("429")));
        GenerationGateway gateway = new GenerationGateway(backend, parser, new RequestRateLimiter("test", 600),
                1, Duration.ofMillis(1));

        gateway.generate("p", "s").block(Duration.ofSeconds(5));

        List<Long> calls = backend.callNanos();
        assertEquals(2, calls.size());
        assertTrue(Duration.ofNanos(calls.get(1) - calls.get(0)).toMillis() >= 75);
    }
}
