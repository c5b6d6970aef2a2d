package com.autohistorian.service.extraction;

import com.autohistorian.config.AppProperties;
import com.autohistorian.model.Document;
import com.autohistorian.model.Entity;
import com.autohistorian.model.Event;
import com.autohistorian.model.ExtractionResult;
import com.autohistorian.model.Statement;
import com.autohistorian.model.TopicRef;
import com.autohistorian.service.generation.PermanentBackendException;
import com.autohistorian.service.generation.RetriesExhaustedException;
import com.autohistorian.service.generation.TransientBackendException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtractionPipelineTest {

    private static Document doc(String id) {
        Document d = new Document();
        d.setId(id);
        d.setHeadline("Headline " + id);
        return d;
    }

    private static Event eventFor(Document d) {
        Event e = new Event();
        e.setId("ev-" + d.getId());
        e.setDescription("event of " + d.getId());
        e.setSourceDocumentId(d.getId());
        return e;
    }

    private static ExtractionPipeline pipeline(FactExtractor<Event> events, FactExtractor<Statement> statements,
                                               FactExtractor<Entity> entities, FactExtractor<TopicRef> topics) {
        return new ExtractionPipeline(events, statements, entities, topics, new AppProperties());
    }

    @Test
    void resultCarriesTheDocumentIdAndAllFourLists() {
        StubExtractor<TopicRef> topics = new StubExtractor<>(d -> Mono.just(List.of(new TopicRef("Budget", "economy", 0.9))));
        ExtractionPipeline p = pipeline(new StubExtractor<>(d -> Mono.just(List.of(eventFor(d)))),
                StubExtractor.empty(), StubExtractor.empty(), topics);

        ExtractionResult r = p.extractOne(doc("d1"), null).block();

        assertEquals("d1", r.getDocumentId());
        assertEquals("ev-d1", r.getEvents().get(0).getId());
        assertEquals(List.of(new TopicRef("Budget", "economy", 0.9)), r.getTopics());
        assertEquals(1, topics.calls.get());
    }

    @Test
    void topicOverrideSkipsTopicExtraction() {
        StubExtractor<TopicRef> topics = new StubExtractor<>(d -> Mono.just(List.of(new TopicRef("Ignored", "other", 1.0))));
        StubExtractor<Entity> entities = StubExtractor.empty();
        ExtractionPipeline p = pipeline(StubExtractor.empty(), StubExtractor.empty(), entities, topics);

        ExtractionResult r = p.extractOne(doc("d1"), "  Minnesota ICE operations ").block();

        assertEquals(List.of(new TopicRef("Minnesota ICE operations", "other", 1.0)), r.getTopics());
        assertEquals(0, topics.calls.get());
        assertEquals(1, entities.calls.get());
    }

    @Test
    void anyExtractorFailureFailsTheDocument() {
        ExtractionPipeline p = pipeline(StubExtractor.empty(),
                new StubExtractor<>(d -> Mono.error(new PermanentBackendException("HTTP 500"))),
                StubExtractor.empty(), StubExtractor.empty());

        assertThrows(PermanentBackendException.class, () -> p.extractOne(doc("d1"), null).block());
    }

    @Test
    void batchKeepsInputOrderWhateverTheCompletionOrder() {
        AtomicInteger completionCounter = new AtomicInteger();
        List<String> completionOrder = new java.util.concurrent.CopyOnWriteArrayList<>();
        StubExtractor<Event> events = new StubExtractor<>(d -> {
            long delay = switch (d.getId()) {
                case "d1" -> 150;
                case "d2" -> 10;
                default -> 60;
            };
            return Mono.delay(Duration.ofMillis(delay))
                    .doOnNext(x -> {
                        completionCounter.incrementAndGet();
                        completionOrder.add(d.getId());
                    })
                    .thenReturn(List.of(eventFor(d)));
        });
        ExtractionPipeline p = pipeline(events, StubExtractor.empty(), StubExtractor.empty(), StubExtractor.empty());

        List<ExtractionResult> results = p.extractBatch(List.of(doc("d1"), doc("d2"), doc("d3")), null, 3).block();

        assertEquals(List.of("d1", "d2", "d3"),
                results.stream().map(ExtractionResult::getDocumentId).collect(Collectors.toList()));
        assertEquals("d2", completionOrder.get(0));
        assertEquals(3, completionCounter.get());
    }

    @Test
    void batchNeverExceedsTheConcurrencyCap() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        StubExtractor<Entity> entities = new StubExtractor<>(d -> Mono.delay(Duration.ofMillis(30))
                .doOnSubscribe(s -> peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max))
                .doFinally(s -> inFlight.decrementAndGet())
                .thenReturn(List.of()));
        ExtractionPipeline p = pipeline(StubExtractor.empty(), StubExtractor.empty(), entities, StubExtractor.empty());

        List<Document> docs = List.of(doc("a"), doc("b"), doc("c"), doc("d"), doc("e"), doc("f"), doc("g"));
        assertEquals(7, p.extractBatch(docs, null, 2).block().size());
        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
    }

    @Test
    void failingDocumentIsNamedAndSiblingsAreCancelled() {
        AtomicBoolean siblingCancelled = new AtomicBoolean();
        StubExtractor<Entity> entities = new StubExtractor<>(d -> {
            if (d.getId().equals("slow")) {
                return Mono.<List<Entity>>never().doOnCancel(() -> siblingCancelled.set(true));
            }
            return Mono.delay(Duration.ofMillis(20))
                    .then(Mono.error(new RetriesExhaustedException(4, new TransientBackendException("429"))));
        });
        ExtractionPipeline p = pipeline(StubExtractor.empty(), StubExtractor.empty(), entities, StubExtractor.empty());

        DocumentExtractionException ex = assertThrows(DocumentExtractionException.class,
                () -> p.extractBatch(List.of(doc("slow"), doc("bad")), null, 2).block(Duration.ofSeconds(5)));

        assertEquals("bad", ex.getDocumentId());
        assertInstanceOf(RetriesExhaustedException.class, ex.getCause());
        assertTrue(siblingCancelled.get());
    }

    @Test
    void settledBatchReportsEveryDocumentInOrder() {
        StubExtractor<Event> events = new StubExtractor<>(d -> d.getId().equals("d2")
                ? Mono.error(new PermanentBackendException("HTTP 400"))
                : Mono.just(List.of(eventFor(d))));
        ExtractionPipeline p = pipeline(events, StubExtractor.empty(), StubExtractor.empty(), StubExtractor.empty());

        List<ExtractionOutcome> outcomes = p.extractBatchSettled(List.of(doc("d1"), doc("d2"), doc("d3")), null, 2).block();

        assertEquals(3, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess());
        assertFalse(outcomes.get(1).isSuccess());
        assertEquals("d2", outcomes.get(1).getDocumentId());
        assertInstanceOf(PermanentBackendException.class, outcomes.get(1).getError());
        assertEquals("d3", outcomes.get(2).getResult().getDocumentId());
    }

    @Test
    void emptyBatchIsEmptyResult() {
        ExtractionPipeline p = pipeline(StubExtractor.empty(), StubExtractor.empty(), StubExtractor.empty(), StubExtractor.empty());
        assertEquals(List.of(), p.extractBatch(List.of(), null).block());
    }
}
