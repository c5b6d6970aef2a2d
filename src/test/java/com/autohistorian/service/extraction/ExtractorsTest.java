package com.autohistorian.service.extraction;

import com.autohistorian.config.WebClientConfig;
import com.autohistorian.model.Document;
import com.autohistorian.model.Entity;
import com.autohistorian.model.Event;
import com.autohistorian.model.Stance;
import com.autohistorian.model.Statement;
import com.autohistorian.model.TopicRef;
import com.autohistorian.service.generation.GenerationGateway;
import com.autohistorian.service.generation.PermanentBackendException;
import com.autohistorian.service.generation.StructuredOutputParser;
import com.autohistorian.service.generation.StubBackend;
import com.autohistorian.util.RequestRateLimiter;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtractorsTest {
    private static final OffsetDateTime PUBLISHED = OffsetDateTime.of(2024, 3, 5, 9, 0, 0, 0, ZoneOffset.UTC);

    private static GenerationGateway gateway(StubBackend backend) {
        return new GenerationGateway(backend, new StructuredOutputParser(WebClientConfig.newObjectMapper()),
                new RequestRateLimiter("test", 60_000), 0, Duration.ofMillis(1));
    }

    private static Document document() {
        Document d = new Document();
        d.setId("doc-1");
        d.setWebUrl("https://example.com/a");
        d.setHeadline("Senate passes budget");
        d.setAbstractText("The Senate voted late Friday.");
        d.setSnippet("snippet text");
        d.setObservedAt(PUBLISHED);
        return d;
    }

    @Test
    void eventsAreMappedWithSourceAndObservationTime() {
        StubBackend backend = StubBackend.answering("""
                ```json
                [{"description": "Senate passed the budget", "event_type": "vote",
                  "valid_time": "2024-03-01T22:00:00Z", "participants": ["Senate"],
                  "location": "Washington", "confidence": 1.7},
                 42,
                 {"description": "Talks stalled", "valid_time": "sometime in 2023"}]
                ```""");

        List<Event> events = new EventExtractor(gateway(backend)).extract(document()).block();

        assertEquals(2, events.size());
        Event first = events.get(0);
        assertNotNull(first.getId());
        assertEquals("vote", first.getCategory());
        assertEquals(OffsetDateTime.of(2024, 3, 1, 22, 0, 0, 0, ZoneOffset.UTC), first.getValidTime());
        assertEquals(PUBLISHED, first.getObservationTime());
        assertEquals(List.of("Senate"), first.getParticipants());
        assertEquals("doc-1", first.getSourceDocumentId());
        assertEquals("https://example.com/a", first.getSourceUrl());
        assertEquals(1.0, first.getConfidence());

        Event second = events.get(1);
        assertEquals("unknown", second.getCategory());
        assertNull(second.getValidTime());
        assertEquals(PUBLISHED, second.getObservationTime());
    }

    @Test
    void promptContainsHeadlineAbstractBlocks() {
        StubBackend backend = StubBackend.answering("[]");
        new EventExtractor(gateway(backend)).extract(document()).block();

        String prompt = backend.prompts().get(0);
        assertTrue(prompt.contains("Headline: Senate passes budget\n\nAbstract: The Senate voted late Friday."));
        assertTrue(!prompt.contains("Lead:"));
    }

    @Test
    void malformedOutputYieldsNoFacts() {
        StubBackend backend = StubBackend.answering("Sure! Here's the data: not json");
        assertEquals(List.of(), new EventExtractor(gateway(backend)).extract(document()).block());
        assertEquals(List.of(), new StatementExtractor(gateway(backend)).extract(document()).block());
    }

    @Test
    void objectInsteadOfArrayYieldsNoFacts() {
        StubBackend backend = StubBackend.answering("{\"description\": \"not a list\"}");
        assertEquals(List.of(), new EventExtractor(gateway(backend)).extract(document()).block());
    }

    @Test
    void failedCallPropagates() {
        StubBackend backend = new StubBackend(p -> Mono.error(new PermanentBackendException("HTTP 500")));
        assertThrows(PermanentBackendException.class, () -> new EntityExtractor(gateway(backend)).extract(document()).block());
    }

    @Test
    void statementStanceIsLenient() {
        StubBackend backend = StubBackend.answering("""
                [{"content": "We will pass it", "speaker": "Sen. Smith", "speaker_role": "Majority leader", "stance": " PRO "},
                 {"content": "Unclear", "stance": "maybe"},
                 {"content": "No comment", "stance": null}]""");

        List<Statement> statements = new StatementExtractor(gateway(backend)).extract(document()).block();

        assertEquals(3, statements.size());
        assertEquals(Stance.PRO, statements.get(0).getStance());
        assertEquals("Majority leader", statements.get(0).getSpeakerRole());
        assertNull(statements.get(1).getStance());
        assertEquals("Unknown", statements.get(1).getSpeaker());
        assertNull(statements.get(2).getStance());
        assertEquals("doc-1", statements.get(2).getSourceDocumentId());
        assertEquals(PUBLISHED, statements.get(2).getObservationTime());
    }

    @Test
    void entityTypeDefaultsToUnknown() {
        StubBackend backend = StubBackend.answering("[{\"name\": \"U.S. Senate\", \"description\": \"upper chamber\"}]");
        List<Entity> entities = new EntityExtractor(gateway(backend)).extract(document()).block();
        assertEquals("unknown", entities.get(0).getCategory());
        assertEquals("U.S. Senate", entities.get(0).getName());
    }

    @Test
    void topicsAreTrimmedClampedAndCapped() {
        StubBackend backend = StubBackend.answering("""
                [{"name": "  Federal Budget 2024 ", "category": "economy", "relevance": 3},
                 {"name": "   ", "category": "politics"},
                 {"name": "Senate", "relevance": "0.5"},
                 {"name": "T3"}, {"name": "T4"}, {"name": "T5"}, {"name": "T6"}]""");

        List<TopicRef> topics = new TopicExtractor(gateway(backend)).extract(document()).block();

        assertEquals(5, topics.size());
        assertEquals(new TopicRef("Federal Budget 2024", "economy", 1.0), topics.get(0));
        assertEquals(new TopicRef("Senate", "other", 0.5), topics.get(1));
        assertEquals("T5", topics.get(4).getName());
        assertTrue(backend.prompts().get(0).contains("Article abstract: The Senate voted late Friday."));
    }

    @Test
    void topicPromptFallsBackToSnippet() {
        StubBackend backend = StubBackend.answering("[]");
        Document d = document();
        d.setAbstractText(null);
        new TopicExtractor(gateway(backend)).extract(d).block();
        assertTrue(backend.prompts().get(0).contains("Article abstract: snippet text"));
    }
}
