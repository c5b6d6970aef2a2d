package com.autohistorian.service.timeline;

import com.autohistorian.config.WebClientConfig;
import com.autohistorian.dto.TimelineDtos;
import com.autohistorian.model.Event;
import com.autohistorian.model.ExtractionResult;
import com.autohistorian.model.Stance;
import com.autohistorian.model.Statement;
import com.autohistorian.model.TopicRef;
import com.autohistorian.model.TopicSummary;
import com.autohistorian.service.store.KnowledgeStore;
import com.autohistorian.service.store.TopicNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimelineServiceTest {

    @TempDir
    Path dataDir;

    private KnowledgeStore store;
    private TimelineService service;

    @BeforeEach
    void setUp() {
        store = new KnowledgeStore(dataDir, WebClientConfig.newObjectMapper());
        service = new TimelineService(store);
    }

    private static OffsetDateTime day(int y, int m, int d) {
        return OffsetDateTime.of(y, m, d, 12, 0, 0, 0, ZoneOffset.UTC);
    }

    private static Event event(String id, String description, OffsetDateTime valid, OffsetDateTime observed) {
        Event e = new Event();
        e.setId(id);
        e.setDescription(description);
        e.setValidTime(valid);
        e.setObservationTime(observed);
        e.setSourceDocumentId("d1");
        return e;
    }

    private static Statement statement(String id, Stance stance) {
        Statement s = new Statement();
        s.setId(id);
        s.setContent("quote " + id);
        s.setSpeaker("Mayor Frey");
        s.setStance(stance);
        s.setObservationTime(day(2024, 1, 10));
        s.setSourceDocumentId("d1");
        return s;
    }

    private void save(String topic, List<Event> events, List<Statement> statements) {
        store.saveExtractionResult(new ExtractionResult("d1", events, statements, List.of(),
                List.of(new TopicRef(topic, "law", 1.0))));
    }

    @Test
    void dualTimelineHoldsBothOrderings() {
        save("ICE in Minnesota", List.of(
                event("late-report", "raid", day(2024, 1, 1), day(2024, 2, 1)),
                event("early-report", "protest", day(2024, 1, 5), day(2024, 1, 6))), List.of());

        TimelineDtos.DualTimeline dual = service.dualTimeline("ICE in Minnesota");

        assertEquals("late-report", dual.getByValidTime().get(0).getFactId());
        assertEquals("early-report", dual.getByObservationTime().get(0).getFactId());
    }

    @Test
    void exportSkipsUndatedItemsAndPrefixesSpeakers() {
        save("ICE in Minnesota",
                List.of(event("e1", "Agents arrived in Minneapolis", day(2024, 1, 3), day(2024, 1, 4)),
                        event("e2", "Undated", null, null)),
                List.of(statement("s1", Stance.CON)));

        TimelineDtos.TimelineJs js = service.exportTimelineJs("ICE in Minnesota");

        assertEquals("ICE in Minnesota", js.getTitle().getText().getHeadline());
        assertNull(js.getTitle().getStartDate());
        assertEquals(2, js.getEvents().size());
        TimelineDtos.Slide first = js.getEvents().get(0);
        assertEquals("2024", first.getStartDate().getYear());
        assertEquals("01", first.getStartDate().getMonth());
        assertEquals("03", first.getStartDate().getDay());
        assertEquals("Agents arrived in Minneapolis", first.getText().getHeadline());
        assertEquals("Mayor Frey: quote s1", js.getEvents().get(1).getText().getHeadline());
    }

    @Test
    void exportHeadlinesAreCapped() {
        String longText = "x".repeat(300);
        save("Long", List.of(event("e1", longText, day(2024, 1, 3), null)), List.of());

        TimelineDtos.Slide slide = service.exportTimelineJs("Long").getEvents().get(0);
        assertEquals(100, slide.getText().getHeadline().length());
        assertEquals(longText, slide.getText().getText());
    }

    @Test
    void perspectivesGroupByStanceWithCounts() {
        List<Statement> statements = new ArrayList<>();
        for (int i = 0; i < 5; i++) statements.add(statement("pro" + i, Stance.PRO));
        statements.add(statement("con0", Stance.CON));
        statements.add(statement("none", null));
        save("Budget", List.of(), statements);

        TimelineDtos.Perspectives p = service.perspectives("Budget");

        assertEquals(3, p.getPro().size());
        assertEquals("pro0", p.getPro().get(0).getId());
        assertEquals(1, p.getCon().size());
        assertEquals(0, p.getNeutral().size());
        assertEquals(5, p.getCounts().get("pro"));
        assertEquals(1, p.getCounts().get("con"));
        assertEquals(0, p.getCounts().get("neutral"));
        assertEquals(1, p.getCounts().get("unset"));
    }

    @Test
    void rankingIsTopNOfSummary() {
        save("A", List.of(event("e1", "x", null, null), event("e2", "y", null, null)), List.of());
        save("B", List.of(), List.of());
        save("C", List.of(event("e3", "z", null, null)), List.of());

        assertEquals(List.of("A", "C"), service.coverageRanking(2).stream().map(TopicSummary::getName).collect(Collectors.toList()));
        assertEquals(3, service.coverageRanking(0).size());
    }

    @Test
    void unknownTopicIsNotFound() {
        assertThrows(TopicNotFoundException.class, () -> service.perspectives("missing"));
        assertThrows(TopicNotFoundException.class, () -> service.dualTimeline("missing"));
    }
}
