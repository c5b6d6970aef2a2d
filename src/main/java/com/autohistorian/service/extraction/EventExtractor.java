package com.autohistorian.service.extraction;

import com.autohistorian.model.Document;
import com.autohistorian.model.Event;
import com.autohistorian.service.generation.GenerationGateway;
import com.autohistorian.service.generation.Prompts;
import com.autohistorian.util.TimeParsing;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class EventExtractor extends AbstractFactExtractor<Event> {

    public EventExtractor(GenerationGateway gateway) {
        super(gateway);
    }

    @Override
    protected String kind() {
        return "events";
    }

    @Override
    protected String buildPrompt(Document document) {
        return Prompts.events(documentText(document));
    }

    @Override
    protected Event map(JsonNode node, Document document) {
        Event e = new Event();
        e.setId(UUID.randomUUID().toString());
        e.setDescription(text(node, "description", ""));
        e.setCategory(text(node, "event_type", "unknown"));
        e.setValidTime(TimeParsing.parseLenient(text(node, "valid_time")));
        e.setObservationTime(document.getObservedAt());
        e.setParticipants(stringList(node, "participants"));
        e.setLocation(text(node, "location"));
        e.setSourceDocumentId(document.getId());
        e.setSourceUrl(document.getWebUrl());
        e.setConfidence(unitInterval(node, "confidence", 1.0));
        return e;
    }
}
