package com.autohistorian.service.extraction;

import com.autohistorian.model.Document;
import com.autohistorian.model.Stance;
import com.autohistorian.model.Statement;
import com.autohistorian.service.generation.GenerationGateway;
import com.autohistorian.service.generation.Prompts;
import com.autohistorian.util.TimeParsing;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class StatementExtractor extends AbstractFactExtractor<Statement> {

    public StatementExtractor(GenerationGateway gateway) {
        super(gateway);
    }

    @Override
    protected String kind() {
        return "statements";
    }

    @Override
    protected String buildPrompt(Document document) {
        return Prompts.statements(documentText(document));
    }

    @Override
    protected Statement map(JsonNode node, Document document) {
        Statement s = new Statement();
        s.setId(UUID.randomUUID().toString());
        s.setContent(text(node, "content", ""));
        s.setSpeaker(text(node, "speaker", "Unknown"));
        s.setSpeakerRole(text(node, "speaker_role"));
        s.setStance(Stance.fromText(text(node, "stance")));
        s.setTarget(text(node, "target"));
        s.setValidTime(TimeParsing.parseLenient(text(node, "valid_time")));
        s.setObservationTime(document.getObservedAt());
        s.setSourceDocumentId(document.getId());
        s.setSourceUrl(document.getWebUrl());
        return s;
    }
}
