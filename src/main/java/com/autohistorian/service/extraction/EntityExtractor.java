package com.autohistorian.service.extraction;

import com.autohistorian.model.Document;
import com.autohistorian.model.Entity;
import com.autohistorian.service.generation.GenerationGateway;
import com.autohistorian.service.generation.Prompts;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class EntityExtractor extends AbstractFactExtractor<Entity> {

    public EntityExtractor(GenerationGateway gateway) {
        super(gateway);
    }

    @Override
    protected String kind() {
        return "entities";
    }

    @Override
    protected String buildPrompt(Document document) {
        return Prompts.entities(documentText(document));
    }

    @Override
    protected Entity map(JsonNode node, Document document) {
        Entity e = new Entity();
        e.setId(UUID.randomUUID().toString());
        e.setName(text(node, "name", ""));
        e.setCategory(text(node, "entity_type", "unknown"));
        e.setAliases(stringList(node, "aliases"));
        e.setDescription(text(node, "description"));
        return e;
    }
}
