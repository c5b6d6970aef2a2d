package com.autohistorian.service.extraction;

import com.autohistorian.model.Document;
import com.autohistorian.model.TopicRef;
import com.autohistorian.service.generation.GenerationGateway;
import com.autohistorian.service.generation.Prompts;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Topics are index keys, not facts: only name, category and relevance are kept. The prompt sees the
 * headline and abstract (or snippet) rather than the full document text.
 */
@Component
public class TopicExtractor extends AbstractFactExtractor<TopicRef> {
    static final int MAX_TOPICS = 5;

    public TopicExtractor(GenerationGateway gateway) {
        super(gateway);
    }

    @Override
    protected String kind() {
        return "topics";
    }

    @Override
    protected String buildPrompt(Document document) {
        String summary = notBlank(document.getAbstractText()) ? document.getAbstractText() : document.getSnippet();
        return Prompts.topics(document.getHeadline(), summary, MAX_TOPICS);
    }

    @Override
    protected TopicRef map(JsonNode node, Document document) {
        String name = text(node, "name");
        if (name == null) return null;
        return new TopicRef(name, text(node, "category", "other"), unitInterval(node, "relevance", 1.0));
    }

    @Override
    public Mono<List<TopicRef>> extract(Document document) {
        return super.extract(document)
                .map(topics -> topics.size() > MAX_TOPICS ? new ArrayList<>(topics.subList(0, MAX_TOPICS)) : topics);
    }
}
