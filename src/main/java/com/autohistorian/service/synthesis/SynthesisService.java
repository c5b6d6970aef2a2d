package com.autohistorian.service.synthesis;

import com.autohistorian.dto.ArticleDtos;
import com.autohistorian.dto.TimelineDtos;
import com.autohistorian.model.Statement;
import com.autohistorian.model.TimelineItem;
import com.autohistorian.model.TopicIndex;
import com.autohistorian.service.generation.GenerationGateway;
import com.autohistorian.service.generation.Prompts;
import com.autohistorian.service.store.KnowledgeStore;
import com.autohistorian.service.store.TopicNotFoundException;
import com.autohistorian.service.timeline.TimelineService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Writes encyclopedia-style articles from a topic's stored facts.
 *
 * <p>One generation call turns the topic's events and statements into the article body. A dual
 * timeline section (first {@value #TIMELINE_ENTRIES} entries of each ordering) and, on request, a
 * perspectives section are appended from the store without further calls.
 */
@Service
public class SynthesisService {
    private static final Logger log = LoggerFactory.getLogger(SynthesisService.class);

    static final int TIMELINE_ENTRIES = 10;

    private final GenerationGateway gateway;
    private final KnowledgeStore store;
    private final TimelineService timelineService;
    private final ObjectMapper objectMapper;
    private final ObjectWriter factWriter;

    public SynthesisService(GenerationGateway gateway, KnowledgeStore store, TimelineService timelineService,
                            ObjectMapper objectMapper) {
        this.gateway = gateway;
        this.store = store;
        this.timelineService = timelineService;
        this.objectMapper = objectMapper;
        this.factWriter = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public Mono<ArticleDtos.Article> generateArticle(String topic, boolean withPerspectives) {
        return Mono.fromCallable(() -> gather(topic, withPerspectives))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(sources -> {
                    TopicIndex index = sources.index;
                    log.info("Writing article for '{}' from {} events and {} statements",
                            index.getName(), index.getEvents().size(), index.getStatements().size());
                    return gateway.generate(promptFor(index, false), Prompts.WRITER_SYSTEM)
                            .map(body -> new ArticleDtos.Article(index.getName(), assemble(body, sources),
                                    index.getEvents().size(), index.getStatements().size()));
                });
    }

    /** Article outline as a JSON object; an answer that is not an object yields an empty one. */
    public Mono<JsonNode> generateOutline(String topic) {
        return Mono.fromCallable(() -> requireTopic(topic))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(index -> gateway.generateStructured(promptFor(index, true)))
                .map(parsed -> parsed.filter(JsonNode::isObject).orElseGet(() -> {
                    log.warn("Outline for '{}' was not a JSON object", topic);
                    return objectMapper.createObjectNode();
                }));
    }

    private static final class Sources {
        TopicIndex index;
        List<TimelineItem> byValidTime;
        List<TimelineItem> byObservationTime;
        TimelineDtos.Perspectives perspectives; // null unless requested
    }

    private Sources gather(String topic, boolean withPerspectives) {
        Sources sources = new Sources();
        sources.index = requireTopic(topic);
        sources.byValidTime = store.timeline(topic, true);
        sources.byObservationTime = store.timeline(topic, false);
        if (withPerspectives) sources.perspectives = timelineService.perspectives(topic);
        return sources;
    }

    private TopicIndex requireTopic(String topic) {
        return store.getTopicIndex(topic).orElseThrow(() -> new TopicNotFoundException(topic));
    }

    private String promptFor(TopicIndex index, boolean outline) {
        String events;
        String statements;
        try {
            events = factWriter.writeValueAsString(index.getEvents());
            statements = factWriter.writeValueAsString(index.getStatements());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize facts of topic " + index.getName(), e);
        }
        return outline
                ? Prompts.outline(index.getName(), events, statements)
                : Prompts.article(index.getName(), events, statements);
    }

    private static String assemble(String body, Sources sources) {
        StringBuilder md = new StringBuilder(body.trim());
        if (!sources.byValidTime.isEmpty() || !sources.byObservationTime.isEmpty()) {
            md.append("\n\n## Timeline\n\n");
            md.append("### When Events Occurred\n");
            md.append("*Chronological order of when events actually happened*\n\n");
            appendEntries(md, sources.byValidTime, "");
            md.append("\n### When We Learned\n");
            md.append("*Order in which information was reported*\n\n");
            appendEntries(md, sources.byObservationTime, " (reported)");
        }
        TimelineDtos.Perspectives p = sources.perspectives;
        if (p != null && !sources.index.getStatements().isEmpty()) {
            md.append("\n\n## Perspectives\n");
            appendViews(md, "Supporting Views", p.getPro());
            appendViews(md, "Opposing Views", p.getCon());
            appendViews(md, "Neutral Analysis", p.getNeutral());
        }
        return md.toString();
    }

    private static void appendEntries(StringBuilder md, List<TimelineItem> items, String suffix) {
        for (TimelineItem item : items.subList(0, Math.min(TIMELINE_ENTRIES, items.size()))) {
            String date = item.getTime() != null ? item.getTime().toLocalDate().toString() : "Unknown date";
            md.append("- **").append(date).append("**").append(suffix).append(": ")
                    .append(item.text() != null ? item.text() : "").append('\n');
        }
    }

    private static void appendViews(StringBuilder md, String heading, List<Statement> statements) {
        if (statements.isEmpty()) return;
        md.append("\n### ").append(heading).append('\n');
        for (Statement s : statements) {
            md.append("- **").append(s.getSpeaker()).append("**: \"").append(s.getContent()).append("\"\n");
        }
    }
}
