package com.autohistorian.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything extracted from one document in one pipeline run. This is the unit the extraction
 * pipeline returns and the knowledge store consumes.
 */
public class ExtractionResult {
    private String documentId;
    private List<Event> events = new ArrayList<>();
    private List<Statement> statements = new ArrayList<>();
    private List<Entity> entities = new ArrayList<>();
    private List<TopicRef> topics = new ArrayList<>();

    public ExtractionResult() {
    }

    public ExtractionResult(String documentId, List<Event> events, List<Statement> statements,
                            List<Entity> entities, List<TopicRef> topics) {
        this.documentId = documentId;
        setEvents(events);
        setStatements(statements);
        setEntities(entities);
        setTopics(topics);
    }

    public String getDocumentId() { return documentId; }
    public void setDocumentId(String documentId) { this.documentId = documentId; }

    public List<Event> getEvents() { return events; }
    public void setEvents(List<Event> events) { this.events = events != null ? new ArrayList<>(events) : new ArrayList<>(); }

    public List<Statement> getStatements() { return statements; }
    public void setStatements(List<Statement> statements) { this.statements = statements != null ? new ArrayList<>(statements) : new ArrayList<>(); }

    public List<Entity> getEntities() { return entities; }
    public void setEntities(List<Entity> entities) { this.entities = entities != null ? new ArrayList<>(entities) : new ArrayList<>(); }

    public List<TopicRef> getTopics() { return topics; }
    public void setTopics(List<TopicRef> topics) { this.topics = topics != null ? new ArrayList<>(topics) : new ArrayList<>(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractionResult)) return false;
        ExtractionResult that = (ExtractionResult) o;
        return Objects.equals(documentId, that.documentId)
                && Objects.equals(events, that.events)
                && Objects.equals(statements, that.statements)
                && Objects.equals(entities, that.entities)
                && Objects.equals(topics, that.topics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, events, statements, entities, topics);
    }
}
