package com.autohistorian.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persisted aggregate for one topic: contributing documents plus every event and statement merged
 * into it. Created on first reference to the topic and only ever grown afterwards.
 *
 * <p>{@code documentIds} has set semantics (insertion ordered); facts are unique by id.
 */
public class TopicIndex {
    private String name;
    private String category = "other";
    private List<String> documentIds = new ArrayList<>();
    private List<Event> events = new ArrayList<>();
    private List<Statement> statements = new ArrayList<>();

    public TopicIndex() {
    }

    public TopicIndex(String name, String category) {
        this.name = name;
        this.category = category;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public List<String> getDocumentIds() { return documentIds; }
    public void setDocumentIds(List<String> documentIds) { this.documentIds = documentIds != null ? new ArrayList<>(documentIds) : new ArrayList<>(); }

    public List<Event> getEvents() { return events; }
    public void setEvents(List<Event> events) { this.events = events != null ? new ArrayList<>(events) : new ArrayList<>(); }

    public List<Statement> getStatements() { return statements; }
    public void setStatements(List<Statement> statements) { this.statements = statements != null ? new ArrayList<>(statements) : new ArrayList<>(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TopicIndex)) return false;
        TopicIndex that = (TopicIndex) o;
        return Objects.equals(name, that.name)
                && Objects.equals(category, that.category)
                && Objects.equals(documentIds, that.documentIds)
                && Objects.equals(events, that.events)
                && Objects.equals(statements, that.statements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, category, documentIds);
    }
}
