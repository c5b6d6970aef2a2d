package com.autohistorian.model;

/** Per-topic coverage counts used for the default "which topics matter" ranking. */
public class TopicSummary {
    private String name;
    private String category;
    private int documentCount;
    private int eventCount;
    private int statementCount;

    public TopicSummary() {
    }

    public TopicSummary(String name, String category, int documentCount, int eventCount, int statementCount) {
        this.name = name;
        this.category = category;
        this.documentCount = documentCount;
        this.eventCount = eventCount;
        this.statementCount = statementCount;
    }

    public int getCoverage() {
        return documentCount + eventCount + statementCount;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public int getDocumentCount() { return documentCount; }
    public void setDocumentCount(int documentCount) { this.documentCount = documentCount; }
    public int getEventCount() { return eventCount; }
    public void setEventCount(int eventCount) { this.eventCount = eventCount; }
    public int getStatementCount() { return statementCount; }
    public void setStatementCount(int statementCount) { this.statementCount = statementCount; }
}
