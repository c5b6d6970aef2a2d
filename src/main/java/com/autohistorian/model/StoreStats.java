package com.autohistorian.model;

public class StoreStats {
    private int documents;
    private int extractions;
    private int topics;
    private int events; // summed per topic membership
    private int statements;

    public StoreStats() {
    }

    public StoreStats(int documents, int extractions, int topics, int events, int statements) {
        this.documents = documents;
        this.extractions = extractions;
        this.topics = topics;
        this.events = events;
        this.statements = statements;
    }

    public int getDocuments() { return documents; }
    public void setDocuments(int documents) { this.documents = documents; }
    public int getExtractions() { return extractions; }
    public void setExtractions(int extractions) { this.extractions = extractions; }
    public int getTopics() { return topics; }
    public void setTopics(int topics) { this.topics = topics; }
    public int getEvents() { return events; }
    public void setEvents(int events) { this.events = events; }
    public int getStatements() { return statements; }
    public void setStatements(int statements) { this.statements = statements; }
}
