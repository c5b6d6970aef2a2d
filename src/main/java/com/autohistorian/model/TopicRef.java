package com.autohistorian.model;

import java.util.Objects;

/**
 * A topic asserted by one document. Topics are matched by exact name after trimming.
 */
public class TopicRef {
    private String name;
    private String category = "other"; // politics, law, international, economy, science, social, other
    private double relevance = 1.0; // 0.0 - 1.0

    public TopicRef() {
    }

    public TopicRef(String name, String category, double relevance) {
        this.name = name;
        this.category = category;
        this.relevance = relevance;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public double getRelevance() { return relevance; }
    public void setRelevance(double relevance) { this.relevance = relevance; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TopicRef)) return false;
        TopicRef that = (TopicRef) o;
        return Double.compare(relevance, that.relevance) == 0
                && Objects.equals(name, that.name)
                && Objects.equals(category, that.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, category, relevance);
    }
}
