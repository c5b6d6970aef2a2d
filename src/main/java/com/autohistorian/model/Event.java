package com.autohistorian.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Something that happened, as reported by one document.
 *
 * <p>{@code validTime} is when it happened and may be null when unknown; {@code observationTime}
 * is when it was reported and defaults to the source document's publication time.
 */
public class Event {
    private String id;
    private String description;
    private String category; // arrest, policy_change, meeting, ...
    private OffsetDateTime validTime;
    private OffsetDateTime observationTime;
    private List<String> participants = new ArrayList<>();
    private String location;
    private String sourceDocumentId;
    private String sourceUrl;
    private double confidence = 1.0;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public OffsetDateTime getValidTime() { return validTime; }
    public void setValidTime(OffsetDateTime validTime) { this.validTime = validTime; }

    public OffsetDateTime getObservationTime() { return observationTime; }
    public void setObservationTime(OffsetDateTime observationTime) { this.observationTime = observationTime; }

    public List<String> getParticipants() { return participants; }
    public void setParticipants(List<String> participants) { this.participants = participants != null ? participants : new ArrayList<>(); }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }

    public String getSourceDocumentId() { return sourceDocumentId; }
    public void setSourceDocumentId(String sourceDocumentId) { this.sourceDocumentId = sourceDocumentId; }

    public String getSourceUrl() { return sourceUrl; }
    public void setSourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        Event that = (Event) o;
        return Double.compare(confidence, that.confidence) == 0
                && Objects.equals(id, that.id)
                && Objects.equals(description, that.description)
                && Objects.equals(category, that.category)
                && Objects.equals(validTime, that.validTime)
                && Objects.equals(observationTime, that.observationTime)
                && Objects.equals(participants, that.participants)
                && Objects.equals(location, that.location)
                && Objects.equals(sourceDocumentId, that.sourceDocumentId)
                && Objects.equals(sourceUrl, that.sourceUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, sourceDocumentId);
    }
}
