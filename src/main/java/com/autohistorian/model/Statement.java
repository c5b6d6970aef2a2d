package com.autohistorian.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/** A quote or paraphrase attributed to a speaker; carries the same dual timestamps as {@link Event}. */
public class Statement {
    private String id;
    private String content;
    private String speaker;
    private String speakerRole;
    private Stance stance; // null when unset
    private String target; // what the statement is about
    private OffsetDateTime validTime;
    private OffsetDateTime observationTime;
    private String sourceDocumentId;
    private String sourceUrl;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getSpeaker() { return speaker; }
    public void setSpeaker(String speaker) { this.speaker = speaker; }

    public String getSpeakerRole() { return speakerRole; }
    public void setSpeakerRole(String speakerRole) { this.speakerRole = speakerRole; }

    public Stance getStance() { return stance; }
    public void setStance(Stance stance) { this.stance = stance; }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    public OffsetDateTime getValidTime() { return validTime; }
    public void setValidTime(OffsetDateTime validTime) { this.validTime = validTime; }

    public OffsetDateTime getObservationTime() { return observationTime; }
    public void setObservationTime(OffsetDateTime observationTime) { this.observationTime = observationTime; }

    public String getSourceDocumentId() { return sourceDocumentId; }
    public void setSourceDocumentId(String sourceDocumentId) { this.sourceDocumentId = sourceDocumentId; }

    public String getSourceUrl() { return sourceUrl; }
    public void setSourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Statement)) return false;
        Statement that = (Statement) o;
        return Objects.equals(id, that.id)
                && Objects.equals(content, that.content)
                && Objects.equals(speaker, that.speaker)
                && Objects.equals(speakerRole, that.speakerRole)
                && stance == that.stance
                && Objects.equals(target, that.target)
                && Objects.equals(validTime, that.validTime)
                && Objects.equals(observationTime, that.observationTime)
                && Objects.equals(sourceDocumentId, that.sourceDocumentId)
                && Objects.equals(sourceUrl, that.sourceUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, content, speaker, sourceDocumentId);
    }
}
