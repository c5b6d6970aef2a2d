package com.autohistorian.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.OffsetDateTime;

/**
 * One row of a topic timeline. Events fill {@code description}/{@code location}; statements fill
 * {@code content}/{@code speaker}/{@code stance}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TimelineItem {
    public enum Kind {
        EVENT, STATEMENT;

        @JsonValue
        public String wire() {
            return name().toLowerCase();
        }
    }

    private OffsetDateTime time; // chosen timestamp, falling back to observation time
    private Kind kind;
    private String factId;
    private String sourceDocumentId;
    private String description;
    private String location;
    private String content;
    private String speaker;
    private Stance stance;

    public static TimelineItem of(Event e, boolean useValidTime) {
        TimelineItem item = new TimelineItem();
        item.time = resolve(e.getValidTime(), e.getObservationTime(), useValidTime);
        item.kind = Kind.EVENT;
        item.factId = e.getId();
        item.sourceDocumentId = e.getSourceDocumentId();
        item.description = e.getDescription() != null ? e.getDescription() : "";
        item.location = e.getLocation();
        return item;
    }

    public static TimelineItem of(Statement s, boolean useValidTime) {
        TimelineItem item = new TimelineItem();
        item.time = resolve(s.getValidTime(), s.getObservationTime(), useValidTime);
        item.kind = Kind.STATEMENT;
        item.factId = s.getId();
        item.sourceDocumentId = s.getSourceDocumentId();
        item.content = s.getContent() != null ? s.getContent() : "";
        item.speaker = s.getSpeaker() != null ? s.getSpeaker() : "Unknown";
        item.stance = s.getStance();
        return item;
    }

    private static OffsetDateTime resolve(OffsetDateTime valid, OffsetDateTime observed, boolean useValidTime) {
        OffsetDateTime chosen = useValidTime ? valid : observed;
        return chosen != null ? chosen : observed;
    }

    /** Event description or statement content, whichever this item carries. */
    public String text() {
        return kind == Kind.EVENT ? description : content;
    }

    public OffsetDateTime getTime() { return time; }
    public void setTime(OffsetDateTime time) { this.time = time; }

    public Kind getKind() { return kind; }
    public void setKind(Kind kind) { this.kind = kind; }

    public String getFactId() { return factId; }
    public void setFactId(String factId) { this.factId = factId; }

    public String getSourceDocumentId() { return sourceDocumentId; }
    public void setSourceDocumentId(String sourceDocumentId) { this.sourceDocumentId = sourceDocumentId; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getSpeaker() { return speaker; }
    public void setSpeaker(String speaker) { this.speaker = speaker; }

    public Stance getStance() { return stance; }
    public void setStance(Stance stance) { this.stance = stance; }
}
