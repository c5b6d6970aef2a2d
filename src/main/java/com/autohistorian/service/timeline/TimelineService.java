package com.autohistorian.service.timeline;

import com.autohistorian.dto.TimelineDtos;
import com.autohistorian.model.Stance;
import com.autohistorian.model.Statement;
import com.autohistorian.model.TimelineItem;
import com.autohistorian.model.TopicIndex;
import com.autohistorian.model.TopicSummary;
import com.autohistorian.service.store.KnowledgeStore;
import com.autohistorian.service.store.TopicNotFoundException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only views over the knowledge store: dual timelines, coverage ranking, TimelineJS export
 * and stance perspectives.
 */
@Service
public class TimelineService {
    static final int PERSPECTIVE_EXAMPLES = 3;
    static final int HEADLINE_MAX = 100;

    private final KnowledgeStore store;

    public TimelineService(KnowledgeStore store) {
        this.store = store;
    }

    public List<TimelineItem> timeline(String topic, boolean useValidTime) {
        return store.timeline(topic, useValidTime);
    }

    public TimelineDtos.DualTimeline dualTimeline(String topic) {
        return new TimelineDtos.DualTimeline(topic, store.timeline(topic, true), store.timeline(topic, false));
    }

    public List<TopicSummary> coverageRanking(int limit) {
        List<TopicSummary> all = store.topicsSummary();
        if (limit <= 0 || limit >= all.size()) return all;
        return new ArrayList<>(all.subList(0, limit));
    }

    /** Valid-time timeline in TimelineJS form; items without any time are left out. */
    public TimelineDtos.TimelineJs exportTimelineJs(String topic) {
        TimelineDtos.TimelineJs out = new TimelineDtos.TimelineJs();
        TimelineDtos.Slide title = new TimelineDtos.Slide();
        title.setText(new TimelineDtos.SlideText(topic, "Timeline of events related to " + topic));
        out.setTitle(title);

        for (TimelineItem item : store.timeline(topic, true)) {
            if (item.getTime() == null) continue;
            String text = item.text() != null ? item.text() : "";
            String headline = text.length() > HEADLINE_MAX ? text.substring(0, HEADLINE_MAX) : text;
            if (item.getKind() == TimelineItem.Kind.STATEMENT) {
                headline = item.getSpeaker() + ": " + headline;
            }
            TimelineDtos.Slide slide = new TimelineDtos.Slide();
            slide.setStartDate(new TimelineDtos.SlideDate(
                    String.format("%04d", item.getTime().getYear()),
                    String.format("%02d", item.getTime().getMonthValue()),
                    String.format("%02d", item.getTime().getDayOfMonth())));
            slide.setText(new TimelineDtos.SlideText(headline, text));
            out.getEvents().add(slide);
        }
        return out;
    }

    public TimelineDtos.Perspectives perspectives(String topic) {
        TopicIndex index = store.getTopicIndex(topic).orElseThrow(() -> new TopicNotFoundException(topic));
        Map<Stance, List<Statement>> byStance = index.getStatements().stream()
                .filter(s -> s.getStance() != null)
                .collect(Collectors.groupingBy(Statement::getStance));

        TimelineDtos.Perspectives out = new TimelineDtos.Perspectives();
        out.setTopic(index.getName());
        out.setPro(firstFew(byStance.get(Stance.PRO)));
        out.setCon(firstFew(byStance.get(Stance.CON)));
        out.setNeutral(firstFew(byStance.get(Stance.NEUTRAL)));
        for (Stance stance : Stance.values()) {
            List<Statement> group = byStance.get(stance);
            out.getCounts().put(stance.wire(), group != null ? group.size() : 0);
        }
        out.getCounts().put("unset", (int) index.getStatements().stream().filter(s -> s.getStance() == null).count());
        return out;
    }

    private static List<Statement> firstFew(List<Statement> group) {
        if (group == null) return new ArrayList<>();
        return new ArrayList<>(group.subList(0, Math.min(PERSPECTIVE_EXAMPLES, group.size())));
    }
}
