package com.autohistorian.controller;

import com.autohistorian.dto.TimelineDtos;
import com.autohistorian.model.StoreStats;
import com.autohistorian.model.TimelineItem;
import com.autohistorian.model.TopicSummary;
import com.autohistorian.service.store.KnowledgeStore;
import com.autohistorian.service.timeline.TimelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/** Read-only topic queries; nothing here mutates the store. */
@RestController
@Tag(name = "topics")
public class TopicController {
    private final KnowledgeStore store;
    private final TimelineService timelineService;

    public TopicController(KnowledgeStore store, TimelineService timelineService) {
        this.store = store;
        this.timelineService = timelineService;
    }

    @GetMapping("/topics")
    public Mono<List<String>> topics() {
        return blocking(store::listTopicNames);
    }

    @GetMapping("/topics/summary")
    @Operation(summary = "Topics with counts, ranked by coverage")
    public Mono<List<TopicSummary>> summary() {
        return blocking(store::topicsSummary);
    }

    @GetMapping("/topics/ranking")
    public Mono<List<TopicSummary>> ranking(@RequestParam(name = "limit", defaultValue = "10") int limit) {
        return blocking(() -> timelineService.coverageRanking(limit));
    }

    @GetMapping("/topics/{name}/timeline")
    @Operation(summary = "Timeline ordered by valid time (basis=valid) or observation time (basis=observed)")
    public Mono<List<TimelineItem>> timeline(@PathVariable("name") String name,
                                             @RequestParam(name = "basis", defaultValue = "valid") String basis) {
        boolean useValidTime;
        if ("valid".equalsIgnoreCase(basis)) {
            useValidTime = true;
        } else if ("observed".equalsIgnoreCase(basis)) {
            useValidTime = false;
        } else {
            return Mono.error(new ServerWebInputException("basis must be 'valid' or 'observed'"));
        }
        return blocking(() -> timelineService.timeline(name, useValidTime));
    }

    @GetMapping("/topics/{name}/timeline/dual")
    public Mono<TimelineDtos.DualTimeline> dualTimeline(@PathVariable("name") String name) {
        return blocking(() -> timelineService.dualTimeline(name));
    }

    @GetMapping("/topics/{name}/timeline/export")
    @Operation(summary = "Timeline in TimelineJS format")
    public Mono<TimelineDtos.TimelineJs> export(@PathVariable("name") String name) {
        return blocking(() -> timelineService.exportTimelineJs(name));
    }

    @GetMapping("/topics/{name}/perspectives")
    public Mono<TimelineDtos.Perspectives> perspectives(@PathVariable("name") String name) {
        return blocking(() -> timelineService.perspectives(name));
    }

    @GetMapping("/stats")
    public Mono<StoreStats> stats() {
        return blocking(store::aggregateStats);
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
