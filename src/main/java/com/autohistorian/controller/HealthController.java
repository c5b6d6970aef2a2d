package com.autohistorian.controller;

import com.autohistorian.service.store.KnowledgeStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
public class HealthController {
    private final KnowledgeStore store;

    public HealthController(KnowledgeStore store) { this.store = store; }

    @GetMapping("/healthz")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(store::aggregateStats)
                .subscribeOn(Schedulers.boundedElastic())
                .map(stats -> ResponseEntity.ok(Map.<String, Object>of("ok", Boolean.TRUE, "topics", stats.getTopics())))
                .onErrorResume(e -> Mono.just(ResponseEntity.status(500).body(Map.<String, Object>of("ok", Boolean.FALSE))));
    }
}
