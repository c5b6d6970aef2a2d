package com.autohistorian.service;

import com.autohistorian.config.AppProperties;
import com.autohistorian.dto.IngestDtos;
import com.autohistorian.model.Document;
import com.autohistorian.model.ExtractionResult;
import com.autohistorian.model.TopicRef;
import com.autohistorian.service.extraction.ExtractionOutcome;
import com.autohistorian.service.extraction.ExtractionPipeline;
import com.autohistorian.service.source.ArchiveLoader;
import com.autohistorian.service.source.DocumentFilter;
import com.autohistorian.service.source.DocumentSourceException;
import com.autohistorian.service.source.NytService;
import com.autohistorian.service.store.KnowledgeStore;
import com.autohistorian.util.TokenAccounting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Ingest workflow: fetch documents, save them, extract facts, merge results into the store.
 *
 * <p>By default one failing document aborts the run before any extraction result is committed.
 * With {@code continueOnError} every successful document is committed and failures are reported.
 */
@Service
public class IngestService {
    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    private final NytService nytService;
    private final ArchiveLoader archiveLoader;
    private final ExtractionPipeline pipeline;
    private final KnowledgeStore store;
    private final AppProperties appProperties;

    public IngestService(NytService nytService, ArchiveLoader archiveLoader, ExtractionPipeline pipeline,
                         KnowledgeStore store, AppProperties appProperties) {
        this.nytService = nytService;
        this.archiveLoader = archiveLoader;
        this.pipeline = pipeline;
        this.store = store;
        this.appProperties = appProperties;
    }

    public Mono<IngestDtos.IngestReport> ingestSearch(IngestDtos.SearchIngestRequest request) {
        int days = request.getDays() != null ? request.getDays() : appProperties.getRecentDays();
        int maxArticles = request.getMaxArticles() != null ? request.getMaxArticles() : appProperties.getMaxArticles();
        log.info("Search ingest: query='{}' days={} maxArticles={} sections={}",
                request.getQuery(), days, maxArticles, request.getSections());
        return nytService.searchRecent(request.getQuery(), days, maxArticles, request.getSections())
                .flatMap(docs -> ingestDocuments(docs, request.getTopic(), request.isContinueOnError()));
    }

    public Mono<IngestDtos.IngestReport> ingestArchive(IngestDtos.ArchiveIngestRequest request) {
        int year = request.getYear();
        int month = request.getMonth();
        int maxArticles = request.getMaxArticles() != null ? request.getMaxArticles() : appProperties.getMaxArticles();
        DocumentFilter filter = new DocumentFilter(request.getSections(), request.getQuery(), maxArticles);

        Mono<List<Document>> source;
        if (archiveLoader.hasMonth(year, month)) {
            source = Mono.fromCallable(() -> archiveLoader.load(year, month)).subscribeOn(Schedulers.boundedElastic());
        } else if (request.isLocalOnly()) {
            source = Mono.error(new DocumentSourceException("No saved archive at " + archiveLoader.archiveFile(year, month)));
        } else {
            source = nytService.fetchByMonth(year, month);
        }
        return source
                .map(all -> {
                    List<Document> kept = filter.apply(all);
                    log.info("Archive {}-{}: {} documents, {} after filters", year, month, all.size(), kept.size());
                    return kept;
                })
                .flatMap(docs -> ingestDocuments(docs, request.getTopic(), request.isContinueOnError()));
    }

    public Mono<IngestDtos.IngestReport> ingestDocuments(List<Document> documents, String topicOverride, boolean continueOnError) {
        TokenAccounting.reset();
        Mono<Void> saveDocuments = Mono.fromRunnable(() -> documents.forEach(store::saveDocument))
                .subscribeOn(Schedulers.boundedElastic())
                .then();

        if (!continueOnError) {
            return saveDocuments
                    .then(Mono.defer(() -> pipeline.extractBatch(documents, topicOverride)))
                    .flatMap(results -> commit(results, topicOverride))
                    .map(results -> buildReport(documents.size(), results, List.of()));
        }
        return saveDocuments
                .then(Mono.defer(() -> pipeline.extractBatchSettled(documents, topicOverride, pipeline.getDefaultMaxConcurrent())))
                .flatMap(outcomes -> {
                    List<ExtractionResult> ok = new ArrayList<>();
                    List<IngestDtos.DocumentFailure> failures = new ArrayList<>();
                    for (int i = 0; i < outcomes.size(); i++) {
                        ExtractionOutcome outcome = outcomes.get(i);
                        if (outcome.isSuccess()) {
                            ok.add(outcome.getResult());
                        } else {
                            failures.add(new IngestDtos.DocumentFailure(outcome.getDocumentId(),
                                    documents.get(i).getHeadline(), outcome.getError().toString()));
                        }
                    }
                    return commit(ok, topicOverride).map(results -> buildReport(documents.size(), results, failures));
                });
    }

    private Mono<List<ExtractionResult>> commit(List<ExtractionResult> results, String topicOverride) {
        return Mono.fromCallable(() -> {
            for (ExtractionResult r : results) {
                store.saveExtractionResult(r, topicOverride);
            }
            return results;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private IngestDtos.IngestReport buildReport(int fetched, List<ExtractionResult> results,
                                                List<IngestDtos.DocumentFailure> failures) {
        TreeSet<String> topics = new TreeSet<>();
        for (ExtractionResult r : results) {
            for (TopicRef t : r.getTopics()) {
                if (t.getName() != null && !t.getName().isBlank()) topics.add(t.getName().trim());
            }
        }
        IngestDtos.IngestReport report = new IngestDtos.IngestReport();
        report.setDocumentsFetched(fetched);
        report.setDocumentsProcessed(results.size());
        report.setDiscoveredTopics(new ArrayList<>(topics));
        report.setFailures(new ArrayList<>(failures));
        report.setStats(store.aggregateStats());
        attachAiUsage(report);
        log.info("Ingest finished: fetched={} processed={} failed={} topics={}",
                fetched, results.size(), failures.size(), topics.size());
        return report;
    }

    private void attachAiUsage(IngestDtos.IngestReport report) {
        Map<String, TokenAccounting.UsageWithCost> snap = TokenAccounting.snapshotWithCosts();
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        for (var e : snap.entrySet()) {
            var u = e.getValue();
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("requests", u.requests);
            m.put("prompt_tokens", u.promptTokens);
            m.put("completion_tokens", u.completionTokens);
            m.put("total_tokens", u.totalTokens);
            m.put("cost_usd", u.costUsd);
            out.put(e.getKey(), m);
        }
        report.setAiUsage(out);
        report.setAiCostTotalUsd(TokenAccounting.totalCostUsd(snap));
    }
}
