package com.autohistorian.service.extraction;

import com.autohistorian.config.AppProperties;
import com.autohistorian.model.Document;
import com.autohistorian.model.Entity;
import com.autohistorian.model.Event;
import com.autohistorian.model.ExtractionResult;
import com.autohistorian.model.Statement;
import com.autohistorian.model.TopicRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fan-out/fan-in extraction of documents.
 *
 * <p>Per document: entities and topics run together, then events and statements run together;
 * the four lists are joined into one {@link ExtractionResult}. Any extractor failure fails the
 * document.
 *
 * <p>Per batch: at most {@code maxConcurrent} documents are in flight and results come back in
 * input order. In the default mode the first failing document fails the batch with a
 * {@link DocumentExtractionException} and cancels the siblings still running (their pending
 * rate-limiter waits and backoffs included). {@link #extractBatchSettled} reports every document
 * instead.
 */
@Service
public class ExtractionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    static final String OVERRIDE_TOPIC_CATEGORY = "other";

    private final FactExtractor<Event> eventExtractor;
    private final FactExtractor<Statement> statementExtractor;
    private final FactExtractor<Entity> entityExtractor;
    private final FactExtractor<TopicRef> topicExtractor;
    private final int defaultMaxConcurrent;

    public ExtractionPipeline(FactExtractor<Event> eventExtractor,
                              FactExtractor<Statement> statementExtractor,
                              FactExtractor<Entity> entityExtractor,
                              FactExtractor<TopicRef> topicExtractor,
                              AppProperties appProperties) {
        this.eventExtractor = eventExtractor;
        this.statementExtractor = statementExtractor;
        this.entityExtractor = entityExtractor;
        this.topicExtractor = topicExtractor;
        this.defaultMaxConcurrent = Math.max(1, appProperties.getMaxConcurrentExtractions());
    }

    public Mono<ExtractionResult> extractOne(Document document, String topicOverride) {
        return Mono.defer(() -> {
            Mono<List<TopicRef>> topics = hasText(topicOverride)
                    ? Mono.just(List.of(new TopicRef(topicOverride.trim(), OVERRIDE_TOPIC_CATEGORY, 1.0)))
                    : topicExtractor.extract(document);

            return Mono.zip(entityExtractor.extract(document), topics)
                    .flatMap(first -> Mono.zip(eventExtractor.extract(document), statementExtractor.extract(document))
                            .map(second -> new ExtractionResult(document.getId(),
                                    second.getT1(), second.getT2(), first.getT1(), first.getT2())));
        });
    }

    public Mono<List<ExtractionResult>> extractBatch(List<Document> documents, String topicOverride) {
        return extractBatch(documents, topicOverride, defaultMaxConcurrent);
    }

    public Mono<List<ExtractionResult>> extractBatch(List<Document> documents, String topicOverride, int maxConcurrent) {
        int concurrency = Math.max(1, maxConcurrent);
        AtomicInteger completed = new AtomicInteger();
        int total = documents.size();
        log.info("Extracting {} documents (maxConcurrent={})", total, concurrency);
        return Flux.fromIterable(documents)
                .flatMapSequential(doc -> extractOne(doc, topicOverride)
                        .onErrorMap(e -> !(e instanceof DocumentExtractionException),
                                e -> new DocumentExtractionException(doc.getId(), e))
                        .doOnNext(r -> logProgress(completed.incrementAndGet(), total, r)), concurrency)
                .collectList()
                .doOnError(e -> log.error("Extraction batch aborted: {}", e.getMessage()));
    }

    /** Like {@link #extractBatch} but never fails: one outcome per document, in input order. */
    public Mono<List<ExtractionOutcome>> extractBatchSettled(List<Document> documents, String topicOverride, int maxConcurrent) {
        int concurrency = Math.max(1, maxConcurrent);
        AtomicInteger completed = new AtomicInteger();
        int total = documents.size();
        return Flux.fromIterable(documents)
                .flatMapSequential(doc -> extractOne(doc, topicOverride)
                        .doOnNext(r -> logProgress(completed.incrementAndGet(), total, r))
                        .map(r -> ExtractionOutcome.success(doc.getId(), r))
                        .onErrorResume(e -> {
                            log.warn("Extraction failed for document {}: {}", doc.getId(), e.toString());
                            return Mono.just(ExtractionOutcome.failure(doc.getId(), e));
                        }), concurrency)
                .collectList();
    }

    public int getDefaultMaxConcurrent() {
        return defaultMaxConcurrent;
    }

    private static void logProgress(int done, int total, ExtractionResult r) {
        log.info("Extraction progress: {}/{}; document={} events={} statements={} topics={}",
                done, total, r.getDocumentId(), r.getEvents().size(), r.getStatements().size(), r.getTopics().size());
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
