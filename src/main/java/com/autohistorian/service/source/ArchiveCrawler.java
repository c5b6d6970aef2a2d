package com.autohistorian.service.source;

import com.autohistorian.dto.IngestDtos;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.YearMonth;

/**
 * Downloads Archive API months into the archive directory, walking backwards from a start month.
 *
 * <p>Months already on disk are skipped without a request. The crawl stops at the request limit or
 * at the first failed month; either way the report names the month to resume from.
 */
@Service
public class ArchiveCrawler {
    private static final Logger log = LoggerFactory.getLogger(ArchiveCrawler.class);

    public static final YearMonth FIRST_ARCHIVE_MONTH = YearMonth.of(1851, 9);

    private final NytService nytService;
    private final ArchiveLoader archiveLoader;

    public ArchiveCrawler(NytService nytService, ArchiveLoader archiveLoader) {
        this.nytService = nytService;
        this.archiveLoader = archiveLoader;
    }

    public Mono<IngestDtos.CrawlReport> crawl(YearMonth start, YearMonth end, int requestLimit) {
        if (start.isBefore(end)) {
            return Mono.error(new IllegalArgumentException("Start " + start + " is before end " + end));
        }
        if (end.getYear() < FIRST_ARCHIVE_MONTH.getYear()) {
            return Mono.error(new IllegalArgumentException("The archive starts at " + FIRST_ARCHIVE_MONTH));
        }
        if (requestLimit < 1) {
            return Mono.error(new IllegalArgumentException("Request limit must be positive, got " + requestLimit));
        }
        IngestDtos.CrawlReport report = new IngestDtos.CrawlReport();
        log.info("Archive crawl from {} back to {} (at most {} requests)", start, end, requestLimit);
        return Mono.defer(() -> crawlFrom(start, end, requestLimit, report))
                .thenReturn(report)
                .doOnNext(r -> log.info("Archive crawl finished: fetched={} skipped={} complete={} resumeFrom={}",
                        r.getFetched().size(), r.getSkipped().size(), r.isComplete(), r.getResumeFrom()));
    }

    private Mono<Void> crawlFrom(YearMonth from, YearMonth end, int requestLimit, IngestDtos.CrawlReport report) {
        YearMonth current = from;
        while (!current.isBefore(end) && archiveLoader.hasMonth(current.getYear(), current.getMonthValue())) {
            log.debug("Archive {} already saved", current);
            report.getSkipped().add(current.toString());
            current = current.minusMonths(1);
        }
        if (current.isBefore(end)) {
            report.setComplete(true);
            return Mono.empty();
        }
        if (report.getRequests() >= requestLimit) {
            log.info("Archive request limit {} reached; resume from {}", requestLimit, current);
            report.setStopReason("daily_limit");
            report.setResumeFrom(current.toString());
            return Mono.empty();
        }

        YearMonth month = current;
        return nytService.fetchArchive(month.getYear(), month.getMonthValue())
                .switchIfEmpty(Mono.error(() -> new DocumentSourceException("Empty archive response for " + month)))
                .flatMap(json -> Mono.fromCallable(() -> {
                    archiveLoader.save(month.getYear(), month.getMonthValue(), json);
                    return json.path("response").path("docs").size();
                }).subscribeOn(Schedulers.boundedElastic()))
                .map(articles -> {
                    report.setRequests(report.getRequests() + 1);
                    report.getFetched().add(new IngestDtos.CrawledMonth(month.toString(), articles));
                    log.info("Archive {} saved: {} articles ({}/{} requests)", month, articles, report.getRequests(), requestLimit);
                    return true;
                })
                .onErrorResume(e -> {
                    log.warn("Archive {} failed, stopping crawl: {}", month, e.toString());
                    report.setStopReason("error");
                    report.setResumeFrom(month.toString());
                    report.setError(e.getMessage() != null ? e.getMessage() : e.toString());
                    return Mono.just(false);
                })
                .flatMap(saved -> saved ? crawlFrom(month.minusMonths(1), end, requestLimit, report) : Mono.<Void>empty());
    }
}
