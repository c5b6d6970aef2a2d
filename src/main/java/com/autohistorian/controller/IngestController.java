package com.autohistorian.controller;

import com.autohistorian.config.NytProperties;
import com.autohistorian.dto.IngestDtos;
import com.autohistorian.service.IngestService;
import com.autohistorian.service.source.ArchiveCrawler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.YearMonth;

@RestController
@RequestMapping("/ingest")
@Tag(name = "ingest")
public class IngestController {
    private final IngestService ingestService;
    private final ArchiveCrawler archiveCrawler;
    private final NytProperties nytProperties;

    public IngestController(IngestService ingestService, ArchiveCrawler archiveCrawler, NytProperties nytProperties) {
        this.ingestService = ingestService;
        this.archiveCrawler = archiveCrawler;
        this.nytProperties = nytProperties;
    }

    @PostMapping(value = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Ingest recent articles from Article Search and extract their facts")
    public Mono<IngestDtos.IngestReport> ingestSearch(@Valid @RequestBody IngestDtos.SearchIngestRequest body) {
        return ingestService.ingestSearch(body);
    }

    @PostMapping(value = "/archive", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Ingest one archive month (saved file first, Archive API otherwise)")
    public Mono<IngestDtos.IngestReport> ingestArchive(@Valid @RequestBody IngestDtos.ArchiveIngestRequest body) {
        return ingestService.ingestArchive(body);
    }

    @PostMapping(value = "/archive/crawl", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Download archive months backwards from a start month into the archive directory")
    public Mono<IngestDtos.CrawlReport> crawlArchive(@Valid @RequestBody IngestDtos.CrawlRequest body) {
        YearMonth start = YearMonth.of(body.getStartYear(), body.getStartMonth());
        YearMonth end = YearMonth.of(
                body.getEndYear() != null ? body.getEndYear() : ArchiveCrawler.FIRST_ARCHIVE_MONTH.getYear(),
                body.getEndMonth() != null ? body.getEndMonth() : ArchiveCrawler.FIRST_ARCHIVE_MONTH.getMonthValue());
        int limit = body.getDailyLimit() != null ? body.getDailyLimit() : nytProperties.getArchiveDailyLimit();
        return archiveCrawler.crawl(start, end, limit);
    }
}
