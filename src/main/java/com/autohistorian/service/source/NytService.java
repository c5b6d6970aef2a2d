package com.autohistorian.service.source;

import com.autohistorian.config.NytProperties;
import com.autohistorian.model.Document;
import com.autohistorian.util.RequestRateLimiter;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin client for the NYT Article Search and Archive APIs.
 *
 * <p>All requests share one {@link RequestRateLimiter} ({@code nyt.requests-per-minute}, 5 by
 * default as the API allows).
 */
@Service
public class NytService {
    private static final Logger log = LoggerFactory.getLogger(NytService.class);

    static final int PAGE_SIZE = 10;
    static final String BROAD_QUERY = "news";
    private static final DateTimeFormatter NYT_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final WebClient nytClient;
    private final NytProperties properties;
    private final NytDocumentMapper mapper;
    private final RequestRateLimiter rateLimiter;

    public NytService(@Qualifier("nytClient") WebClient nytClient, NytProperties properties, NytDocumentMapper mapper) {
        this.nytClient = nytClient;
        this.properties = properties;
        this.mapper = mapper;
        this.rateLimiter = new RequestRateLimiter("nyt", properties.getRequestsPerMinute());
    }

    /** One page (up to 10 documents) of Article Search. */
    public Mono<SearchPage> search(SearchQuery query, int page) {
        return requireKey().then(Mono.defer(() -> rateLimiter.acquire().then(nytClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/svc/search/v2/articlesearch.json")
                            .queryParam("api-key", properties.getApiKey())
                            .queryParam("page", page)
                            .queryParam("sort", query.getSort());
                    if (query.getQuery() != null && !query.getQuery().isBlank()) uriBuilder.queryParam("q", "{q}");
                    if (query.getBeginDate() != null) uriBuilder.queryParam("begin_date", NYT_DATE.format(query.getBeginDate()));
                    if (query.getEndDate() != null) uriBuilder.queryParam("end_date", NYT_DATE.format(query.getEndDate()));
                    String fq = query.buildFilter();
                    if (fq != null) uriBuilder.queryParam("fq", "{fq}");
                    return uriBuilder.build(uriVariables(query.getQuery(), fq));
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(status -> status.isError(), resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                        .flatMap(body -> Mono.error(new DocumentSourceException(
                                "NYT search failed (HTTP " + resp.statusCode().value() + ")"))))
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(30))
                .map(json -> {
                    JsonNode response = json.path("response");
                    List<Document> docs = mapper.mapAll(response.path("docs"));
                    long hits = response.path("meta").path("hits").asLong(docs.size());
                    log.info("NYT search page {} → {} documents ({} hits)", page, docs.size(), hits);
                    return new SearchPage(docs, hits);
                }))));
    }

    /** Pages until a short page, the total hit count or {@code maxPages}, whichever comes first. */
    public Mono<List<Document>> searchAll(SearchQuery query, int maxPages) {
        return collectPages(query, 0, Math.max(1, maxPages), new ArrayList<>());
    }

    private Mono<List<Document>> collectPages(SearchQuery query, int page, int maxPages, List<Document> acc) {
        return search(query, page).flatMap(result -> {
            acc.addAll(result.getDocuments());
            boolean done = result.getDocuments().size() < PAGE_SIZE
                    || acc.size() >= result.getTotalHits()
                    || page + 1 >= maxPages;
            return done ? Mono.just(acc) : collectPages(query, page + 1, maxPages, acc);
        });
    }

    /**
     * Documents of the last {@code days} days, optionally narrowed by query and sections; without a
     * query the broad query {@value #BROAD_QUERY} is used.
     */
    public Mono<List<Document>> searchRecent(String query, int days, int maxArticles, List<String> sections) {
        LocalDate end = LocalDate.now(ZoneOffset.UTC);
        SearchQuery q = new SearchQuery()
                .setQuery(query != null && !query.isBlank() ? query : BROAD_QUERY)
                .setBeginDate(end.minusDays(Math.max(0, days)))
                .setEndDate(end)
                .setSections(sections);
        int maxPages = Math.min(properties.getMaxPages(), (Math.max(1, maxArticles) + PAGE_SIZE - 1) / PAGE_SIZE);
        return searchAll(q, maxPages)
                .map(docs -> docs.size() > maxArticles ? new ArrayList<>(docs.subList(0, maxArticles)) : docs);
    }

    /** Every document of one month from the Archive API. */
    public Mono<List<Document>> fetchByMonth(int year, int month) {
        return fetchArchive(year, month).map(json -> {
            List<Document> docs = mapper.mapAll(json.path("response").path("docs"));
            log.info("NYT archive {}-{} → {} documents", year, month, docs.size());
            return docs;
        });
    }

    /** The raw Archive API response for one month ({@code response.docs} holds the articles). */
    public Mono<JsonNode> fetchArchive(int year, int month) {
        if (month < 1 || month > 12) {
            return Mono.error(new IllegalArgumentException("Month must be 1-12, got " + month));
        }
        if (year < 1851) {
            return Mono.error(new IllegalArgumentException("Year must be 1851 or later, got " + year));
        }
        return requireKey().then(Mono.defer(() -> rateLimiter.acquire().then(nytClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/svc/archive/v1/{year}/{month}.json")
                        .queryParam("api-key", properties.getApiKey())
                        .build(year, month))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(status -> status.isError(), resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                        .flatMap(body -> Mono.error(new DocumentSourceException(
                                "NYT archive " + year + "-" + month + " failed (HTTP " + resp.statusCode().value() + ")"))))
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(60)))));
    }

    private Mono<Void> requireKey() {
        String key = properties.getApiKey();
        if (key == null || key.isBlank()) {
            return Mono.error(new DocumentSourceException("nyt.api-key is not configured"));
        }
        return Mono.empty();
    }

    private static Object[] uriVariables(String q, String fq) {
        List<Object> vars = new ArrayList<>();
        if (q != null && !q.isBlank()) vars.add(q);
        if (fq != null) vars.add(fq);
        return vars.toArray();
    }
}
