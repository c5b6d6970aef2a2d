package com.autohistorian.dto;

import com.autohistorian.model.StoreStats;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class IngestDtos {

    /** Ingest recent documents from Article Search. */
    public static class SearchIngestRequest {
        private String query; // null: broad recent news
        @Min(0)
        private Integer days; // defaults to app.recent-days
        @Positive
        private Integer maxArticles; // defaults to app.max-articles
        private List<String> sections;
        private String topic; // fixed topic instead of auto-discovered ones
        private boolean continueOnError;

        public String getQuery() { return query; }
        public void setQuery(String query) { this.query = query; }
        public Integer getDays() { return days; }
        public void setDays(Integer days) { this.days = days; }
        public Integer getMaxArticles() { return maxArticles; }
        public void setMaxArticles(Integer maxArticles) { this.maxArticles = maxArticles; }
        public List<String> getSections() { return sections; }
        public void setSections(List<String> sections) { this.sections = sections; }
        public String getTopic() { return topic; }
        public void setTopic(String topic) { this.topic = topic; }
        public boolean isContinueOnError() { return continueOnError; }
        public void setContinueOnError(boolean continueOnError) { this.continueOnError = continueOnError; }
    }

    /** Ingest one archive month, from a saved file when present, otherwise from the Archive API. */
    public static class ArchiveIngestRequest {
        @NotNull
        @Min(1851)
        private Integer year;
        @NotNull
        @Min(1)
        @Max(12)
        private Integer month;
        private String query;
        private List<String> sections;
        @Positive
        private Integer maxArticles;
        private String topic;
        private boolean continueOnError;
        private boolean localOnly; // fail instead of calling the API when no file is saved

        public Integer getYear() { return year; }
        public void setYear(Integer year) { this.year = year; }
        public Integer getMonth() { return month; }
        public void setMonth(Integer month) { this.month = month; }
        public String getQuery() { return query; }
        public void setQuery(String query) { this.query = query; }
        public List<String> getSections() { return sections; }
        public void setSections(List<String> sections) { this.sections = sections; }
        public Integer getMaxArticles() { return maxArticles; }
        public void setMaxArticles(Integer maxArticles) { this.maxArticles = maxArticles; }
        public String getTopic() { return topic; }
        public void setTopic(String topic) { this.topic = topic; }
        public boolean isContinueOnError() { return continueOnError; }
        public void setContinueOnError(boolean continueOnError) { this.continueOnError = continueOnError; }
        public boolean isLocalOnly() { return localOnly; }
        public void setLocalOnly(boolean localOnly) { this.localOnly = localOnly; }
    }

    public static class DocumentFailure {
        private String documentId;
        private String headline;
        private String error;

        public DocumentFailure() {}

        public DocumentFailure(String documentId, String headline, String error) {
            this.documentId = documentId;
            this.headline = headline;
            this.error = error;
        }

        public String getDocumentId() { return documentId; }
        public void setDocumentId(String documentId) { this.documentId = documentId; }
        public String getHeadline() { return headline; }
        public void setHeadline(String headline) { this.headline = headline; }
        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
    }

    /** Overall report returned by the ingest endpoints */
    public static class IngestReport {
        private int documentsFetched;
        private int documentsProcessed; // extracted and merged into the store
        private List<String> discoveredTopics = new ArrayList<>(); // sorted, distinct
        private List<DocumentFailure> failures = new ArrayList<>();
        private StoreStats stats;

        /**
         * Per-model token usage and approximate cost.
         * Structure: model -> { requests, prompt_tokens, completion_tokens, total_tokens, cost_usd }
         */
        private Map<String, Map<String, Object>> aiUsage;
        private double aiCostTotalUsd;

        public int getDocumentsFetched() { return documentsFetched; }
        public void setDocumentsFetched(int documentsFetched) { this.documentsFetched = documentsFetched; }
        public int getDocumentsProcessed() { return documentsProcessed; }
        public void setDocumentsProcessed(int documentsProcessed) { this.documentsProcessed = documentsProcessed; }
        public List<String> getDiscoveredTopics() { return discoveredTopics; }
        public void setDiscoveredTopics(List<String> discoveredTopics) { this.discoveredTopics = discoveredTopics; }
        public List<DocumentFailure> getFailures() { return failures; }
        public void setFailures(List<DocumentFailure> failures) { this.failures = failures; }
        public StoreStats getStats() { return stats; }
        public void setStats(StoreStats stats) { this.stats = stats; }
        public Map<String, Map<String, Object>> getAiUsage() { return aiUsage; }
        public void setAiUsage(Map<String, Map<String, Object>> aiUsage) { this.aiUsage = aiUsage; }
        public double getAiCostTotalUsd() { return aiCostTotalUsd; }
        public void setAiCostTotalUsd(double aiCostTotalUsd) { this.aiCostTotalUsd = aiCostTotalUsd; }
    }

    /** Download archive months to the archive directory, newest first, from start back to end. */
    public static class CrawlRequest {
        @NotNull
        @Min(1851)
        private Integer startYear;
        @NotNull
        @Min(1)
        @Max(12)
        private Integer startMonth;
        @Min(1851)
        private Integer endYear; // defaults to 1851
        @Min(1)
        @Max(12)
        private Integer endMonth; // defaults to 9, the first archive month
        @Positive
        private Integer dailyLimit; // defaults to nyt.archive-daily-limit

        public Integer getStartYear() { return startYear; }
        public void setStartYear(Integer startYear) { this.startYear = startYear; }
        public Integer getStartMonth() { return startMonth; }
        public void setStartMonth(Integer startMonth) { this.startMonth = startMonth; }
        public Integer getEndYear() { return endYear; }
        public void setEndYear(Integer endYear) { this.endYear = endYear; }
        public Integer getEndMonth() { return endMonth; }
        public void setEndMonth(Integer endMonth) { this.endMonth = endMonth; }
        public Integer getDailyLimit() { return dailyLimit; }
        public void setDailyLimit(Integer dailyLimit) { this.dailyLimit = dailyLimit; }
    }

    public static class CrawledMonth {
        private String month; // yyyy-MM
        private int articles;

        public CrawledMonth() {}

        public CrawledMonth(String month, int articles) {
            this.month = month;
            this.articles = articles;
        }

        public String getMonth() { return month; }
        public void setMonth(String month) { this.month = month; }
        public int getArticles() { return articles; }
        public void setArticles(int articles) { this.articles = articles; }
    }

    /**
     * Outcome of a crawl. When it stopped early, {@code resumeFrom} is the first month not yet saved
     * and {@code stopReason} is "daily_limit" or "error".
     */
    public static class CrawlReport {
        private List<CrawledMonth> fetched = new ArrayList<>();
        private List<String> skipped = new ArrayList<>(); // already saved
        private int requests;
        private boolean complete;
        private String stopReason;
        private String resumeFrom;
        private String error;

        public List<CrawledMonth> getFetched() { return fetched; }
        public void setFetched(List<CrawledMonth> fetched) { this.fetched = fetched; }
        public List<String> getSkipped() { return skipped; }
        public void setSkipped(List<String> skipped) { this.skipped = skipped; }
        public int getRequests() { return requests; }
        public void setRequests(int requests) { this.requests = requests; }
        public boolean isComplete() { return complete; }
        public void setComplete(boolean complete) { this.complete = complete; }
        public String getStopReason() { return stopReason; }
        public void setStopReason(String stopReason) { this.stopReason = stopReason; }
        public String getResumeFrom() { return resumeFrom; }
        public void setResumeFrom(String resumeFrom) { this.resumeFrom = resumeFrom; }
        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
    }
}
