package com.autohistorian.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nyt")
public class NytProperties {
    private String baseUrl = "https://api.nytimes.com";
    private String apiKey;
    /** NYT allows 5 requests per minute per key */
    private int requestsPerMinute = 5;
    /** Upper bound on Article Search pages fetched per search (10 docs per page) */
    private int maxPages = 10;
    /** Archive requests one crawl may make; the API allows 500 per day */
    private int archiveDailyLimit = 500;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public void setRequestsPerMinute(int requestsPerMinute) {
        this.requestsPerMinute = requestsPerMinute;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = maxPages;
    }

    public int getArchiveDailyLimit() {
        return archiveDailyLimit;
    }

    public void setArchiveDailyLimit(int archiveDailyLimit) {
        this.archiveDailyLimit = archiveDailyLimit;
    }
}
