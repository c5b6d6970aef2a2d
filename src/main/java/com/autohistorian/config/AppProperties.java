package com.autohistorian.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public class AppProperties {
    /**
     * Root directory of the knowledge store (documents, extractions, topics).
     */
    private String dataDir = "data";
    /**
     * Directory holding locally saved archive months named yyyy-MM.json.
     * Defaults to "data/archive" when not set.
     */
    private String archiveDir;
    // Extraction tuning
    private int maxConcurrentExtractions = 5;
    private int maxArticles = 50;
    private int recentDays = 7;

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getArchiveDir() {
        return archiveDir;
    }

    public void setArchiveDir(String archiveDir) {
        this.archiveDir = archiveDir;
    }

    public int getMaxConcurrentExtractions() {
        return maxConcurrentExtractions;
    }

    public void setMaxConcurrentExtractions(int maxConcurrentExtractions) {
        this.maxConcurrentExtractions = maxConcurrentExtractions;
    }

    public int getMaxArticles() {
        return maxArticles;
    }

    public void setMaxArticles(int maxArticles) {
        this.maxArticles = maxArticles;
    }

    public int getRecentDays() {
        return recentDays;
    }

    public void setRecentDays(int recentDays) {
        this.recentDays = recentDays;
    }
}
