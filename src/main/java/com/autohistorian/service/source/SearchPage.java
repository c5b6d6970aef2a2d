package com.autohistorian.service.source;

import com.autohistorian.model.Document;

import java.util.List;

public class SearchPage {
    private final List<Document> documents;
    private final long totalHits;

    public SearchPage(List<Document> documents, long totalHits) {
        this.documents = documents;
        this.totalHits = totalHits;
    }

    public List<Document> getDocuments() { return documents; }
    public long getTotalHits() { return totalHits; }
}
