package com.autohistorian.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A news article as ingested from the document source. Documents are written once by the
 * knowledge store and never changed afterwards; re-saving the same id replaces the file.
 */
public class Document {
    private String id; // stable unique id (name-based UUID of the source uri)
    private String webUrl;
    private String headline;
    private String snippet;
    private String abstractText;
    private String leadParagraph;
    private String byline;
    private String source; // e.g., The New York Times
    private OffsetDateTime observedAt; // publication time
    private String documentType;
    private String sectionName;
    private String subsectionName;
    private List<String> keywords = new ArrayList<>();
    private int wordCount;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getWebUrl() {
        return webUrl;
    }

    public void setWebUrl(String webUrl) {
        this.webUrl = webUrl;
    }

    public String getHeadline() {
        return headline;
    }

    public void setHeadline(String headline) {
        this.headline = headline;
    }

    public String getSnippet() {
        return snippet;
    }

    public void setSnippet(String snippet) {
        this.snippet = snippet;
    }

    public String getAbstractText() {
        return abstractText;
    }

    public void setAbstractText(String abstractText) {
        this.abstractText = abstractText;
    }

    public String getLeadParagraph() {
        return leadParagraph;
    }

    public void setLeadParagraph(String leadParagraph) {
        this.leadParagraph = leadParagraph;
    }

    public String getByline() {
        return byline;
    }

    public void setByline(String byline) {
        this.byline = byline;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public OffsetDateTime getObservedAt() {
        return observedAt;
    }

    public void setObservedAt(OffsetDateTime observedAt) {
        this.observedAt = observedAt;
    }

    public String getDocumentType() {
        return documentType;
    }

    public void setDocumentType(String documentType) {
        this.documentType = documentType;
    }

    public String getSectionName() {
        return sectionName;
    }

    public void setSectionName(String sectionName) {
        this.sectionName = sectionName;
    }

    public String getSubsectionName() {
        return subsectionName;
    }

    public void setSubsectionName(String subsectionName) {
        this.subsectionName = subsectionName;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords != null ? keywords : new ArrayList<>();
    }

    public int getWordCount() {
        return wordCount;
    }

    public void setWordCount(int wordCount) {
        this.wordCount = wordCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document)) return false;
        Document that = (Document) o;
        return wordCount == that.wordCount
                && Objects.equals(id, that.id)
                && Objects.equals(webUrl, that.webUrl)
                && Objects.equals(headline, that.headline)
                && Objects.equals(snippet, that.snippet)
                && Objects.equals(abstractText, that.abstractText)
                && Objects.equals(leadParagraph, that.leadParagraph)
                && Objects.equals(byline, that.byline)
                && Objects.equals(source, that.source)
                && Objects.equals(observedAt, that.observedAt)
                && Objects.equals(documentType, that.documentType)
                && Objects.equals(sectionName, that.sectionName)
                && Objects.equals(subsectionName, that.subsectionName)
                && Objects.equals(keywords, that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, webUrl, headline, observedAt);
    }
}
