package com.autohistorian.service.source;

import com.autohistorian.model.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Narrows a month of archive documents before extraction.
 *
 * <p>Drops documents with neither headline nor abstract, keeps only the listed sections
 * (case-insensitive; no sections keeps all), keeps documents whose headline, abstract or snippet
 * contains the query (case-insensitive), and stops at {@code maxArticles}.
 */
public final class DocumentFilter {
    private final Set<String> sections;
    private final String query;
    private final int maxArticles;

    public DocumentFilter(List<String> sections, String query, int maxArticles) {
        this.sections = sections == null ? Set.of() : sections.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        this.query = query != null && !query.isBlank() ? query.trim().toLowerCase(Locale.ROOT) : null;
        this.maxArticles = maxArticles;
    }

    public List<Document> apply(List<Document> documents) {
        List<Document> out = new ArrayList<>();
        for (Document d : documents) {
            if (out.size() >= maxArticles) break;
            if (accepts(d)) out.add(d);
        }
        return out;
    }

    boolean accepts(Document d) {
        if (isBlank(d.getHeadline()) && isBlank(d.getAbstractText())) return false;
        if (!sections.isEmpty()) {
            String section = d.getSectionName();
            if (section == null || !sections.contains(section.trim().toLowerCase(Locale.ROOT))) return false;
        }
        if (query != null) {
            return contains(d.getHeadline()) || contains(d.getAbstractText()) || contains(d.getSnippet());
        }
        return true;
    }

    private boolean contains(String field) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(query);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
