package com.autohistorian.service.source;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Parameters of an Article Search request; everything is optional. */
public class SearchQuery {
    private String query;
    private LocalDate beginDate;
    private LocalDate endDate;
    private String sort = "newest"; // newest, oldest, relevance
    private String filterQuery;
    private List<String> sections = new ArrayList<>();

    public String getQuery() { return query; }
    public SearchQuery setQuery(String query) { this.query = query; return this; }

    public LocalDate getBeginDate() { return beginDate; }
    public SearchQuery setBeginDate(LocalDate beginDate) { this.beginDate = beginDate; return this; }

    public LocalDate getEndDate() { return endDate; }
    public SearchQuery setEndDate(LocalDate endDate) { this.endDate = endDate; return this; }

    public String getSort() { return sort; }
    public SearchQuery setSort(String sort) { this.sort = sort; return this; }

    public String getFilterQuery() { return filterQuery; }
    public SearchQuery setFilterQuery(String filterQuery) { this.filterQuery = filterQuery; return this; }

    public List<String> getSections() { return sections; }
    public SearchQuery setSections(List<String> sections) { this.sections = sections != null ? sections : new ArrayList<>(); return this; }

    /**
     * Lucene-style {@code fq}: the free filter and a section clause joined with AND, or null when
     * neither is set.
     */
    public String buildFilter() {
        List<String> parts = new ArrayList<>();
        if (filterQuery != null && !filterQuery.isBlank()) parts.add(filterQuery);
        if (!sections.isEmpty()) {
            List<String> quoted = new ArrayList<>();
            for (String s : sections) quoted.add("\"" + s + "\"");
            parts.add("section_name:(" + String.join(" OR ", quoted) + ")");
        }
        return parts.isEmpty() ? null : String.join(" AND ", parts);
    }
}
