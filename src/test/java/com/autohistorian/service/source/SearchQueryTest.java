package com.autohistorian.service.source;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class SearchQueryTest {

    @Test
    void filterCombinesFreeFilterAndSections() {
        SearchQuery q = new SearchQuery()
                .setFilterQuery("document_type:(\"article\")")
                .setSections(List.of("U.S.", "Politics"));
        assertEquals("document_type:(\"article\") AND section_name:(\"U.S.\" OR \"Politics\")", q.buildFilter());
    }

    @Test
    void noFilterWhenNothingIsSet() {
        assertNull(new SearchQuery().buildFilter());
    }
}
