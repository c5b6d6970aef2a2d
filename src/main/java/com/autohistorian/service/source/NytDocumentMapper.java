package com.autohistorian.service.source;

import com.autohistorian.model.Document;
import com.autohistorian.util.TimeParsing;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Maps one NYT API doc (Article Search or Archive) to a {@link Document}.
 *
 * <p>The id is a name-based UUID of the NYT {@code _id} (then {@code uri}, then {@code web_url}),
 * so the same article always maps to the same document id.
 */
@Component
public class NytDocumentMapper {
    static final String DEFAULT_SOURCE = "The New York Times";

    public Document map(JsonNode doc) {
        Document d = new Document();
        d.setId(stableId(doc));
        d.setWebUrl(text(doc, "web_url"));
        d.setHeadline(text(doc.path("headline"), "main"));
        d.setSnippet(text(doc, "snippet"));
        d.setAbstractText(text(doc, "abstract"));
        d.setLeadParagraph(text(doc, "lead_paragraph"));
        d.setByline(text(doc.path("byline"), "original"));
        String source = text(doc, "source");
        d.setSource(source != null ? source : DEFAULT_SOURCE);
        OffsetDateTime published = TimeParsing.parseLenient(text(doc, "pub_date"));
        d.setObservedAt(published != null ? published : OffsetDateTime.now(ZoneOffset.UTC));
        String type = text(doc, "document_type");
        d.setDocumentType(type != null ? type : "article");
        d.setSectionName(text(doc, "section_name"));
        d.setSubsectionName(text(doc, "subsection_name"));
        d.setKeywords(keywords(doc));
        d.setWordCount(doc.path("word_count").asInt(0));
        return d;
    }

    public List<Document> mapAll(JsonNode docs) {
        List<Document> out = new ArrayList<>();
        if (docs == null || !docs.isArray()) return out;
        for (JsonNode doc : docs) {
            if (doc.isObject()) out.add(map(doc));
        }
        return out;
    }

    static String stableId(JsonNode doc) {
        String key = text(doc, "_id");
        if (key == null) key = text(doc, "uri");
        if (key == null) key = text(doc, "web_url");
        if (key == null) return UUID.randomUUID().toString();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static List<String> keywords(JsonNode doc) {
        List<String> out = new ArrayList<>();
        for (JsonNode kw : doc.path("keywords")) {
            String value = text(kw, "value");
            if (value != null) out.add(value);
        }
        return out;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }
}
