package com.autohistorian.service.extraction;

import com.autohistorian.model.Document;
import com.autohistorian.service.generation.GenerationGateway;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared plumbing for the extractors: prompt, one gateway call, tolerant JSON-array mapping.
 */
public abstract class AbstractFactExtractor<T> implements FactExtractor<T> {
    private static final Logger log = LoggerFactory.getLogger(AbstractFactExtractor.class);

    protected final GenerationGateway gateway;

    protected AbstractFactExtractor(GenerationGateway gateway) {
        this.gateway = gateway;
    }

    protected abstract String kind();

    protected abstract String buildPrompt(Document document);

    /** Maps one array element; returning null drops it. */
    protected abstract T map(JsonNode node, Document document);

    @Override
    public Mono<List<T>> extract(Document document) {
        return gateway.generateStructured(buildPrompt(document))
                .map(parsed -> toFacts(parsed, document));
    }

    List<T> toFacts(Optional<JsonNode> parsed, Document document) {
        if (parsed.isEmpty() || !parsed.get().isArray()) {
            log.warn("Unparseable {} output for document {}; treating as no {}", kind(), document.getId(), kind());
            return new ArrayList<>();
        }
        List<T> out = new ArrayList<>();
        for (JsonNode element : parsed.get()) {
            if (!element.isObject()) continue;
            T fact = map(element, document);
            if (fact != null) out.add(fact);
        }
        log.debug("Extracted {} {} from document {}", out.size(), kind(), document.getId());
        return out;
    }

    /** Headline, abstract and lead joined by blank lines; missing parts are skipped. */
    public static String documentText(Document document) {
        List<String> parts = new ArrayList<>();
        parts.add("Headline: " + (document.getHeadline() != null ? document.getHeadline() : ""));
        if (notBlank(document.getAbstractText())) parts.add("Abstract: " + document.getAbstractText());
        if (notBlank(document.getLeadParagraph())) parts.add("Lead: " + document.getLeadParagraph());
        return String.join("\n\n", parts);
    }

    protected static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }

    protected static String text(JsonNode node, String field, String fallback) {
        String s = text(node, field);
        return s != null ? s : fallback;
    }

    protected static List<String> stringList(JsonNode node, String field) {
        List<String> out = new ArrayList<>();
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return out;
        if (v.isArray()) {
            for (JsonNode item : v) {
                if (item.isValueNode() && !item.isNull() && !item.asText().isBlank()) out.add(item.asText().trim());
            }
        } else if (v.isTextual() && !v.asText().isBlank()) {
            out.add(v.asText().trim());
        }
        return out;
    }

    protected static double unitInterval(JsonNode node, String field, double fallback) {
        JsonNode v = node.get(field);
        double d;
        if (v != null && v.isNumber()) {
            d = v.asDouble();
        } else if (v != null && v.isTextual()) {
            try {
                d = Double.parseDouble(v.asText().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        } else {
            return fallback;
        }
        if (Double.isNaN(d)) return fallback;
        return Math.max(0.0, Math.min(1.0, d));
    }

    protected static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
