package com.autohistorian.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form model output into a JSON array or object.
 *
 * <p>Strategies, first match wins:
 * - contents of a fenced code block (```json ... ``` or ``` ... ```)
 * - the whole text as JSON
 * - the first balanced [...] span that parses
 * - the first balanced {...} span that parses
 *
 * <p>Spans are found by bracket matching that skips string literals, so brackets in prose after the
 * JSON do not widen the span.
 *
 * <p>Scalars are not structured data; text that yields neither an array nor an object parses to
 * {@link Optional#empty()}.
 */
@Component
public class StructuredOutputParser {
    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private final ObjectReader strictReader;

    public StructuredOutputParser(ObjectMapper objectMapper) {
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Optional<JsonNode> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String candidate = text.trim();
        Matcher fence = FENCE.matcher(candidate);
        if (fence.find()) {
            candidate = fence.group(1).trim();
        }

        Optional<JsonNode> direct = tryParse(candidate);
        if (direct.isPresent()) return direct;

        Optional<JsonNode> array = firstBalanced(candidate, '[', ']');
        if (array.isPresent()) return array;
        return firstBalanced(candidate, '{', '}');
    }

    private Optional<JsonNode> firstBalanced(String text, char open, char close) {
        for (int start = text.indexOf(open); start >= 0; start = text.indexOf(open, start + 1)) {
            int end = closingIndex(text, start, open, close);
            if (end < 0) continue;
            Optional<JsonNode> parsed = tryParse(text.substring(start, end + 1));
            if (parsed.isPresent()) return parsed;
        }
        return Optional.empty();
    }

    /** Index of the bracket closing the one at {@code start}, or -1. */
    static int closingIndex(String text, int start, char open, char close) {
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                if (ch == '\\') i++;
                else if (ch == '"') inString = false;
            } else if (ch == '"') {
                inString = true;
            } else if (ch == open) {
                depth++;
            } else if (ch == close && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private Optional<JsonNode> tryParse(String json) {
        try {
            JsonNode node = strictReader.readTree(json);
            if (node != null && node.isContainerNode()) return Optional.of(node);
            return Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
