package com.autohistorian.service.generation;

import com.autohistorian.config.WebClientConfig;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuredOutputParserTest {
    private final StructuredOutputParser parser = new StructuredOutputParser(WebClientConfig.newObjectMapper());

    @Test
    void fencedJsonBlock() {
        String text = "Here you go:\n```json\n[{\"name\": \"Budget talks\"}]\n```\nAnything else?";
        JsonNode node = parser.parse(text).orElseThrow();
        assertTrue(node.isArray());
        assertEquals("Budget talks", node.get(0).get("name").asText());
    }

    @Test
    void fenceWithoutLanguageTag() {
        JsonNode node = parser.parse("```\n{\"stance\": \"pro\"}\n```").orElseThrow();
        assertEquals("pro", node.get("stance").asText());
    }

    @Test
    void bareJson() {
        assertEquals(2, parser.parse("[1, 2]").orElseThrow().size());
    }

    @Test
    void arrayEmbeddedInProse() {
        JsonNode node = parser.parse("Sure! The events are [{\"description\": \"vote\"}] as requested.").orElseThrow();
        assertEquals("vote", node.get(0).get("description").asText());
    }

    @Test
    void bracketsInTrailingProseDoNotHideTheArray() {
        JsonNode node = parser.parse("Here are the events: [{\"description\": \"Vote held\"}] (source: paragraph [2])")
                .orElseThrow();
        assertTrue(node.isArray());
        assertEquals("Vote held", node.get(0).get("description").asText());
    }

    @Test
    void bracketsInsideStringsAreNotStructure() {
        JsonNode node = parser.parse("Result: [{\"quote\": \"see [note] and ]\"}] done [x").orElseThrow();
        assertEquals(1, node.size());
        assertEquals("see [note] and ]", node.get(0).get("quote").asText());
    }

    @Test
    void firstArrayWinsOverLaterOnes() {
        JsonNode node = parser.parse("Step [a] failed, events: [{\"description\": \"first\"}] and [{\"description\": \"second\"}]")
                .orElseThrow();
        assertEquals("first", node.get(0).get("description").asText());
    }

    @Test
    void objectEmbeddedInProse() {
        JsonNode node = parser.parse("Result: {\"stance\": \"con\", \"confidence\": 0.8} hope this helps").orElseThrow();
        assertEquals("con", node.get("stance").asText());
    }

    @Test
    void closingIndexSkipsEscapedQuotes() {
        String text = "[\"a \\\" ]\", 1] tail]";
        assertEquals(text.indexOf(" tail") - 1, StructuredOutputParser.closingIndex(text, 0, '[', ']'));
    }

    @Test
    void proseWithoutJsonIsNoStructuredData() {
        assertEquals(Optional.empty(), parser.parse("Sure! Here's the data: not json"));
    }

    @Test
    void scalarsAndBlankAreNoStructuredData() {
        assertEquals(Optional.empty(), parser.parse("42"));
        assertEquals(Optional.empty(), parser.parse("\"just a string\""));
        assertEquals(Optional.empty(), parser.parse("   "));
        assertEquals(Optional.empty(), parser.parse(null));
    }

    @Test
    void brokenJsonIsNoStructuredData() {
        assertEquals(Optional.empty(), parser.parse("[{\"description\": \"unterminated"));
    }
}
