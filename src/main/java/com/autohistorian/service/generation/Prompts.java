package com.autohistorian.service.generation;

/**
 * Prompt catalogue for fact extraction and article writing. Templates are filled with
 * {@link String#format}.
 */
public final class Prompts {
    private Prompts() {}

    public static final String SYSTEM = """
            You are an expert at analyzing news articles and extracting structured information.
            You identify events, statements, entities, and topics with precision and accuracy.
            Always respond with valid JSON when asked for structured output.""";

    private static final String EVENTS = """
            Analyze this news article and extract all events (things that happened).

            For each event, identify:
            - description: A clear, factual description of what happened
            - event_type: Category (e.g., arrest, policy_change, statement, meeting, protest, legal_action)
            - valid_time: When the event actually occurred (ISO-8601 if known, null if unknown)
            - participants: List of people/organizations involved
            - location: Where it happened (if mentioned)
            - confidence: How certain the article is that it happened (0.0-1.0)

            Article:
            %s

            Respond with a JSON array of events:
            [{"description": "...", "event_type": "...", "valid_time": "...", "participants": [], "location": "...", "confidence": 0.9}]""";

    private static final String STATEMENTS = """
            Analyze this news article and extract all notable statements or quotes.

            For each statement, identify:
            - content: The actual quote or paraphrased statement
            - speaker: Who said it
            - speaker_role: Their role/title if mentioned
            - stance: Their position (pro, con, neutral) on the topic
            - target: What the statement is about
            - valid_time: When it was said (ISO-8601 if known, null if unknown)

            Article:
            %s

            Respond with a JSON array of statements:
            [{"content": "...", "speaker": "...", "speaker_role": "...", "stance": "...", "target": "...", "valid_time": null}]""";

    private static final String ENTITIES = """
            Analyze this news article and extract all named entities.

            For each entity, identify:
            - name: The entity's name
            - entity_type: Category (person, organization, location, law, event_name)
            - aliases: Other names used for it in the article
            - description: Brief description based on the article

            Article:
            %s

            Respond with a JSON array of entities:
            [{"name": "...", "entity_type": "...", "aliases": [], "description": "..."}]""";

    private static final String TOPICS = """
            Analyze this news article and identify the main topics it covers.

            For each topic, provide:
            - name: A clear, specific topic name (e.g., "ICE Operations in Minnesota" not just "Immigration")
            - category: One of: politics, law, international, economy, science, social, other
            - relevance: How central this topic is to the article (0.0-1.0)

            Article headline: %s
            Article abstract: %s

            Respond with a JSON array of topics (max %d):
            [{"name": "...", "category": "...", "relevance": 0.9}]""";

    public static final String WRITER_SYSTEM = """
            You are an encyclopedia editor. You write neutral, well-sourced articles from the
            facts you are given and never add facts of your own.""";

    private static final String OUTLINE = """
            Generate a Wikipedia-style article outline for the topic: %s

            Based on the following events and statements:

            Events:
            %s

            Statements:
            %s

            Create an outline with:
            1. A lead section summarizing the topic
            2. Relevant sections organized chronologically or thematically
            3. A timeline section with dual timelines (when events happened vs when reported)

            Respond with a JSON outline:
            {"title": "...", "lead": "...", "sections": [{"title": "...", "content_notes": "..."}]}""";

    private static final String ARTICLE = """
            Write a Wikipedia-style article section about: %s

            Use these events and statements as source material:

            Events:
            %s

            Statements:
            %s

            Guidelines:
            - Write in encyclopedic, neutral tone
            - Cite sources using [Source: date] format
            - Distinguish between when events happened and when they were reported
            - Include notable quotes with attribution
            - Be factual and avoid speculation

            Write the article section in markdown format.""";

    public static String events(String documentText) {
        return String.format(EVENTS, documentText);
    }

    public static String statements(String documentText) {
        return String.format(STATEMENTS, documentText);
    }

    public static String entities(String documentText) {
        return String.format(ENTITIES, documentText);
    }

    public static String topics(String headline, String summary, int maxTopics) {
        return String.format(TOPICS, headline != null ? headline : "", summary != null ? summary : "", maxTopics);
    }

    public static String outline(String topic, String eventsJson, String statementsJson) {
        return String.format(OUTLINE, topic, eventsJson, statementsJson);
    }

    public static String article(String topic, String eventsJson, String statementsJson) {
        return String.format(ARTICLE, topic, eventsJson, statementsJson);
    }
}
