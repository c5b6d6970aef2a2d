package com.autohistorian.service.generation;

import com.autohistorian.config.GenerationProperties;
import com.autohistorian.util.TokenAccounting;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * {@link GenerationBackend} backed by the Gemini {@code generateContent} REST endpoint.
 *
 * <p>HTTP 429, a RESOURCE_EXHAUSTED status or a quota message map to
 * {@link TransientBackendException}; everything else, timeouts included, is permanent.
 */
@Service
public class GeminiGenerationBackend implements GenerationBackend {
    private static final Logger log = LoggerFactory.getLogger(GeminiGenerationBackend.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final GenerationProperties properties;

    public GeminiGenerationBackend(@Qualifier("generationClient") WebClient webClient,
                                   ObjectMapper objectMapper,
                                   GenerationProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            log.info("Generation backend has no API key; extraction calls will fail until generation.api-key is set");
        } else {
            log.info("Generation backend enabled with model: {}", properties.getModel());
        }
    }

    @Override
    public Mono<String> complete(String prompt, String systemPrompt) {
        String apiKey = properties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new PermanentBackendException("generation.api-key is not configured"));
        }
        String model = properties.getModel();
        ObjectNode request = buildRequest(prompt, systemPrompt);

        log.info("Generation request → model={} promptChars={}", model, prompt != null ? prompt.length() : 0);
        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/v1beta/models/{model}:generateContent")
                        .queryParam("key", apiKey)
                        .build(model))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request.toString())
                .retrieve()
                .onStatus(status -> status.isError(), resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .flatMap(body -> Mono.error(classify(resp.statusCode().value(), body))))
                .bodyToMono(JsonNode.class)
                .timeout(properties.getTimeout())
                .map(response -> {
                    recordUsage(model, response);
                    String text = extractText(response);
                    log.info("Generation response ← model={} chars={}", model, text.length());
                    return text;
                })
                .defaultIfEmpty("")
                .onErrorMap(e -> !(e instanceof GenerationException),
                        e -> new PermanentBackendException("Generation call failed: " + e, e));
    }

    ObjectNode buildRequest(String prompt, String systemPrompt) {
        ObjectNode request = objectMapper.createObjectNode();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            ObjectNode system = request.putObject("systemInstruction");
            system.putArray("parts").addObject().put("text", systemPrompt);
        }
        ArrayNode contents = request.putArray("contents");
        ObjectNode user = contents.addObject();
        user.put("role", "user");
        user.putArray("parts").addObject().put("text", prompt != null ? prompt : "");
        ObjectNode config = request.putObject("generationConfig");
        config.put("temperature", properties.getTemperature());
        return request;
    }

    static GenerationException classify(int status, String body) {
        String lowered = body != null ? body.toLowerCase(Locale.ROOT) : "";
        if (status == 429 || lowered.contains("resource_exhausted") || lowered.contains("quota")) {
            log.warn("Generation throttled: HTTP {}", status);
            return new TransientBackendException("Generation backend throttled (HTTP " + status + ")");
        }
        log.error("Generation HTTP {}: {}", status, truncateForLog(body));
        return new PermanentBackendException("Generation backend error (HTTP " + status + ")");
    }

    /** Concatenated text parts of the first candidate; empty when the model returned none. */
    static String extractText(JsonNode response) {
        JsonNode parts = response.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) return "";
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : parts) {
            if (part.hasNonNull("text")) sb.append(part.get("text").asText());
        }
        return sb.toString();
    }

    private static void recordUsage(String model, JsonNode response) {
        JsonNode usage = response.path("usageMetadata");
        if (usage.isMissingNode()) return;
        String usedModel = response.hasNonNull("modelVersion") ? response.get("modelVersion").asText() : model;
        TokenAccounting.recordUsage(usedModel,
                usage.path("promptTokenCount").asLong(0),
                usage.path("candidatesTokenCount").asLong(0),
                usage.path("totalTokenCount").asLong(0));
    }

    private static String truncateForLog(String s) {
        if (s == null) return "";
        return s.length() > 500 ? s.substring(0, 500) + "…" : s;
    }
}
