package com.autohistorian.controller;

import com.autohistorian.service.extraction.DocumentExtractionException;
import com.autohistorian.service.generation.GenerationException;
import com.autohistorian.service.source.DocumentSourceException;
import com.autohistorian.service.store.KnowledgeStoreException;
import com.autohistorian.service.store.TopicNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to JSON bodies: 400 for bad input, 404 for unknown topics, 502 when the
 * generation backend or the document source failed, 500 for store failures and anything else.
 */
@RestControllerAdvice
public class GlobalErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex) {
        List<Map<String, Object>> errors = ex.getFieldErrors().stream().map(err -> {
            Map<String, Object> e = new HashMap<>();
            e.put("field", err.getField());
            e.put("code", err.getCode());
            e.put("message", err.getDefaultMessage());
            return e;
        }).collect(Collectors.toList());
        log.warn("Request binding failed: {}", errors);
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("details", errors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.warn("Input error: {}", ex.getReason());
        return ResponseEntity.badRequest().body(body("bad_request", ex.getReason()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body("bad_request", ex.getMessage()));
    }

    @ExceptionHandler(TopicNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleTopicNotFound(TopicNotFoundException ex) {
        Map<String, Object> body = body("not_found", ex.getMessage());
        body.put("topic", ex.getTopicName());
        return ResponseEntity.status(404).body(body);
    }

    @ExceptionHandler(DocumentExtractionException.class)
    public ResponseEntity<Map<String, Object>> handleExtraction(DocumentExtractionException ex) {
        log.error("Extraction aborted at document {}: {}", ex.getDocumentId(), ex.getCause() != null ? ex.getCause().toString() : "");
        Map<String, Object> body = body("extraction_failed", ex.getMessage());
        body.put("documentId", ex.getDocumentId());
        if (ex.getCause() != null) body.put("cause", ex.getCause().getClass().getSimpleName());
        return ResponseEntity.status(502).body(body);
    }

    @ExceptionHandler({GenerationException.class, DocumentSourceException.class})
    public ResponseEntity<Map<String, Object>> handleUpstream(RuntimeException ex) {
        log.error("Upstream failure: {}", ex.toString());
        Map<String, Object> body = body("upstream_failed", ex.getMessage());
        body.put("exception", ex.getClass().getSimpleName());
        return ResponseEntity.status(502).body(body);
    }

    @ExceptionHandler(KnowledgeStoreException.class)
    public ResponseEntity<Map<String, Object>> handleStore(KnowledgeStoreException ex) {
        log.error("Knowledge store failure", ex);
        return ResponseEntity.status(500).body(body("store_error", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.warn("Unhandled error: {}", ex.toString());
        Map<String, Object> body = body("server_error", ex.getMessage());
        body.put("exception", ex.getClass().getSimpleName());
        return ResponseEntity.status(500).body(body);
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
