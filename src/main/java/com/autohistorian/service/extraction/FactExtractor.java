package com.autohistorian.service.extraction;

import com.autohistorian.model.Document;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Turns one document into zero or more typed facts with a single generation call.
 *
 * <p>Output the model sends back in a shape that cannot be parsed yields an empty list. A failed
 * generation call fails the returned Mono.
 */
public interface FactExtractor<T> {
    Mono<List<T>> extract(Document document);
}
