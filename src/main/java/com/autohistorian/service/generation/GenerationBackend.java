package com.autohistorian.service.generation;

import reactor.core.publisher.Mono;

/**
 * Raw text-generation capability: given a prompt, return text, asynchronously and fallibly.
 *
 * <p>Implementations signal throttling with {@link TransientBackendException} and every other
 * failure with {@link PermanentBackendException}. Only {@link GenerationGateway} calls this.
 */
public interface GenerationBackend {
    Mono<String> complete(String prompt, String systemPrompt);
}
