package com.github.spud.primus.domain.inference;

import reactor.core.publisher.Mono;

/**
 * Opaque inference boundary. Sees only the context the guard let through.
 */
public interface InferenceBackend {

  Mono<String> complete(String prompt, ContextBundle context);
}
