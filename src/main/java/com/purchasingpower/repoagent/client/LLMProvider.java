package com.purchasingpower.repoagent.client;

import com.purchasingpower.repoagent.model.CompletionRequest;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Consumer;

/**
 * Chat-completion provider speaking the OpenAI-compatible protocol.
 *
 * <p>Implementations translate transport and HTTP failures into the
 * {@link com.purchasingpower.repoagent.exception.EngineException} taxonomy so the
 * resilience layer can decide what to retry.
 */
public interface LLMProvider {

    /**
     * Blocking-style completion: the text of the first choice.
     *
     * @param request conversation, model and sampling settings
     * @return first choice content
     */
    Mono<String> complete(CompletionRequest request);

    /**
     * Streamed completion.
     *
     * <p>{@code onChunk} is invoked once per non-empty delta, in arrival order and never
     * concurrently. {@code onComplete} is invoked exactly once with the concatenated text,
     * and only when the stream finished cleanly.
     *
     * @return the concatenated text, emitted after {@code onComplete}
     */
    Mono<String> stream(CompletionRequest request, Consumer<String> onChunk, Consumer<String> onComplete);

    /**
     * Identifiers of the models the provider currently advertises.
     */
    Mono<List<String>> listModels();

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
