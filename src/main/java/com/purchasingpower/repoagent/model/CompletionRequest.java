package com.purchasingpower.repoagent.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One chat-completion call. Immutable; {@link #withModel(String)} is used by
 * the fallback chain to re-issue the same conversation to another model.
 */
@Value
@Builder(toBuilder = true)
public class CompletionRequest {

    String systemPrompt;

    @Singular
    List<ChatMessage> messages;

    String modelId;

    boolean streaming;

    @Builder.Default
    double temperature = 0.7;

    @Builder.Default
    int maxTokens = 4000;

    public CompletionRequest withModel(String model) {
        return toBuilder().modelId(model).build();
    }

    public CompletionRequest asStreaming() {
        return toBuilder().streaming(true).build();
    }
}
