package com.purchasingpower.repoagent.model.prompt;

public record RenderedPrompt(String systemPrompt, String userPrompt) {
}
