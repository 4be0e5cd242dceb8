package com.purchasingpower.repoagent.api;

public record FileContentResponse(String path, String content) {
}
