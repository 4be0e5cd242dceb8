package com.purchasingpower.repoagent.api;

public record TextResponse(String content) {
}
