package com.purchasingpower.repoagent.api;

public record ModelChoice(String model) {
}
