package com.purchasingpower.repoagent.model;

public record EntryStat(String path, boolean directory, long size) {
}
