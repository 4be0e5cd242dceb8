package com.purchasingpower.repoagent.api;

import java.util.List;

public record SearchResponse(List<String> paths) {
}
