package com.purchasingpower.repoagent.api;

import java.util.List;

public record ModelsResponse(List<String> models) {
}
