package com.purchasingpower.repoagent.model;

import java.util.List;

public record AgentResponse(String explanation, List<FileModification> files) {

    public static AgentResponse empty() {
        return new AgentResponse("", List.of());
    }
}
