package com.purchasingpower.repoagent.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.Duration;

@Data
public class CompletionProperties {

    @NotBlank
    private String baseUrl = "https://openrouter.ai/api/v1";

    private String apiKey;

    /**
     * Sent as HTTP-Referer; OpenRouter uses it for app attribution.
     */
    private String referer = "https://github.com/purchasingpower/repo-agent";

    private String title = "Repo Agent";

    private double temperature = 0.7;

    private int maxTokens = 4000;

    private Duration responseTimeout = Duration.ofMinutes(5);
}
