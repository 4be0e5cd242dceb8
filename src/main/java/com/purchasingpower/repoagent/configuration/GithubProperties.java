package com.purchasingpower.repoagent.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.Duration;

@Data
public class GithubProperties {

    @NotBlank
    private String apiBaseUrl = "https://api.github.com";

    /**
     * Optional token; metadata requests are sent anonymously when blank.
     */
    private String token;

    private Duration timeout = Duration.ofSeconds(15);
}
