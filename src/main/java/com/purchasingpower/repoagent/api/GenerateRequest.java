package com.purchasingpower.repoagent.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the generate, generate/stream and generate-with-tests endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerateRequest {

    @NotBlank
    private String prompt;

    /**
     * Target language; the repository's language is used when absent.
     */
    private String language;

    private String model;
}
