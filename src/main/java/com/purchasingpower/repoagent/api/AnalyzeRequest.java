package com.purchasingpower.repoagent.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

    @NotBlank
    private String prompt;

    /**
     * Optional; focuses the question on one file.
     */
    private String filePath;

    private String model;
}
