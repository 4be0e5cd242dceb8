package com.purchasingpower.repoagent.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateFileRequest {

    /**
     * Target directory; blank for the repository root.
     */
    private String directory;

    @NotBlank
    private String fileName;

    @NotBlank
    private String description;

    private String model;
}
