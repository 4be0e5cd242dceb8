package com.purchasingpower.repoagent.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EditRequest {

    @NotBlank
    private String filePath;

    @NotBlank
    private String instruction;

    private String model;
}
