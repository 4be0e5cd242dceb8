package com.purchasingpower.repoagent.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to clone and index a repository, e.g. {@code {"url": "https://github.com/user/repo"}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadRepositoryRequest {

    @NotBlank
    private String url;
}
