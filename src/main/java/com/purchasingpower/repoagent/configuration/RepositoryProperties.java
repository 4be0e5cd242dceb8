package com.purchasingpower.repoagent.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RepositoryProperties {

    /**
     * When false the headless store is wired and every clone/read fails with
     * {@link UnsupportedOperationException}.
     */
    private boolean virtualFsEnabled = true;

    /**
     * Fetch depth; 0 fetches full history.
     */
    @Min(0)
    private int cloneDepth = 1;

    /**
     * Branch to clone. Blank means the remote's default branch (HEAD).
     */
    private String branch;

    /**
     * Optional credentials for private repositories.
     */
    private String username;

    private String password;
}
