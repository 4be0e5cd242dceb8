package com.purchasingpower.repoagent.model;

/**
 * Descriptive fields fetched from the hosting service's metadata API.
 */
public record RepositoryMetadata(String description, int starCount, int forkCount) {

    public static RepositoryMetadata unavailable() {
        return new RepositoryMetadata("", 0, 0);
    }
}
