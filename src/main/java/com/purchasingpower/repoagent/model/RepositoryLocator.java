package com.purchasingpower.repoagent.model;

/**
 * Parsed {@code host/owner/name} repository reference.
 *
 * @param host     e.g. {@code github.com}
 * @param owner    repository owner (user or organisation)
 * @param name     repository name without {@code .git}
 * @param cloneUrl clean URL suitable for git transport
 */
public record RepositoryLocator(String host, String owner, String name, String cloneUrl) {

    public String namespace() {
        return owner + "/" + name;
    }
}
