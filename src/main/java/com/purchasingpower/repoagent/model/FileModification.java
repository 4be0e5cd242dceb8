package com.purchasingpower.repoagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A proposed change to one file. Never applied to the store by the engine;
 * the caller decides whether to accept, review or discard it.
 *
 * @param path            repository-relative path
 * @param originalContent current content, or {@code null} when the file does not exist yet
 * @param newContent      full proposed content
 */
public record FileModification(String path, String originalContent, String newContent) {

    public static FileModification proposed(String path, String newContent) {
        return new FileModification(path, null, newContent);
    }

    public FileModification withOriginal(String original) {
        return new FileModification(path, original, newContent);
    }

    @JsonIgnore
    public boolean isNewFile() {
        return originalContent == null;
    }
}
