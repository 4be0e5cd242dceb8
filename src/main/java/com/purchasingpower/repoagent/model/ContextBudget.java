package com.purchasingpower.repoagent.model;

/**
 * Caps applied when assembling repository context.
 */
public record ContextBudget(int maxSelectedFiles, int maxCharsPerFile, int maxTreeEntriesPerLevel) {

    public static final ContextBudget DEFAULT = new ContextBudget(10, 1000, 10);

    public ContextBudget {
        if (maxSelectedFiles < 0 || maxCharsPerFile < 0 || maxTreeEntriesPerLevel < 0) {
            throw new IllegalArgumentException("Context budget values must not be negative");
        }
    }

    public ContextBudget withMaxSelectedFiles(int files) {
        return new ContextBudget(files, maxCharsPerFile, maxTreeEntriesPerLevel);
    }
}
