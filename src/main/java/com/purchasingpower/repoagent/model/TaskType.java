package com.purchasingpower.repoagent.model;

/**
 * Coarse task category, used to pick a default model when the preferred one
 * cannot be used.
 */
public enum TaskType {
    CODE,
    ANALYSIS,
    EDIT,
    GENERAL
}
