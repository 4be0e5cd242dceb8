package com.purchasingpower.repoagent.model;

public enum NodeKind {
    FILE,
    DIRECTORY
}
