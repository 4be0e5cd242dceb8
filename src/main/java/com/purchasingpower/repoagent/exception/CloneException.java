package com.purchasingpower.repoagent.exception;

import lombok.Getter;

@Getter
public class CloneException extends EngineException {

    private final String repoUrl;

    public CloneException(String repoUrl, Throwable cause) {
        super("Git clone failed for " + repoUrl + ": " + cause.getMessage(), cause);
        this.repoUrl = repoUrl;
    }
}
