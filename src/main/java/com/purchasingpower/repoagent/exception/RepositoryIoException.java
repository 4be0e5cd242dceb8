package com.purchasingpower.repoagent.exception;

public class RepositoryIoException extends EngineException {

    public RepositoryIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
