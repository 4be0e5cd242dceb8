package com.purchasingpower.repoagent.exception;

public class RepositoryNotLoadedException extends EngineException {

    public RepositoryNotLoadedException() {
        super("No repository is currently loaded. Load a repository first.");
    }
}
