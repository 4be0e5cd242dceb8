package com.purchasingpower.repoagent.exception;

import lombok.Getter;

/**
 * A path does not exist in the repository namespace.
 *
 * <p>Kept distinct from {@link RepositoryIoException} so workflows can treat a
 * missing file as a file that is about to be created.
 */
@Getter
public class NotFoundException extends EngineException {

    private final String path;

    public NotFoundException(String namespace, String path) {
        super("File not found: /" + namespace + "/" + path);
        this.path = path;
    }
}
