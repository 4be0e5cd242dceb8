package com.purchasingpower.repoagent.model;

import java.util.List;

/**
 * Everything known about the active repository after a load: metadata, the indexed
 * tree and its file paths in traversal order.
 */
public record LoadedRepository(RemoteRepository repository, FileTreeNode tree, List<String> filePaths) {

    public LoadedRepository {
        filePaths = List.copyOf(filePaths);
    }

    public String namespace() {
        return repository.namespace();
    }
}
