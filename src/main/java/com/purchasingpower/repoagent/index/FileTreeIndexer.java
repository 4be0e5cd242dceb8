package com.purchasingpower.repoagent.index;

import com.purchasingpower.repoagent.exception.EngineException;
import com.purchasingpower.repoagent.model.EntryStat;
import com.purchasingpower.repoagent.model.FileTreeNode;
import com.purchasingpower.repoagent.model.RepositoryStats;
import com.purchasingpower.repoagent.store.RepositoryStore;
import com.purchasingpower.repoagent.util.FileNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the in-memory {@link FileTreeNode} tree of a cloned namespace.
 *
 * <p>Walks depth-first through {@link RepositoryStore#listDirectory}, keeping the
 * store's traversal order. Entries that fail to list are logged and left out so a
 * single unreadable directory does not lose the rest of the tree.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileTreeIndexer {

    private static final String GIT_DIR = ".git";

    private final RepositoryStore store;

    public Result index(String namespace, String rootName) {
        FileTreeNode root = FileTreeNode.directory(rootName, "");
        int[] skipped = {0};
        walk(namespace, root, skipped);

        RepositoryStats stats = analyze(root);
        log.info("Indexed {}: {} files{}", namespace, stats.fileCount(),
                skipped[0] > 0 ? " (" + skipped[0] + " entries skipped)" : "");
        return new Result(root, stats);
    }

    /**
     * File count and extension histogram of an indexed tree.
     */
    public RepositoryStats analyze(FileTreeNode tree) {
        return RepositoryStats.of(tree.flattenFilePaths());
    }

    private void walk(String namespace, FileTreeNode directory, int[] skipped) {
        List<EntryStat> entries;
        try {
            entries = store.listDirectory(namespace, directory.getPath());
        } catch (EngineException e) {
            log.warn("Skipping unreadable directory /{}/{}: {}", namespace, directory.getPath(), e.getMessage());
            skipped[0]++;
            return;
        }

        for (EntryStat entry : entries) {
            String name = FileNames.fileName(entry.path());
            if (GIT_DIR.equals(name)) {
                continue;
            }
            if (entry.directory()) {
                FileTreeNode child = FileTreeNode.directory(name, entry.path());
                directory.addChild(child);
                walk(namespace, child, skipped);
            } else {
                directory.addChild(FileTreeNode.file(name, entry.path()));
            }
        }
    }

    public record Result(FileTreeNode tree, RepositoryStats stats) {
    }
}
