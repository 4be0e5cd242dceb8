package com.purchasingpower.repoagent.model;

import com.purchasingpower.repoagent.util.FileNames;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts produced by the post-clone analysis.
 *
 * @param fileCount number of files (directories excluded)
 * @param fileTypes extension to count; {@code no-extension} for dot-less names
 */
public record RepositoryStats(int fileCount, Map<String, Integer> fileTypes) {

    public static RepositoryStats of(Collection<String> filePaths) {
        Map<String, Integer> types = new LinkedHashMap<>();
        for (String path : filePaths) {
            types.merge(FileNames.extension(path), 1, Integer::sum);
        }
        return new RepositoryStats(filePaths.size(), Collections.unmodifiableMap(types));
    }
}
