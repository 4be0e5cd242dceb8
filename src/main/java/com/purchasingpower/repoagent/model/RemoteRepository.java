package com.purchasingpower.repoagent.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * The single active repository of an engine instance.
 *
 * <p>Built once per successful clone; loading another URL replaces it.
 * {@code cloned} is only ever set to {@code true} by the store after the
 * namespace has been populated.
 */
@Value
@Builder(toBuilder = true)
public class RemoteRepository {

    String owner;
    String name;
    String url;
    String description;
    int starCount;
    int forkCount;
    boolean cloned;

    /**
     * Number of files found by the post-clone analysis.
     */
    int fileCount;

    /**
     * Extension histogram, e.g. {@code {"py": 12, "md": 2}}.
     */
    Map<String, Integer> fileTypes;

    public String namespace() {
        return owner + "/" + name;
    }
}
