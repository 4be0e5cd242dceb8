package com.purchasingpower.repoagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the in-memory repository tree.
 *
 * <p>Paths are relative to the repository root ({@code ""} for the root itself)
 * and unique within a repository. Leaves never carry content; file bodies are
 * read lazily through the store. Children keep traversal order.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FileTreeNode {

    private final NodeKind kind;
    private final String name;
    private final String path;
    private final List<FileTreeNode> children;

    private FileTreeNode(NodeKind kind, String name, String path, List<FileTreeNode> children) {
        this.kind = kind;
        this.name = name;
        this.path = path;
        this.children = children;
    }

    public static FileTreeNode file(String name, String path) {
        return new FileTreeNode(NodeKind.FILE, name, path, null);
    }

    public static FileTreeNode directory(String name, String path) {
        return new FileTreeNode(NodeKind.DIRECTORY, name, path, new ArrayList<>());
    }

    @JsonIgnore
    public boolean isDirectory() {
        return kind == NodeKind.DIRECTORY;
    }

    public List<FileTreeNode> getChildren() {
        return children == null ? null : Collections.unmodifiableList(children);
    }

    public void addChild(FileTreeNode child) {
        if (!isDirectory()) {
            throw new IllegalStateException("Cannot add children to file node " + path);
        }
        children.add(child);
    }

    /**
     * All file paths below this node, depth-first in traversal order.
     */
    public List<String> flattenFilePaths() {
        List<String> paths = new ArrayList<>();
        collect(this, paths);
        return paths;
    }

    private static void collect(FileTreeNode node, List<String> paths) {
        if (!node.isDirectory()) {
            paths.add(node.path);
            return;
        }
        for (FileTreeNode child : node.children) {
            collect(child, paths);
        }
    }
}
