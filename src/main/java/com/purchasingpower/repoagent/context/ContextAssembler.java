package com.purchasingpower.repoagent.context;

import com.purchasingpower.repoagent.exception.EngineException;
import com.purchasingpower.repoagent.model.ContextBudget;
import com.purchasingpower.repoagent.model.FileTreeNode;
import com.purchasingpower.repoagent.model.RemoteRepository;
import com.purchasingpower.repoagent.store.RepositoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns repository metadata, the file tree and selected file bodies into the
 * plain-text context block sent along with a prompt.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextAssembler {

    static final String TRUNCATION_MARKER = "... [truncated]";
    static final String NO_DESCRIPTION = "No description provided";
    private static final int TOP_FILE_TYPES = 5;

    private static final Comparator<FileTreeNode> DIRECTORIES_FIRST = Comparator
            .comparing((FileTreeNode node) -> !node.isDirectory())
            .thenComparing(FileTreeNode::getName, String.CASE_INSENSITIVE_ORDER);

    private final RepositoryStore store;

    /**
     * @param fileContents path to content, rendered in iteration order
     */
    public String assemble(RemoteRepository repository, FileTreeNode tree,
                           Map<String, String> fileContents, ContextBudget budget) {
        StringBuilder context = new StringBuilder();
        context.append(summarize(repository)).append('\n');
        context.append("File Structure:\n");
        context.append(renderTree(tree, budget)).append('\n');
        context.append("Important Files:\n");
        fileContents.forEach((path, content) -> context
                .append("\n--- ").append(path).append(" ---\n")
                .append(truncate(content, budget.maxCharsPerFile()))
                .append('\n'));
        return context.toString();
    }

    public String summarize(RemoteRepository repository) {
        String description = repository.getDescription() == null || repository.getDescription().isBlank()
                ? NO_DESCRIPTION
                : repository.getDescription();
        return "Repository Information:\n"
                + "- Name: " + repository.getName() + "\n"
                + "- Owner: " + repository.getOwner() + "\n"
                + "- Description: " + description + "\n"
                + "- Files: " + repository.getFileCount() + " files\n"
                + "- Main file types: " + describeFileTypes(repository.getFileTypes()) + "\n";
    }

    /**
     * Indented listing, directories before files and alphabetical within each group.
     * Directories with more than {@code maxTreeEntriesPerLevel} children are collapsed
     * into a {@code ... and N more items} line.
     */
    public String renderTree(FileTreeNode root, ContextBudget budget) {
        StringBuilder out = new StringBuilder();
        render(root, 0, budget.maxTreeEntriesPerLevel(), out);
        return out.toString();
    }

    /**
     * Reads the given files through the store; unreadable ones are left out.
     */
    public Map<String, String> loadContents(String namespace, List<String> paths) {
        Map<String, String> contents = new LinkedHashMap<>();
        for (String path : paths) {
            try {
                contents.put(path, store.readFile(namespace, path));
            } catch (EngineException | UnsupportedOperationException e) {
                log.warn("Skipping {} in context: {}", path, e.getMessage());
            }
        }
        return contents;
    }

    /**
     * Cuts {@code content} to at most {@code maxChars} chars, never inside a surrogate pair.
     */
    public static String truncate(String content, int maxChars) {
        if (content.length() <= maxChars) {
            return content;
        }
        int end = maxChars;
        if (end > 0 && Character.isHighSurrogate(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(0, end) + TRUNCATION_MARKER;
    }

    private void render(FileTreeNode node, int depth, int maxEntries, StringBuilder out) {
        String indent = "  ".repeat(depth);
        if (!node.isDirectory()) {
            out.append(indent).append("📄 ").append(node.getName()).append('\n');
            return;
        }
        out.append(indent).append("📁 ").append(node.getName()).append("/\n");

        List<FileTreeNode> sorted = node.getChildren().stream().sorted(DIRECTORIES_FIRST).toList();
        sorted.stream().limit(maxEntries).forEach(child -> render(child, depth + 1, maxEntries, out));
        if (sorted.size() > maxEntries) {
            out.append(indent).append("  ... and ").append(sorted.size() - maxEntries).append(" more items\n");
        }
    }

    /**
     * The five most common extensions as {@code "py (12), md (2)"}.
     */
    public String describeFileTypes(Map<String, Integer> fileTypes) {
        if (fileTypes == null || fileTypes.isEmpty()) {
            return "none";
        }
        return fileTypes.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(TOP_FILE_TYPES)
                .map(e -> e.getKey() + " (" + e.getValue() + ")")
                .collect(Collectors.joining(", "));
    }
}
