package com.purchasingpower.repoagent.service;

import com.purchasingpower.repoagent.model.AgentResponse;
import com.purchasingpower.repoagent.model.CloneProgress;
import com.purchasingpower.repoagent.model.ConnectivityStatus;
import com.purchasingpower.repoagent.model.FileModification;
import com.purchasingpower.repoagent.model.FileTreeNode;
import com.purchasingpower.repoagent.model.GeneratedCodeWithTests;
import com.purchasingpower.repoagent.model.RemoteRepository;
import com.purchasingpower.repoagent.model.TaskType;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Caller-facing operations of the engine.
 *
 * <p>Every workflow except {@link #generate} and {@link #generateStream} needs a loaded
 * repository and signals {@link com.purchasingpower.repoagent.exception.RepositoryNotLoadedException}
 * otherwise. Workflows only propose changes; nothing is written back to the repository.
 * A {@code null} model means the configured default.
 */
public interface RepositoryAgentService {

    // ---------------------------------------------------------------- repository

    /**
     * Clone, analyze and index {@code url}, replacing the active repository.
     */
    Mono<RemoteRepository> loadRepository(String url, Consumer<CloneProgress> onProgress);

    Optional<RemoteRepository> getRepository();

    FileTreeNode getTree();

    Mono<String> getFile(String path);

    // ---------------------------------------------------------------- provider

    Mono<ConnectivityStatus> checkConnectivity(boolean force);

    Mono<List<String>> availableModels();

    Mono<String> bestAvailableModel(String preferred, TaskType taskType);

    String recommendModel(String category);

    // ---------------------------------------------------------------- workflows

    /**
     * Answer a question about the repository, or about one file when {@code filePath} is set.
     */
    Mono<String> analyze(String prompt, String filePath, String model);

    Mono<String> generate(String prompt, String language, String model);

    /**
     * Streamed {@link #generate}. {@code onChunk} sees deltas in order; {@code onComplete}
     * runs once with the full text on success.
     */
    Mono<String> generateStream(String prompt, String language, String model,
                                Consumer<String> onChunk, Consumer<String> onComplete);

    /**
     * Full replacement body for an existing file.
     */
    Mono<FileModification> edit(String filePath, String instruction, String model);

    /**
     * Content for a new file at {@code directory/fileName}; {@code originalContent} is always null.
     */
    Mono<FileModification> create(String directory, String fileName, String description, String model);

    /**
     * Plan, then implement. Proposed files that already exist carry their current content.
     */
    Mono<AgentResponse> solve(String problem, String model);

    /**
     * Find relevant files from the tree, read them, plan and implement.
     */
    Mono<AgentResponse> autonomousModify(String task, String model);

    /**
     * Paths likely to hold the described functionality, judged from the tree only.
     */
    Mono<List<String>> search(String description, String model);

    Mono<GeneratedCodeWithTests> generateWithTests(String specification, String language, String model);
}
