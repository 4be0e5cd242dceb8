package com.purchasingpower.repoagent.store;

import com.purchasingpower.repoagent.model.CloneProgress;
import com.purchasingpower.repoagent.model.EntryStat;
import com.purchasingpower.repoagent.model.RemoteRepository;
import com.purchasingpower.repoagent.model.RepositoryLocator;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Consumer;

/**
 * Isolated, in-process filesystem namespaces holding cloned repositories.
 *
 * <p>Namespaces are keyed by {@code owner/name}. Paths passed to the primitives
 * are relative to the repository root; leading slashes are ignored.
 */
public interface RepositoryStore {

    /**
     * Shallow, single-branch clone of {@code url} into the namespace of its owner/name.
     * Re-cloning an existing namespace replaces it.
     *
     * @param url        repository URL ({@code host/owner/name})
     * @param onProgress receives non-decreasing percentages; 100 only after analysis completes
     * @return the cloned repository with metadata and file statistics
     * @throws com.purchasingpower.repoagent.exception.InvalidReferenceException for malformed URLs (signalled)
     * @throws com.purchasingpower.repoagent.exception.CloneException on transport or storage failure (signalled)
     */
    Mono<RemoteRepository> cloneRepository(String url, Consumer<CloneProgress> onProgress);

    /**
     * Clone of an already parsed locator; {@link RepositoryLocator#cloneUrl()} may use any
     * transport git understands.
     */
    Mono<RemoteRepository> cloneRepository(RepositoryLocator locator, Consumer<CloneProgress> onProgress);

    /**
     * Entries directly below {@code path} in repository order.
     *
     * @throws com.purchasingpower.repoagent.exception.NotFoundException if the directory does not exist
     */
    List<EntryStat> listDirectory(String namespace, String path);

    /**
     * @throws com.purchasingpower.repoagent.exception.NotFoundException if nothing exists at {@code path}
     */
    EntryStat stat(String namespace, String path);

    /**
     * UTF-8 content of a file.
     *
     * @throws com.purchasingpower.repoagent.exception.NotFoundException if there is no file at {@code path}
     * @throws com.purchasingpower.repoagent.exception.RepositoryIoException on any other read failure
     */
    String readFile(String namespace, String path);

    boolean contains(String namespace);

    void evict(String namespace);
}
