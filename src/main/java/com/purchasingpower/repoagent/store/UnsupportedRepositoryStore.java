package com.purchasingpower.repoagent.store;

import com.purchasingpower.repoagent.model.CloneProgress;
import com.purchasingpower.repoagent.model.EntryStat;
import com.purchasingpower.repoagent.model.RemoteRepository;
import com.purchasingpower.repoagent.model.RepositoryLocator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Consumer;

/**
 * Store for headless deployments built without the virtual filesystem.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.repository", name = "virtual-fs-enabled", havingValue = "false")
public class UnsupportedRepositoryStore implements RepositoryStore {

    private static final String MESSAGE = "Repository cloning is not available in this deployment (virtual filesystem disabled)";

    public UnsupportedRepositoryStore() {
        log.info("Virtual filesystem disabled; repository operations are unsupported");
    }

    @Override
    public Mono<RemoteRepository> cloneRepository(String url, Consumer<CloneProgress> onProgress) {
        return Mono.error(new UnsupportedOperationException(MESSAGE));
    }

    @Override
    public Mono<RemoteRepository> cloneRepository(RepositoryLocator locator, Consumer<CloneProgress> onProgress) {
        return Mono.error(new UnsupportedOperationException(MESSAGE));
    }

    @Override
    public List<EntryStat> listDirectory(String namespace, String path) {
        throw new UnsupportedOperationException(MESSAGE);
    }

    @Override
    public EntryStat stat(String namespace, String path) {
        throw new UnsupportedOperationException(MESSAGE);
    }

    @Override
    public String readFile(String namespace, String path) {
        throw new UnsupportedOperationException(MESSAGE);
    }

    @Override
    public boolean contains(String namespace) {
        return false;
    }

    @Override
    public void evict(String namespace) {
        // nothing is ever stored
    }
}
