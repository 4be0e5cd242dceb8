package com.purchasingpower.repoagent.service;

import com.purchasingpower.repoagent.exception.RepositoryNotLoadedException;
import com.purchasingpower.repoagent.model.LoadedRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Holder of the single active repository. Loading another repository replaces it;
 * concurrent loads are last-writer-wins.
 */
@Component
public class RepositorySession {

    private volatile LoadedRepository current;

    public Optional<LoadedRepository> current() {
        return Optional.ofNullable(current);
    }

    public LoadedRepository require() {
        LoadedRepository loaded = current;
        if (loaded == null) {
            throw new RepositoryNotLoadedException();
        }
        return loaded;
    }

    /**
     * @return the repository that was active before, if any
     */
    public Optional<LoadedRepository> replace(LoadedRepository loaded) {
        LoadedRepository previous = current;
        current = loaded;
        return Optional.ofNullable(previous);
    }
}
