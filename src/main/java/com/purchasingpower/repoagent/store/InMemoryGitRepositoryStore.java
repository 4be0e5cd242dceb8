package com.purchasingpower.repoagent.store;

import com.purchasingpower.repoagent.client.RepositoryMetadataClient;
import com.purchasingpower.repoagent.configuration.AppProperties;
import com.purchasingpower.repoagent.configuration.RepositoryProperties;
import com.purchasingpower.repoagent.exception.CloneException;
import com.purchasingpower.repoagent.exception.NotFoundException;
import com.purchasingpower.repoagent.exception.RepositoryIoException;
import com.purchasingpower.repoagent.model.CallContext;
import com.purchasingpower.repoagent.model.CloneProgress;
import com.purchasingpower.repoagent.model.EntryStat;
import com.purchasingpower.repoagent.model.RemoteRepository;
import com.purchasingpower.repoagent.model.RepositoryLocator;
import com.purchasingpower.repoagent.model.RepositoryMetadata;
import com.purchasingpower.repoagent.model.RepositoryStats;
import com.purchasingpower.repoagent.model.ServiceType;
import com.purchasingpower.repoagent.util.ExternalCallLogger;
import com.purchasingpower.repoagent.util.FileNames;
import com.purchasingpower.repoagent.util.RepositoryUrlParser;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.FetchCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.LsRemoteCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.errors.MissingObjectException;
import org.eclipse.jgit.internal.storage.dfs.DfsRepositoryDescription;
import org.eclipse.jgit.internal.storage.dfs.InMemoryRepository;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Virtual filesystem backed by JGit's in-memory DFS repositories.
 *
 * <p>Each namespace holds one object database and the root tree of the fetched
 * branch head. Nothing is written to local disk.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.repository", name = "virtual-fs-enabled", havingValue = "true", matchIfMissing = true)
public class InMemoryGitRepositoryStore implements RepositoryStore {

    private static final List<String> PREFERRED_BRANCHES = List.of("main", "master");

    private final RepositoryUrlParser urlParser;
    private final RepositoryMetadataClient metadataClient;
    private final RepositoryProperties properties;

    private final Map<String, Namespace> namespaces = new ConcurrentHashMap<>();

    public InMemoryGitRepositoryStore(RepositoryUrlParser urlParser,
                                      RepositoryMetadataClient metadataClient,
                                      AppProperties appProperties) {
        this.urlParser = urlParser;
        this.metadataClient = metadataClient;
        this.properties = appProperties.getRepository();
    }

    @Override
    public Mono<RemoteRepository> cloneRepository(String url, Consumer<CloneProgress> onProgress) {
        return Mono.defer(() -> cloneRepository(urlParser.parse(url), onProgress));
    }

    @Override
    public Mono<RemoteRepository> cloneRepository(RepositoryLocator locator, Consumer<CloneProgress> onProgress) {
        return Mono.defer(() -> {
            CloneProgressMonitor monitor = new CloneProgressMonitor(onProgress);
            monitor.report("Resolving " + locator.namespace(), 0);

            return Mono.fromCallable(() -> fetch(locator, monitor))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(namespace -> {
                        monitor.report("Fetching metadata", 85);
                        return metadataClient.fetch(locator.owner(), locator.name())
                                .map(metadata -> analyze(locator, namespace, metadata, monitor));
                    });
        });
    }

    private Namespace fetch(RepositoryLocator locator, CloneProgressMonitor monitor) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GIT, "Clone", log);
        ctx.logRequest("Cloning " + locator.cloneUrl(), "depth", properties.getCloneDepth());

        InMemoryRepository repository = new InMemoryRepository(new DfsRepositoryDescription(locator.namespace()));
        try {
            String branch = resolveBranch(locator.cloneUrl());
            fetchBranch(repository, locator.cloneUrl(), branch, monitor);

            ObjectId head = repository.resolve(Constants.R_HEADS + branch);
            if (head == null) {
                throw new IOException("Branch " + branch + " was not fetched");
            }
            ObjectId tree;
            try (RevWalk revWalk = new RevWalk(repository)) {
                RevCommit commit = revWalk.parseCommit(head);
                tree = commit.getTree().getId();
            }

            Namespace namespace = new Namespace(repository, tree, branch);
            Namespace previous = namespaces.put(locator.namespace(), namespace);
            if (previous != null) {
                log.info("Replaced existing namespace {}", locator.namespace());
                previous.repository().close();
            }
            ctx.logResponse("Cloned " + locator.namespace() + " @ " + branch, "head", head.abbreviate(8).name());
            return namespace;

        } catch (GitAPIException | IOException | RuntimeException e) {
            ctx.logError("Clone failed for " + locator.cloneUrl(), e);
            repository.close();
            throw new CloneException(locator.cloneUrl(), e);
        }
    }

    private void fetchBranch(InMemoryRepository repository, String url, String branch,
                             CloneProgressMonitor monitor) throws GitAPIException {
        RefSpec refSpec = new RefSpec("+" + Constants.R_HEADS + branch + ":" + Constants.R_HEADS + branch);
        try (Git git = new Git(repository)) {
            FetchCommand fetch = git.fetch()
                    .setRemote(url)
                    .setRefSpecs(refSpec)
                    .setProgressMonitor(monitor);
            credentials().ifPresent(fetch::setCredentialsProvider);
            if (properties.getCloneDepth() > 0) {
                fetch.setDepth(properties.getCloneDepth());
            }
            fetch.call();
        }
    }

    /**
     * Configured branch, otherwise the branch the remote HEAD points at.
     */
    private String resolveBranch(String url) throws GitAPIException {
        if (properties.getBranch() != null && !properties.getBranch().isBlank()) {
            return properties.getBranch();
        }

        LsRemoteCommand lsRemote = Git.lsRemoteRepository().setRemote(url);
        credentials().ifPresent(lsRemote::setCredentialsProvider);
        Map<String, Ref> refs = lsRemote.callAsMap();

        Ref head = refs.get(Constants.HEAD);
        if (head != null && head.isSymbolic()) {
            return branchName(head.getTarget().getName());
        }
        if (head != null && head.getObjectId() != null) {
            for (Ref ref : refs.values()) {
                if (ref.getName().startsWith(Constants.R_HEADS) && head.getObjectId().equals(ref.getObjectId())) {
                    return branchName(ref.getName());
                }
            }
        }
        for (String preferred : PREFERRED_BRANCHES) {
            if (refs.containsKey(Constants.R_HEADS + preferred)) {
                return preferred;
            }
        }
        return refs.keySet().stream()
                .filter(name -> name.startsWith(Constants.R_HEADS))
                .findFirst()
                .map(InMemoryGitRepositoryStore::branchName)
                .orElseThrow(() -> new IllegalStateException("Remote has no branches"));
    }

    private static String branchName(String refName) {
        return refName.startsWith(Constants.R_HEADS) ? refName.substring(Constants.R_HEADS.length()) : refName;
    }

    private Optional<CredentialsProvider> credentials() {
        if (properties.getUsername() == null || properties.getUsername().isBlank()) {
            return Optional.empty();
        }
        String password = properties.getPassword() == null ? "" : properties.getPassword();
        return Optional.of(new UsernamePasswordCredentialsProvider(properties.getUsername(), password));
    }

    private RemoteRepository analyze(RepositoryLocator locator, Namespace namespace,
                                     RepositoryMetadata metadata, CloneProgressMonitor monitor) {
        monitor.report("Analyzing repository", 90);
        List<String> files = new ArrayList<>();
        try (TreeWalk walk = new TreeWalk(namespace.repository())) {
            walk.addTree(namespace.tree());
            walk.setRecursive(true);
            while (walk.next()) {
                files.add(walk.getPathString());
            }
        } catch (IOException e) {
            throw new CloneException(locator.cloneUrl(), e);
        }
        RepositoryStats stats = RepositoryStats.of(files);
        log.info("Analyzed {}: {} files, {} file types", locator.namespace(), stats.fileCount(), stats.fileTypes().size());

        RemoteRepository repository = RemoteRepository.builder()
                .owner(locator.owner())
                .name(locator.name())
                .url(locator.cloneUrl())
                .description(metadata.description())
                .starCount(metadata.starCount())
                .forkCount(metadata.forkCount())
                .cloned(true)
                .fileCount(stats.fileCount())
                .fileTypes(stats.fileTypes())
                .build();
        monitor.complete();
        return repository;
    }

    @Override
    public List<EntryStat> listDirectory(String namespace, String path) {
        Namespace ns = require(namespace, path);
        String dir = FileNames.normalize(path);
        try (TreeWalk walk = new TreeWalk(ns.repository())) {
            if (dir.isEmpty()) {
                walk.addTree(ns.tree());
            } else {
                try (TreeWalk lookup = TreeWalk.forPath(ns.repository(), dir, ns.tree())) {
                    if (lookup == null || lookup.getFileMode(0).getObjectType() != Constants.OBJ_TREE) {
                        throw new NotFoundException(namespace, dir);
                    }
                    walk.addTree(lookup.getObjectId(0));
                }
            }
            walk.setRecursive(false);

            List<EntryStat> entries = new ArrayList<>();
            ObjectReader reader = walk.getObjectReader();
            while (walk.next()) {
                String childPath = dir.isEmpty() ? walk.getNameString() : dir + "/" + walk.getNameString();
                entries.add(toStat(reader, childPath, walk.getFileMode(0), walk.getObjectId(0)));
            }
            return entries;
        } catch (IOException e) {
            throw new RepositoryIoException("Failed to list /" + namespace + "/" + dir + ": " + e.getMessage(), e);
        }
    }

    @Override
    public EntryStat stat(String namespace, String path) {
        Namespace ns = require(namespace, path);
        String target = FileNames.normalize(path);
        if (target.isEmpty()) {
            return new EntryStat("", true, 0);
        }
        try (TreeWalk walk = TreeWalk.forPath(ns.repository(), target, ns.tree())) {
            if (walk == null) {
                throw new NotFoundException(namespace, target);
            }
            return toStat(walk.getObjectReader(), target, walk.getFileMode(0), walk.getObjectId(0));
        } catch (IOException e) {
            throw new RepositoryIoException("Failed to stat /" + namespace + "/" + target + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String readFile(String namespace, String path) {
        Namespace ns = require(namespace, path);
        String target = FileNames.normalize(path);
        if (target.isEmpty()) {
            // the root is a directory
            throw new NotFoundException(namespace, target);
        }
        try (TreeWalk walk = TreeWalk.forPath(ns.repository(), target, ns.tree())) {
            if (walk == null || walk.getFileMode(0).getObjectType() != Constants.OBJ_BLOB) {
                throw new NotFoundException(namespace, target);
            }
            byte[] bytes = ns.repository().open(walk.getObjectId(0), Constants.OBJ_BLOB).getBytes();
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (MissingObjectException e) {
            throw new RepositoryIoException("Object missing for /" + namespace + "/" + target, e);
        } catch (IOException e) {
            throw new RepositoryIoException("Failed to read /" + namespace + "/" + target + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean contains(String namespace) {
        return namespaces.containsKey(namespace);
    }

    @Override
    public void evict(String namespace) {
        Namespace removed = namespaces.remove(namespace);
        if (removed != null) {
            removed.repository().close();
            log.info("Evicted namespace {}", namespace);
        }
    }

    private Namespace require(String namespace, String path) {
        Namespace ns = namespaces.get(namespace);
        if (ns == null) {
            throw new NotFoundException(namespace, FileNames.normalize(path));
        }
        return ns;
    }

    private EntryStat toStat(ObjectReader reader, String path, FileMode mode, ObjectId id)
            throws IOException {
        if (mode.getObjectType() == Constants.OBJ_TREE) {
            return new EntryStat(path, true, 0);
        }
        if (mode.getObjectType() == Constants.OBJ_COMMIT) {
            // submodule commit, no blob in this repository
            return new EntryStat(path, false, 0);
        }
        return new EntryStat(path, false, reader.getObjectSize(id, Constants.OBJ_BLOB));
    }

    private record Namespace(InMemoryRepository repository, ObjectId tree, String branch) {
    }
}
