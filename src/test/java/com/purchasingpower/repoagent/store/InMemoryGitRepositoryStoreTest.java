package com.purchasingpower.repoagent.store;

import com.purchasingpower.repoagent.client.RepositoryMetadataClient;
import com.purchasingpower.repoagent.configuration.AppProperties;
import com.purchasingpower.repoagent.exception.CloneException;
import com.purchasingpower.repoagent.exception.InvalidReferenceException;
import com.purchasingpower.repoagent.exception.NotFoundException;
import com.purchasingpower.repoagent.model.CloneProgress;
import com.purchasingpower.repoagent.model.EntryStat;
import com.purchasingpower.repoagent.model.RemoteRepository;
import com.purchasingpower.repoagent.model.RepositoryLocator;
import com.purchasingpower.repoagent.model.RepositoryMetadata;
import com.purchasingpower.repoagent.util.RepositoryUrlParser;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Clones a throwaway repository created on local disk, so no network is involved.
 */
@DisplayName("In-Memory Git Repository Store Tests")
class InMemoryGitRepositoryStoreTest {

    @TempDir
    Path tempDir;

    private RepositoryMetadataClient metadataClient;
    private InMemoryGitRepositoryStore store;
    private RepositoryLocator locator;

    @BeforeEach
    void setUp() throws Exception {
        Path origin = tempDir.resolve("origin");
        Files.createDirectories(origin.resolve("src/util"));
        Files.writeString(origin.resolve("README.md"), "# Demo\n", StandardCharsets.UTF_8);
        Files.writeString(origin.resolve("src/app.py"), "print('hello')\n", StandardCharsets.UTF_8);
        Files.writeString(origin.resolve("src/util/helpers.py"), "def helper():\n    return 1\n", StandardCharsets.UTF_8);

        try (Git git = Git.init().setDirectory(origin.toFile()).setInitialBranch("main").call()) {
            git.add().addFilepattern(".").call();
            git.commit()
                    .setMessage("Initial commit")
                    .setAuthor("Test", "test@example.com")
                    .setCommitter("Test", "test@example.com")
                    .setSign(false)
                    .call();
        }

        AppProperties appProperties = new AppProperties();
        appProperties.getRepository().setCloneDepth(0);
        metadataClient = mock(RepositoryMetadataClient.class);
        when(metadataClient.fetch(anyString(), anyString()))
                .thenReturn(Mono.just(new RepositoryMetadata("Local demo", 5, 1)));

        store = new InMemoryGitRepositoryStore(new RepositoryUrlParser(), metadataClient, appProperties);
        locator = new RepositoryLocator("local", "alice", "demo", origin.toAbsolutePath().toString());
    }

    @Test
    @DisplayName("Should clone, analyze and report monotone progress ending at 100")
    void testCloneRepository_ShouldPopulateNamespace() {
        // Given
        List<CloneProgress> progress = new CopyOnWriteArrayList<>();

        // When
        RemoteRepository repository = store.cloneRepository(locator, progress::add).block();

        // Then
        assertThat(repository.isCloned()).isTrue();
        assertThat(repository.namespace()).isEqualTo("alice/demo");
        assertThat(repository.getDescription()).isEqualTo("Local demo");
        assertThat(repository.getStarCount()).isEqualTo(5);
        assertThat(repository.getFileCount()).isEqualTo(3);
        assertThat(repository.getFileTypes()).containsEntry("py", 2).containsEntry("md", 1);
        assertThat(store.contains("alice/demo")).isTrue();

        List<Integer> percents = progress.stream().map(CloneProgress::percent).toList();
        assertThat(percents).isSortedAccordingTo(Integer::compare);
        assertThat(percents).last().isEqualTo(100);
        assertThat(percents.stream().filter(p -> p == 100).count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should list, stat and read the cloned tree")
    void testReadOperations_ShouldServeClonedContent() {
        store.cloneRepository(locator, p -> { }).block();

        List<EntryStat> root = store.listDirectory("alice/demo", "");
        assertThat(root).extracting(EntryStat::path).containsExactlyInAnyOrder("README.md", "src");
        assertThat(root).filteredOn(EntryStat::directory).extracting(EntryStat::path).containsExactly("src");

        assertThat(store.listDirectory("alice/demo", "/src/")).extracting(EntryStat::path)
                .containsExactlyInAnyOrder("src/app.py", "src/util");

        EntryStat app = store.stat("alice/demo", "src/app.py");
        assertThat(app.directory()).isFalse();
        assertThat(app.size()).isEqualTo("print('hello')\n".length());

        assertThat(store.readFile("alice/demo", "/src/util/helpers.py")).isEqualTo("def helper():\n    return 1\n");
    }

    @Test
    @DisplayName("Should raise NotFound for missing paths, directories and namespaces")
    void testReadFile_ShouldRaiseNotFound() {
        store.cloneRepository(locator, p -> { }).block();

        assertThatThrownBy(() -> store.readFile("alice/demo", "nope.txt")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.readFile("alice/demo", "src")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.readFile("alice/demo", "/")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.readFile("alice/demo", "")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.listDirectory("alice/demo", "README.md")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.stat("alice/demo", "src/missing.py")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.readFile("bob/other", "README.md")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Should fetch only the branch head with the default clone depth")
    void testCloneRepository_ShouldCloneShallowByDefault() throws Exception {
        // Given: a second commit on top of the initial one
        Path origin = tempDir.resolve("origin");
        Files.writeString(origin.resolve("src/app.py"), "print('second')\n", StandardCharsets.UTF_8);
        try (Git git = Git.open(origin.toFile())) {
            git.add().addFilepattern(".").call();
            git.commit()
                    .setMessage("Second commit")
                    .setAuthor("Test", "test@example.com")
                    .setCommitter("Test", "test@example.com")
                    .setSign(false)
                    .call();
        }
        AppProperties defaults = new AppProperties();
        assertThat(defaults.getRepository().getCloneDepth()).isEqualTo(1);
        InMemoryGitRepositoryStore shallowStore =
                new InMemoryGitRepositoryStore(new RepositoryUrlParser(), metadataClient, defaults);

        // When
        RemoteRepository repository = shallowStore.cloneRepository(locator, p -> { }).block();

        // Then
        assertThat(repository.getFileCount()).isEqualTo(3);
        assertThat(shallowStore.readFile("alice/demo", "src/app.py")).isEqualTo("print('second')\n");
    }

    @Test
    @DisplayName("Should replace the namespace when cloned again")
    void testCloneRepository_ShouldBeRepeatable() {
        RemoteRepository first = store.cloneRepository(locator, p -> { }).block();
        RemoteRepository second = store.cloneRepository(locator, p -> { }).block();

        assertThat(second.getFileCount()).isEqualTo(first.getFileCount());
        assertThat(store.readFile("alice/demo", "README.md")).isEqualTo("# Demo\n");

        store.evict("alice/demo");
        assertThat(store.contains("alice/demo")).isFalse();
    }

    @Test
    @DisplayName("Should wrap transport failures in CloneException")
    void testCloneRepository_ShouldFailForMissingRemote() {
        RepositoryLocator missing = new RepositoryLocator("local", "alice", "gone",
                tempDir.resolve("does-not-exist").toAbsolutePath().toString());

        assertThatThrownBy(() -> store.cloneRepository(missing, p -> { }).block())
                .isInstanceOf(CloneException.class);
        assertThat(store.contains("alice/gone")).isFalse();
        verifyNoInteractions(metadataClient);
    }

    @Test
    void testCloneRepository_ShouldRejectInvalidUrlBeforeNetwork() {
        assertThatThrownBy(() -> store.cloneRepository("not a url", p -> { }).block())
                .isInstanceOf(InvalidReferenceException.class);
    }
}
