package com.purchasingpower.repoagent.index;

import com.purchasingpower.repoagent.exception.RepositoryIoException;
import com.purchasingpower.repoagent.model.EntryStat;
import com.purchasingpower.repoagent.model.FileTreeNode;
import com.purchasingpower.repoagent.store.RepositoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("File Tree Indexer Tests")
class FileTreeIndexerTest {

    private static final String NS = "alice/demo";

    private RepositoryStore store;
    private FileTreeIndexer indexer;

    @BeforeEach
    void setUp() {
        store = mock(RepositoryStore.class);
        indexer = new FileTreeIndexer(store);
    }

    @Test
    @DisplayName("Should mirror the store layout in traversal order")
    void testIndex_ShouldBuildTree() {
        // Given
        when(store.listDirectory(NS, "")).thenReturn(List.of(
                new EntryStat("README.md", false, 10),
                new EntryStat("src", true, 0),
                new EntryStat(".git", true, 0)));
        when(store.listDirectory(NS, "src")).thenReturn(List.of(
                new EntryStat("src/main.py", false, 20),
                new EntryStat("src/lib", true, 0)));
        when(store.listDirectory(NS, "src/lib")).thenReturn(List.of(
                new EntryStat("src/lib/util.py", false, 5)));

        // When
        FileTreeIndexer.Result result = indexer.index(NS, "demo");

        // Then
        FileTreeNode root = result.tree();
        assertEquals("demo", root.getName());
        assertEquals("", root.getPath());
        assertEquals(List.of("README.md", "src/main.py", "src/lib/util.py"), root.flattenFilePaths());
        assertEquals(2, root.getChildren().size(), ".git must be skipped");
        assertEquals(3, result.stats().fileCount());
        assertEquals(2, result.stats().fileTypes().get("py"));
        verify(store, never()).listDirectory(NS, ".git");
    }

    @Test
    @DisplayName("Should skip a directory that fails to list and keep the rest")
    void testIndex_ShouldSkipUnreadableDirectory() {
        when(store.listDirectory(NS, "")).thenReturn(List.of(
                new EntryStat("broken", true, 0),
                new EntryStat("ok.txt", false, 1)));
        when(store.listDirectory(NS, "broken"))
                .thenThrow(new RepositoryIoException("corrupt tree", new IOException("bad object")));

        FileTreeIndexer.Result result = indexer.index(NS, "demo");

        assertEquals(List.of("ok.txt"), result.tree().flattenFilePaths());
        assertTrue(result.tree().getChildren().get(0).isDirectory());
        assertTrue(result.tree().getChildren().get(0).getChildren().isEmpty());
    }
}
