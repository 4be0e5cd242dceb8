package com.purchasingpower.repoagent.context;

import com.purchasingpower.repoagent.exception.NotFoundException;
import com.purchasingpower.repoagent.model.ContextBudget;
import com.purchasingpower.repoagent.model.FileTreeNode;
import com.purchasingpower.repoagent.model.RemoteRepository;
import com.purchasingpower.repoagent.store.RepositoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Context Assembler Tests")
class ContextAssemblerTest {

    private RepositoryStore store;
    private ContextAssembler assembler;

    @BeforeEach
    void setUp() {
        store = mock(RepositoryStore.class);
        assembler = new ContextAssembler(store);
    }

    @Test
    @DisplayName("Should render summary, tree and truncated file bodies")
    void testAssemble_ShouldRenderAllSections() {
        // Given
        RemoteRepository repository = repository("");
        FileTreeNode root = FileTreeNode.directory("demo", "");
        root.addChild(FileTreeNode.file("main.py", "main.py"));
        Map<String, String> contents = new LinkedHashMap<>();
        contents.put("main.py", "x".repeat(50));
        ContextBudget budget = new ContextBudget(10, 20, 10);

        // When
        String context = assembler.assemble(repository, root, contents, budget);

        // Then
        assertThat(context).startsWith("Repository Information:\n");
        assertThat(context).contains("- Name: demo", "- Owner: alice", "- Description: No description provided");
        assertThat(context).contains("- Files: 3 files", "- Main file types: py (2), md (1)");
        assertThat(context).contains("File Structure:\n📁 demo/\n  📄 main.py\n");
        assertThat(context).contains("Important Files:\n", "\n--- main.py ---\n" + "x".repeat(20) + "... [truncated]");
        assertThat(context).doesNotContain("x".repeat(21));
    }

    @Test
    @DisplayName("Should keep short content untouched")
    void testTruncate_ShouldLeaveShortContent() {
        assertThat(ContextAssembler.truncate("short", 10)).isEqualTo("short");
        assertThat(ContextAssembler.truncate("0123456789AB", 10))
                .isEqualTo("0123456789" + ContextAssembler.TRUNCATION_MARKER);
    }

    @Test
    @DisplayName("Should not split a surrogate pair at the cut")
    void testTruncate_ShouldKeepSurrogatePairsWhole() {
        // "ab" followed by U+1F600, which takes two chars
        String content = "ab\uD83D\uDE00cd";

        String truncated = ContextAssembler.truncate(content, 3);

        assertThat(truncated).isEqualTo("ab" + ContextAssembler.TRUNCATION_MARKER);
        assertThat(ContextAssembler.truncate(content, 4)).isEqualTo("ab\uD83D\uDE00" + ContextAssembler.TRUNCATION_MARKER);
    }

    @Test
    @DisplayName("Should order names case-insensitively within a level")
    void testRenderTree_ShouldIgnoreCaseWhenSorting() {
        FileTreeNode root = FileTreeNode.directory("repo", "");
        root.addChild(FileTreeNode.file("Zeta.md", "Zeta.md"));
        root.addChild(FileTreeNode.file("alpha.md", "alpha.md"));
        root.addChild(FileTreeNode.file("Beta.md", "Beta.md"));

        String tree = assembler.renderTree(root, new ContextBudget(10, 100, 10));

        assertThat(tree).isEqualTo("📁 repo/\n"
                + "  📄 alpha.md\n"
                + "  📄 Beta.md\n"
                + "  📄 Zeta.md\n");
    }

    @Test
    @DisplayName("Should list directories first and collapse long levels")
    void testRenderTree_ShouldSortAndCap() {
        // Given
        FileTreeNode root = FileTreeNode.directory("repo", "");
        root.addChild(FileTreeNode.file("b.txt", "b.txt"));
        root.addChild(FileTreeNode.file("a.txt", "a.txt"));
        FileTreeNode src = FileTreeNode.directory("src", "src");
        src.addChild(FileTreeNode.file("app.py", "src/app.py"));
        root.addChild(src);
        root.addChild(FileTreeNode.file("c.txt", "c.txt"));

        // When
        String tree = assembler.renderTree(root, new ContextBudget(10, 100, 2));

        // Then
        assertThat(tree).isEqualTo("📁 repo/\n"
                + "  📁 src/\n"
                + "    📄 app.py\n"
                + "  📄 a.txt\n"
                + "  ... and 2 more items\n");
    }

    @Test
    @DisplayName("Should skip files the store cannot read")
    void testLoadContents_ShouldSkipUnreadable() {
        when(store.readFile("alice/demo", "a.py")).thenReturn("print(1)");
        when(store.readFile("alice/demo", "gone.py")).thenThrow(new NotFoundException("alice/demo", "gone.py"));

        Map<String, String> contents = assembler.loadContents("alice/demo", List.of("a.py", "gone.py"));

        assertThat(contents).containsOnlyKeys("a.py");
    }

    @Test
    void testDescribeFileTypes_ShouldReportNoneForEmpty() {
        assertThat(assembler.describeFileTypes(Map.of())).isEqualTo("none");
        assertThat(assembler.summarize(repository("A demo"))).contains("- Description: A demo");
    }

    private static RemoteRepository repository(String description) {
        Map<String, Integer> types = new LinkedHashMap<>();
        types.put("md", 1);
        types.put("py", 2);
        return RemoteRepository.builder()
                .owner("alice")
                .name("demo")
                .url("https://github.com/alice/demo")
                .description(description)
                .cloned(true)
                .fileCount(3)
                .fileTypes(types)
                .build();
    }
}
