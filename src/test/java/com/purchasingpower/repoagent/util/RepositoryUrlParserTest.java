package com.purchasingpower.repoagent.util;

import com.purchasingpower.repoagent.exception.InvalidReferenceException;
import com.purchasingpower.repoagent.model.RepositoryLocator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Repository URL Parser Tests")
class RepositoryUrlParserTest {

    private final RepositoryUrlParser parser = new RepositoryUrlParser();

    @ParameterizedTest
    @ValueSource(strings = {
            "https://github.com/user/repo",
            "https://github.com/user/repo.git",
            "https://github.com/user/repo/tree/branch-name",
            "github.com/user/repo",
            "  https://github.com/user/repo/  "
    })
    @DisplayName("Should extract owner and name from accepted URL shapes")
    void testParse_ShouldExtractOwnerAndName(String url) {
        // When
        RepositoryLocator locator = parser.parse(url);

        // Then
        assertEquals("github.com", locator.host());
        assertEquals("user", locator.owner());
        assertEquals("repo", locator.name());
        assertEquals("https://github.com/user/repo.git", locator.cloneUrl());
        assertEquals("user/repo", locator.namespace());
    }

    @Test
    @DisplayName("Should keep dots inside repository names")
    void testParse_ShouldKeepDottedNames() {
        RepositoryLocator locator = parser.parse("https://gitlab.example.com/team/my.lib.git");

        assertEquals("gitlab.example.com", locator.host());
        assertEquals("team", locator.owner());
        assertEquals("my.lib", locator.name());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not a url", "https://github.com/", "https://github.com/user", "github.com/../repo"})
    @DisplayName("Should reject URLs without host/owner/name")
    void testParse_ShouldRejectInvalidUrls(String url) {
        assertThrows(InvalidReferenceException.class, () -> parser.parse(url));
    }

    @Test
    @DisplayName("Should reject null URL")
    void testParse_ShouldRejectNull() {
        assertThrows(InvalidReferenceException.class, () -> parser.parse(null));
    }
}
