package com.purchasingpower.repoagent.client;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.purchasingpower.repoagent.model.RepositoryMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

@WireMockTest
@DisplayName("Repository Metadata Client Tests")
class RepositoryMetadataClientTest {

    private RepositoryMetadataClient client;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmInfo) {
        client = new RepositoryMetadataClient(WebClient.builder().baseUrl(wmInfo.getHttpBaseUrl()).build());
    }

    @Test
    @DisplayName("Should read description, stars and forks")
    void testFetch_ShouldReadMetadata() {
        // Given
        stubFor(get(urlPathEqualTo("/repos/alice/demo"))
                .willReturn(okJson("{\"description\":\"Demo project\",\"stargazers_count\":42,\"forks_count\":7}")));

        // When
        RepositoryMetadata metadata = client.fetch("alice", "demo").block();

        // Then
        assertEquals(new RepositoryMetadata("Demo project", 42, 7), metadata);
    }

    @Test
    @DisplayName("Should fall back to defaults when the repository is unknown")
    void testFetch_ShouldDegradeOnNotFound() {
        stubFor(get(urlPathEqualTo("/repos/alice/missing"))
                .willReturn(aResponse().withStatus(404).withBody("{\"message\":\"Not Found\"}")));

        assertEquals(RepositoryMetadata.unavailable(), client.fetch("alice", "missing").block());
    }

    @Test
    void testFetch_ShouldTreatNullDescriptionAsEmpty() {
        stubFor(get(urlPathEqualTo("/repos/alice/bare"))
                .willReturn(okJson("{\"description\":null,\"stargazers_count\":1}")));

        assertEquals(new RepositoryMetadata("", 1, 0), client.fetch("alice", "bare").block());
    }
}
