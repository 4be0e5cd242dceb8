package com.purchasingpower.repoagent.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.repoagent.model.CallContext;
import com.purchasingpower.repoagent.model.RepositoryMetadata;
import com.purchasingpower.repoagent.model.ServiceType;
import com.purchasingpower.repoagent.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Reads description, star and fork counts from the GitHub REST API.
 *
 * <p>Metadata is decorative: any failure (404, rate limit, network) degrades to
 * {@link RepositoryMetadata#unavailable()} and never fails a clone.
 */
@Slf4j
@Component
public class RepositoryMetadataClient {

    private final WebClient webClient;

    public RepositoryMetadataClient(@Qualifier("githubWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    public Mono<RepositoryMetadata> fetch(String owner, String name) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GITHUB_API, "GetRepository", log);
        ctx.logRequest("GET /repos/" + owner + "/" + name);

        return webClient.get()
                .uri("/repos/{owner}/{name}", owner, name)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::toMetadata)
                .doOnNext(meta -> ctx.logResponse("stars=" + meta.starCount() + ", forks=" + meta.forkCount()))
                .onErrorResume(e -> {
                    ctx.logError("Metadata unavailable for " + owner + "/" + name + ": " + e.getMessage(), e);
                    return Mono.just(RepositoryMetadata.unavailable());
                })
                .defaultIfEmpty(RepositoryMetadata.unavailable());
    }

    private RepositoryMetadata toMetadata(JsonNode node) {
        JsonNode description = node.path("description");
        return new RepositoryMetadata(
                description.isTextual() ? description.asText() : "",
                node.path("stargazers_count").asInt(0),
                node.path("forks_count").asInt(0));
    }
}
