package com.purchasingpower.repoagent.api;

import com.purchasingpower.repoagent.exception.RepositoryNotLoadedException;
import com.purchasingpower.repoagent.model.FileTreeNode;
import com.purchasingpower.repoagent.model.RemoteRepository;
import com.purchasingpower.repoagent.service.RepositoryAgentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Loading the active repository and browsing it.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/repositories")
@RequiredArgsConstructor
public class RepositoryController {

    private final RepositoryAgentService agentService;

    /**
     * Clone and index a repository, replacing the active one.
     *
     * POST /api/v1/repositories
     */
    @PostMapping
    public RemoteRepository load(@Valid @RequestBody LoadRepositoryRequest request) {
        log.info("Loading repository {}", request.getUrl());
        return agentService.loadRepository(request.getUrl(),
                        progress -> log.info("Clone progress {}%: {}", progress.percent(), progress.phase()))
                .block();
    }

    @GetMapping("/current")
    public RemoteRepository current() {
        return agentService.getRepository().orElseThrow(RepositoryNotLoadedException::new);
    }

    @GetMapping("/current/tree")
    public FileTreeNode tree() {
        return agentService.getTree();
    }

    /**
     * GET /api/v1/repositories/current/files?path=src/app.py
     */
    @GetMapping("/current/files")
    public FileContentResponse file(@RequestParam String path) {
        return new FileContentResponse(path, agentService.getFile(path).block());
    }
}
