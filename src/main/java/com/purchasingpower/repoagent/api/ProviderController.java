package com.purchasingpower.repoagent.api;

import com.purchasingpower.repoagent.model.ConnectivityStatus;
import com.purchasingpower.repoagent.model.TaskType;
import com.purchasingpower.repoagent.service.RepositoryAgentService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Completion provider status and model selection.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ProviderController {

    private final RepositoryAgentService agentService;

    @GetMapping("/connectivity")
    public ConnectivityStatus connectivity(@RequestParam(defaultValue = "false") boolean force) {
        return agentService.checkConnectivity(force).block();
    }

    @GetMapping("/models")
    public ModelsResponse models() {
        return new ModelsResponse(agentService.availableModels().block());
    }

    /**
     * GET /api/v1/models/recommendation?category=data_analysis
     */
    @GetMapping("/models/recommendation")
    public ModelChoice recommendation(@RequestParam String category) {
        return new ModelChoice(agentService.recommendModel(category));
    }

    /**
     * GET /api/v1/models/best?preferred=anthropic/claude-3-opus&task=CODE
     */
    @GetMapping("/models/best")
    public ModelChoice best(@RequestParam(required = false) String preferred,
                            @RequestParam(defaultValue = "GENERAL") TaskType task) {
        return new ModelChoice(agentService.bestAvailableModel(preferred, task).block());
    }
}
