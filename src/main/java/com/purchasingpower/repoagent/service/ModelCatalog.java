package com.purchasingpower.repoagent.service;

import com.purchasingpower.repoagent.client.LLMProvider;
import com.purchasingpower.repoagent.config.ModelConfig;
import com.purchasingpower.repoagent.model.TaskType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Model identifiers, per-task defaults and category recommendations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelCatalog {

    private final ModelConfig config;
    private final ConnectivityMonitor connectivity;
    private final LLMProvider provider;

    public String defaultModel() {
        return config.getDefaultModel();
    }

    public List<String> knownModels() {
        return List.copyOf(config.getRequired());
    }

    /**
     * Fallback chain without {@code preferred} and without duplicates, in configured order.
     */
    public List<String> fallbacksExcluding(String preferred) {
        return config.getFallbacks().stream()
                .filter(model -> !model.equals(preferred))
                .distinct()
                .toList();
    }

    public String taskDefault(TaskType taskType) {
        String model = config.getTaskDefaults().get(taskType);
        return model != null ? model : config.getRecommendationDefault();
    }

    /**
     * Model suited to a coding category such as {@code data_analysis} or {@code web_development}.
     */
    public String recommendFor(String category) {
        if (category == null) {
            return config.getRecommendationDefault();
        }
        return config.getRecommendations()
                .getOrDefault(category.trim().toLowerCase(Locale.ROOT), config.getRecommendationDefault());
    }

    /**
     * {@code preferred} while the provider is reachable, otherwise the default for the task type.
     */
    public Mono<String> bestAvailable(String preferred, TaskType taskType) {
        return connectivity.check(false)
                .map(status -> {
                    if (status.isOk()) {
                        return preferred;
                    }
                    String degraded = taskDefault(taskType);
                    log.warn("Connectivity degraded, using {} instead of {} for {}", degraded, preferred, taskType);
                    return degraded;
                });
    }

    /**
     * Known models the provider currently advertises, in the provider's order.
     * Falls back to the known list when the provider lists none of them or cannot be reached.
     */
    public Mono<List<String>> availableModels() {
        List<String> known = knownModels();
        return provider.listModels()
                .map(advertised -> advertised.stream().filter(known::contains).toList())
                .map(available -> available.isEmpty() ? known : available)
                .onErrorResume(e -> {
                    log.warn("Error fetching models, using known list: {}", e.getMessage());
                    return Mono.just(known);
                });
    }
}
