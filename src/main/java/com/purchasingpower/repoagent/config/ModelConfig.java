package com.purchasingpower.repoagent.config;

import com.purchasingpower.repoagent.model.TaskType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model identifiers known to the engine.
 *
 * <p>Loaded from {@code app.models}. The fallback list is tried in order once the
 * preferred model has exhausted its retries; it must not be empty.
 */
@ConfigurationProperties(prefix = "app.models")
@Data
public class ModelConfig {

    /**
     * Model used when the caller does not name one.
     */
    private String defaultModel = "anthropic/claude-3-opus";

    /**
     * Models this engine is built for; the connectivity check verifies the provider still lists them.
     */
    private List<String> required = new ArrayList<>(List.of(
            "anthropic/claude-instant-1",
            "anthropic/claude-3-opus",
            "anthropic/claude-3-sonnet",
            "meta-llama/llama-2-13b-chat",
            "google/palm-2-chat-bison",
            "google/gemini-pro",
            "mistralai/mistral-7b-instruct",
            "mistralai/mixtral-8x7b-instruct"));

    /**
     * Ordered fallback chain.
     */
    private List<String> fallbacks = new ArrayList<>(List.of(
            "google/gemini-pro",
            "anthropic/claude-instant-1",
            "mistralai/mistral-7b-instruct"));

    /**
     * Model used per task type when connectivity is degraded.
     */
    private Map<TaskType, String> taskDefaults = new EnumMap<>(Map.of(
            TaskType.CODE, "google/gemini-pro",
            TaskType.ANALYSIS, "mistralai/mixtral-8x7b-instruct",
            TaskType.EDIT, "anthropic/claude-instant-1",
            TaskType.GENERAL, "mistralai/mistral-7b-instruct"));

    /**
     * Model recommendation per coding category.
     */
    private Map<String, String> recommendations = new LinkedHashMap<>(Map.of(
            "data_analysis", "mistralai/mixtral-8x7b-instruct",
            "machine_learning", "mistralai/mixtral-8x7b-instruct",
            "web_development", "google/gemini-pro",
            "automation", "anthropic/claude-instant-1",
            "algorithms", "meta-llama/llama-2-13b-chat",
            "simple_scripts", "mistralai/mistral-7b-instruct"));

    private String recommendationDefault = "google/gemini-pro";
}
