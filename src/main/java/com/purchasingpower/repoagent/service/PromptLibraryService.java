package com.purchasingpower.repoagent.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.repoagent.model.prompt.PromptTemplate;
import com.purchasingpower.repoagent.model.prompt.RenderedPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from YAML files and renders them with variables.
 *
 * Usage:
 * RenderedPrompt prompt = promptLibrary.render("edit", Map.of(
 *     "filePath", "src/app.py",
 *     "instruction", "Add logging",
 *     "currentContent", content
 * ));
 *
 * Templates use triple braces for injected code so Mustache does not HTML-escape it.
 */
@Slf4j
@Service
public class PromptLibraryService {

    public static final String SYSTEM_TEMPLATE = "system";
    static final String INCLUDE_REPOSITORY = "includeRepository";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }

        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }

        if (!templates.containsKey(SYSTEM_TEMPLATE)) {
            throw new IllegalStateException("Prompt library initialization failed: no '" + SYSTEM_TEMPLATE + "' template");
        }
        log.info("Loaded {} prompt templates", templates.size());
    }

    /**
     * Render the system and user prompt of a template.
     *
     * @param variables values for the template; the repository variables of the shared
     *                  system prompt ({@code repoName}, {@code repoOwner}, ...) may be included
     */
    public RenderedPrompt render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = getTemplate(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }

        Map<String, Object> scope = new HashMap<>(variables);
        scope.put(INCLUDE_REPOSITORY, template.isRepositoryContext() && variables.get("repoName") != null);

        String system = template.getSystemPrompt() != null
                ? execute(templateName + "#system", template.getSystemPrompt(), scope)
                : execute(SYSTEM_TEMPLATE + "#system", templates.get(SYSTEM_TEMPLATE).getSystemPrompt(), scope);
        String user = execute(templateName + "#user", template.getUserPrompt(), scope);
        return new RenderedPrompt(system.strip(), user.strip());
    }

    /**
     * Get template metadata (for logging, debugging)
     */
    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }

    private String execute(String key, String source, Map<String, Object> scope) {
        if (source == null) {
            return "";
        }
        Mustache mustache = compiled.computeIfAbsent(key,
                k -> mustacheFactory.compile(new StringReader(source), k));
        StringWriter writer = new StringWriter();
        mustache.execute(writer, scope);
        return writer.toString();
    }
}
