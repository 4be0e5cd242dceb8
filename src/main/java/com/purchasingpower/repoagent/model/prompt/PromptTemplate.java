package com.purchasingpower.repoagent.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: solve-plan
 * version: 1.0
 * repositoryContext: true
 * userPrompt: |
 *   PROBLEM DESCRIPTION:
 *   {{{problem}}}
 * </pre>
 *
 * Templates without a {@code systemPrompt} share the one from the {@code system} template.
 * {@code repositoryContext} switches the repository block of that shared system prompt on.
 *
 * @see com.purchasingpower.repoagent.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private boolean repositoryContext;
    private String systemPrompt;
    private String userPrompt;
}
