package com.purchasingpower.repoagent.parser;

import com.purchasingpower.repoagent.model.AgentResponse;
import com.purchasingpower.repoagent.model.FileModification;
import com.purchasingpower.repoagent.model.GeneratedCodeWithTests;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers structured output from the labelled free-text format the prompts ask for:
 *
 * <pre>
 * SOLUTION EXPLANATION:
 * ...
 * IMPLEMENTATION:
 * [FILE: src/app.py]
 * ```python
 * ...
 * ```
 * </pre>
 *
 * Parsing is tolerant. Missing labels give empty values, never exceptions.
 */
@Slf4j
@Component
public class AgentResponseParser {

    private static final Pattern EXPLANATION = Pattern.compile(
            "(?:SOLUTION )?EXPLANATION:\\s*(.*?)(?=IMPLEMENTATION:|MODIFIED FILES:|\\[FILE:|\\z)",
            Pattern.DOTALL);

    private static final Pattern FILE_BLOCK = Pattern.compile(
            "\\[FILE: (.+?)\\]\\s*```(?:\\w*\\n)?(.*?)```",
            Pattern.DOTALL);

    private static final Pattern IMPLEMENTATION_BLOCK = Pattern.compile(
            "IMPLEMENTATION:\\s*```(?:\\w*\\n)?(.*?)```",
            Pattern.DOTALL);

    private static final Pattern TESTS_BLOCK = Pattern.compile(
            "TESTS:\\s*```(?:\\w*\\n)?(.*?)```",
            Pattern.DOTALL);

    public AgentResponse parseMultiFile(String text) {
        if (text == null || text.isBlank()) {
            return AgentResponse.empty();
        }

        String explanation = "";
        Matcher explanationMatcher = EXPLANATION.matcher(text);
        if (explanationMatcher.find()) {
            explanation = explanationMatcher.group(1).trim();
        }

        List<FileModification> files = new ArrayList<>();
        Matcher fileMatcher = FILE_BLOCK.matcher(text);
        while (fileMatcher.find()) {
            files.add(FileModification.proposed(fileMatcher.group(1).trim(), fileMatcher.group(2).trim()));
        }

        log.debug("Parsed agent response: explanation={} chars, {} files", explanation.length(), files.size());
        return new AgentResponse(explanation, List.copyOf(files));
    }

    public GeneratedCodeWithTests parseImplementationWithTests(String text) {
        return GeneratedCodeWithTests.builder()
                .implementation(firstGroup(IMPLEMENTATION_BLOCK, text))
                .tests(firstGroup(TESTS_BLOCK, text))
                .build();
    }

    private static String firstGroup(Pattern pattern, String text) {
        if (text == null) {
            return "";
        }
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : "";
    }
}
