package com.purchasingpower.repoagent.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a list of file paths out of a model answer.
 *
 * <p>The first JSON string array found is parsed; when there is none, or it does not parse,
 * every double-quoted string in the text is taken instead. Duplicates are dropped keeping
 * first occurrence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PathListExtractor {

    private static final Pattern JSON_ARRAY = Pattern.compile("\\[\\s*\".*?\"\\s*]", Pattern.DOTALL);
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    private final ObjectMapper objectMapper;

    public List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        Matcher arrayMatcher = JSON_ARRAY.matcher(text);
        if (arrayMatcher.find()) {
            try {
                JsonNode array = objectMapper.readTree(arrayMatcher.group());
                Set<String> paths = new LinkedHashSet<>();
                array.forEach(element -> {
                    if (element.isTextual() && !element.asText().isBlank()) {
                        paths.add(element.asText().trim());
                    }
                });
                return List.copyOf(paths);
            } catch (JsonProcessingException e) {
                log.debug("Path list is not valid JSON, extracting quoted strings: {}", e.getOriginalMessage());
            }
        }

        Set<String> paths = new LinkedHashSet<>();
        Matcher quoted = QUOTED.matcher(text);
        while (quoted.find()) {
            String candidate = quoted.group(1).trim();
            if (!candidate.isEmpty()) {
                paths.add(candidate);
            }
        }
        return List.copyOf(paths);
    }
}
