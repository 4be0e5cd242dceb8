package com.purchasingpower.repoagent.parser;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips markdown fences from a model answer.
 */
@Component
public class CodeBlockExtractor {

    private static final Pattern FENCED = Pattern.compile("```(?:[\\w+#.-]*[ \\t]*\\n)?(.*?)```", Pattern.DOTALL);

    /**
     * Contents of all fenced blocks joined by a blank line, or the trimmed text when it has none.
     */
    public String extract(String text) {
        if (text == null) {
            return "";
        }
        List<String> blocks = new ArrayList<>();
        Matcher matcher = FENCED.matcher(text);
        while (matcher.find()) {
            blocks.add(matcher.group(1).trim());
        }
        return blocks.isEmpty() ? text.trim() : String.join("\n\n", blocks);
    }
}
