package com.purchasingpower.repoagent.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Path List Extractor Tests")
class PathListExtractorTest {

    private final PathListExtractor extractor = new PathListExtractor(new ObjectMapper());

    @Test
    @DisplayName("Should parse JSON array embedded in prose")
    void testExtract_ShouldParseEmbeddedJsonArray() {
        String text = "The relevant files are:\n```json\n[\"src/app.py\", \"src/db.py\", \"src/app.py\"]\n```\nHope this helps.";

        assertThat(extractor.extract(text)).containsExactly("src/app.py", "src/db.py");
    }

    @Test
    @DisplayName("Should take only the first array when the answer holds several")
    void testExtract_ShouldStopAtFirstArray() {
        String text = "Primary: [\"src/app.py\", \"src/db.py\"]\nMaybe also: [\"docs/notes.md\"] and \"setup.cfg\"";

        assertThat(extractor.extract(text)).containsExactly("src/app.py", "src/db.py");
    }

    @Test
    @DisplayName("Should fall back to quoted strings when there is no valid array")
    void testExtract_ShouldFallBackToQuotedStrings() {
        String text = "Look at \"README.md\" and \"lib/core.js\", then \"README.md\" again.";

        assertThat(extractor.extract(text)).containsExactly("README.md", "lib/core.js");
    }

    @Test
    void testExtract_ShouldFallBackWhenArrayIsInvalidJson() {
        String text = "[\"a.py\", \"b.py\",]";

        assertThat(extractor.extract(text)).containsExactly("a.py", "b.py");
    }

    @Test
    void testExtract_ShouldReturnEmptyForBlankInput() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("no paths here")).isEmpty();
    }
}
