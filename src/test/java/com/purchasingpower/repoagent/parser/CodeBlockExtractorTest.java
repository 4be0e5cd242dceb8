package com.purchasingpower.repoagent.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Code Block Extractor Tests")
class CodeBlockExtractorTest {

    private final CodeBlockExtractor extractor = new CodeBlockExtractor();

    @Test
    @DisplayName("Should strip fence and language tag")
    void testExtract_ShouldStripFence() {
        assertEquals("print('hi')", extractor.extract("Here you go:\n```python\nprint('hi')\n```\nDone."));
    }

    @Test
    @DisplayName("Should join several blocks with a blank line")
    void testExtract_ShouldJoinBlocks() {
        String text = "```js\nconst a = 1;\n```\nand\n```\nconst b = 2;\n```";

        assertEquals("const a = 1;\n\nconst b = 2;", extractor.extract(text));
    }

    @Test
    @DisplayName("Should keep a first line that is code rather than a language tag")
    void testExtract_ShouldKeepInlineCode() {
        assertEquals("x = 1", extractor.extract("```x = 1```"));
    }

    @Test
    void testExtract_ShouldReturnTrimmedTextWithoutFences() {
        assertEquals("plain answer", extractor.extract("  plain answer \n"));
        assertEquals("", extractor.extract(null));
    }
}
