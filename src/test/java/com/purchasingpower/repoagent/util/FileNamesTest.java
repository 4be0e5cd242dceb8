package com.purchasingpower.repoagent.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FileNamesTest {

    @Test
    void testExtension_ShouldLowercaseAndHandleEdgeCases() {
        assertEquals("py", FileNames.extension("src/Main.PY"));
        assertEquals("no-extension", FileNames.extension("Makefile"));
        assertEquals("unknown", FileNames.extension("weird."));
        assertEquals("gz", FileNames.extension("dist/archive.tar.gz"));
    }

    @Test
    void testNormalize_ShouldStripSlashes() {
        assertEquals("src/app.py", FileNames.normalize(" /src/app.py/ "));
        assertEquals("", FileNames.normalize(null));
        assertEquals("app.py", FileNames.fileName("src/app.py"));
    }
}
