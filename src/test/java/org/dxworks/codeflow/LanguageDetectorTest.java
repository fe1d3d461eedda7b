package org.dxworks.codeflow;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class LanguageDetectorTest {

    @Test
    void detectsByExtension() {
        assertEquals(Optional.of(Language.JAVA), LanguageDetector.detectLanguage(Paths.get("src/Main.java")));
        assertEquals(Optional.of(Language.PYTHON), LanguageDetector.detectLanguage(Paths.get("tools/build.PY")));
        assertEquals(Optional.empty(), LanguageDetector.detectLanguage(Paths.get("README.md")));
    }
}
