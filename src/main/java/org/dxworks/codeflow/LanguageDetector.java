package org.dxworks.codeflow;

import java.nio.file.Path;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<Language> detectLanguage(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase();

        if (fileName.endsWith(".java")) {
            return Optional.of(Language.JAVA);
        } else if (fileName.endsWith(".py")) {
            return Optional.of(Language.PYTHON);
        }

        return Optional.empty();
    }
}
