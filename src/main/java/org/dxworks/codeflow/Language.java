package org.dxworks.codeflow;

public enum Language {
    JAVA("java"),
    PYTHON("python");

    private final String name;

    Language(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
