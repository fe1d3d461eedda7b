package org.dxworks.codeflow.model;

import java.util.Objects;

/**
 * A variable name referenced at a source line.
 */
public final class Occurrence {

    private final String name;
    private final int line;

    public Occurrence(String name, int line) {
        this.name = name;
        this.line = line;
    }

    public String getName() {
        return name;
    }

    public int getLine() {
        return line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Occurrence)) return false;
        Occurrence that = (Occurrence) o;
        return line == that.line && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, line);
    }

    @Override
    public String toString() {
        return "(" + name + ", " + line + ")";
    }
}
