package org.dxworks.codeflow.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Occurrences of variables along one control-flow route. Immutable; equal paths have equal
 * occurrence sequences.
 */
public final class DfgPath {

    private final List<Occurrence> occurrences;

    public DfgPath(List<Occurrence> occurrences) {
        if (occurrences.isEmpty()) {
            throw new IllegalArgumentException("A data-flow path needs at least one occurrence");
        }
        this.occurrences = List.copyOf(occurrences);
    }

    public List<Occurrence> getOccurrences() {
        return occurrences;
    }

    /** Name of the first occurrence, the variable that owns the path. */
    public String getVariable() {
        return occurrences.get(0).getName();
    }

    public int size() {
        return occurrences.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DfgPath)) return false;
        return occurrences.equals(((DfgPath) o).occurrences);
    }

    @Override
    public int hashCode() {
        return occurrences.hashCode();
    }

    @Override
    public String toString() {
        return occurrences.stream().map(Occurrence::toString).collect(Collectors.joining(" -> "));
    }
}
