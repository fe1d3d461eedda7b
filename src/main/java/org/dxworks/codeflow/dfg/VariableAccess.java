package org.dxworks.codeflow.dfg;

import org.dxworks.codeflow.model.Occurrence;

/**
 * An occurrence together with how the statement touches the variable.
 */
public final class VariableAccess {

    private final Occurrence occurrence;
    private final boolean definition;
    private final boolean use;

    public VariableAccess(Occurrence occurrence, boolean definition, boolean use) {
        this.occurrence = occurrence;
        this.definition = definition;
        this.use = use;
    }

    public Occurrence getOccurrence() {
        return occurrence;
    }

    public String getName() {
        return occurrence.getName();
    }

    public int getLine() {
        return occurrence.getLine();
    }

    public boolean isDefinition() {
        return definition;
    }

    public boolean isUse() {
        return use;
    }

    @Override
    public String toString() {
        return occurrence + (definition ? " def" : "") + (use ? " use" : "");
    }
}
