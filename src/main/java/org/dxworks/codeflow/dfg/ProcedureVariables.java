package org.dxworks.codeflow.dfg;

import org.dxworks.codeflow.model.Occurrence;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class ProcedureVariables {

    private final List<Occurrence> parameters;
    private final Set<String> locals;

    public ProcedureVariables(List<Occurrence> parameters, Set<String> locals) {
        this.parameters = List.copyOf(parameters);
        this.locals = Collections.unmodifiableSet(new LinkedHashSet<>(locals));
    }

    /** Parameters located at the declaration line, in declaration order. */
    public List<Occurrence> getParameters() {
        return parameters;
    }

    public Set<String> getLocals() {
        return locals;
    }

    /** Parameter names followed by local names. */
    public Set<String> tracked() {
        Set<String> tracked = new LinkedHashSet<>();
        parameters.forEach(parameter -> tracked.add(parameter.getName()));
        tracked.addAll(locals);
        return tracked;
    }
}
