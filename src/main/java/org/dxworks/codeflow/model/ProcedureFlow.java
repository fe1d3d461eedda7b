package org.dxworks.codeflow.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ProcedureFlow {
    public String name;
    public int line;
    public Integer entryBlock;
    public List<Integer> finalBlocks = new ArrayList<>();
    public List<BlockInfo> blocks = new ArrayList<>();
    public int pathCount;
    /** Rendered data-flow paths grouped by variable, in first-seen order. */
    public Map<String, List<String>> dataFlowPaths = new LinkedHashMap<>();
    public List<DefUsePath> defUsePaths = new ArrayList<>();
    public List<String> diagnostics = new ArrayList<>();
    public List<ProcedureFlow> nestedProcedures = new ArrayList<>();
}
