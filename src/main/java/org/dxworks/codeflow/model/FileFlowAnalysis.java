package org.dxworks.codeflow.model;

import java.util.ArrayList;
import java.util.List;

public class FileFlowAnalysis {
    public String kind = "file";
    public String filePath;
    public String language;
    /** True when the file was analyzed line by line because no syntax tree was available. */
    public boolean degraded;
    public List<ProcedureFlow> procedures = new ArrayList<>();
}
