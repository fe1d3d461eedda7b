package org.dxworks.codeflow.model;

import java.util.ArrayList;
import java.util.List;

public class BlockInfo {
    public int id;
    public int line;
    public String source;
    public List<EdgeInfo> exits = new ArrayList<>();
}
