package org.dxworks.codeflow.model;

public class EdgeInfo {
    public int target;
    public String exitcase;
}
