package org.dxworks.codeflow.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Block route from a definition of a variable to one of its uses. Block id 0 stands for the
 * procedure's parameter list.
 */
public class DefUsePath {
    public String variable;
    public int definitionLine;
    public int definitionBlock;
    public int useLine;
    public int useBlock;
    public List<Integer> blocks = new ArrayList<>();
}
