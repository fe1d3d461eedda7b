package org.dxworks.codeflow.cfg;

import org.dxworks.codeflow.ast.AstNode;

/**
 * A construct lacks a part the control-flow builder cannot do without, such as a conditional
 * without its condition.
 */
public class MalformedNodeException extends RuntimeException {

    public MalformedNodeException(AstNode node, String role) {
        super("Malformed " + node.type() + " at line " + node.line() + ": missing " + role);
    }
}
