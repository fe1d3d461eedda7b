package org.dxworks.codeflow.ast;

import java.util.Collections;
import java.util.List;

/**
 * {@link AstNode} produced by {@link LineFrontEnd}: a body node whose children are single source
 * lines. Line nodes carry no field roles.
 */
public final class LineAstNode implements AstNode {

    private final NodeKind kind;
    private final String text;
    private final int line;
    private final List<AstNode> children;

    private LineAstNode(NodeKind kind, String text, int line, List<AstNode> children) {
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.children = children;
    }

    public static LineAstNode line(String text, int line) {
        return new LineAstNode(NodeKind.LINE, text, line, Collections.emptyList());
    }

    public static LineAstNode body(String text, int line, List<AstNode> lines) {
        return new LineAstNode(NodeKind.BLOCK, text, line, List.copyOf(lines));
    }

    @Override
    public String type() {
        return kind == NodeKind.LINE ? "line" : "line_body";
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public int line() {
        return line;
    }

    @Override
    public List<AstNode> namedChildren() {
        return children;
    }

    @Override
    public AstNode child(String role) {
        return null;
    }

    @Override
    public List<AstNode> children(String role) {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return type() + "@" + line;
    }
}
