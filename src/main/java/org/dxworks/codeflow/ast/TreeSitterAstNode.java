package org.dxworks.codeflow.ast;

import org.dxworks.codeflow.ast.grammar.Grammar;
import org.treesitter.TSNode;
import org.treesitter.TSTreeCursor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@link AstNode} over a tree-sitter node. Role lookups go through the grammar's field aliases.
 */
public final class TreeSitterAstNode implements AstNode {

    private final TSNode node;
    private final SourceText source;
    private final Grammar grammar;

    public TreeSitterAstNode(TSNode node, SourceText source, Grammar grammar) {
        this.node = node;
        this.source = source;
        this.grammar = grammar;
    }

    public TSNode getTsNode() {
        return node;
    }

    public boolean hasError() {
        return node.hasError();
    }

    @Override
    public String type() {
        return node.getType();
    }

    @Override
    public NodeKind kind() {
        return grammar.kindOf(node.getType());
    }

    @Override
    public String text() {
        return source.slice(node.getStartByte(), node.getEndByte());
    }

    @Override
    public int line() {
        return node.getStartPoint().getRow() + 1;
    }

    @Override
    public List<AstNode> namedChildren() {
        int count = node.getNamedChildCount();
        List<AstNode> children = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            children.add(wrap(node.getNamedChild(i)));
        }
        return children;
    }

    @Override
    public AstNode child(String role) {
        TSNode child = node.getChildByFieldName(grammar.fieldFor(node.getType(), role));
        if (child == null || child.isNull()) return null;
        return wrap(child);
    }

    @Override
    public List<AstNode> children(String role) {
        String field = grammar.fieldFor(node.getType(), role);
        TSTreeCursor cursor = new TSTreeCursor(node);
        if (!cursor.gotoFirstChild()) {
            return Collections.emptyList();
        }
        List<AstNode> result = new ArrayList<>();
        do {
            if (field.equals(cursor.currentFieldName())) {
                result.add(wrap(cursor.currentNode()));
            }
        } while (cursor.gotoNextSibling());
        return result;
    }

    private AstNode wrap(TSNode child) {
        return new TreeSitterAstNode(child, source, grammar);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TreeSitterAstNode)) return false;
        TreeSitterAstNode other = (TreeSitterAstNode) o;
        return source == other.source
                && node.getStartByte() == other.node.getStartByte()
                && node.getEndByte() == other.node.getEndByte()
                && node.getType().equals(other.node.getType());
    }

    @Override
    public int hashCode() {
        return Objects.hash(node.getStartByte(), node.getEndByte(), node.getType());
    }

    @Override
    public String toString() {
        return type() + "@" + line();
    }
}
