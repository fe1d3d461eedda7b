package org.dxworks.codeflow.model;

import org.dxworks.codeflow.ast.AstHelper;
import org.dxworks.codeflow.ast.AstNode;
import org.dxworks.codeflow.ast.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A basic block: an ordered run of statements with its outgoing and incoming links.
 * Statements are borrowed from the syntax tree.
 */
public final class Block {

    private static final Set<NodeKind> COMPOUND_KINDS = EnumSet.of(
            NodeKind.IF, NodeKind.ELSE, NodeKind.WHILE, NodeKind.FOR, NodeKind.FOR_EACH, NodeKind.SWITCH,
            NodeKind.PROCEDURE, NodeKind.CLASS, NodeKind.DECORATED);

    private final int id;
    private final List<AstNode> statements = new ArrayList<>();
    private final List<Link> exits = new ArrayList<>();
    private final List<Link> predecessors = new ArrayList<>();

    public Block(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public List<AstNode> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public void addStatement(AstNode statement) {
        statements.add(statement);
    }

    public List<Link> getExits() {
        return Collections.unmodifiableList(exits);
    }

    public List<Link> getPredecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public boolean hasExits() {
        return !exits.isEmpty();
    }

    public Link addExit(Block target, String exitcase) {
        Link link = new Link(this, target, exitcase);
        exits.add(link);
        target.predecessors.add(link);
        return link;
    }

    public void removeExit(Link link) {
        if (link.getSource() != this) {
            throw new IllegalArgumentException("Link " + link + " does not leave block " + id);
        }
        exits.remove(link);
        link.getTarget().predecessors.remove(link);
    }

    /** Line of the first statement, or 0 for an empty block. */
    public int getLine() {
        return statements.isEmpty() ? 0 : statements.get(0).line();
    }

    /**
     * Source text of the block's statements, one per line. Compound statements contribute only
     * their header line.
     */
    public String getSource() {
        return statements.stream()
                .map(statement -> COMPOUND_KINDS.contains(statement.kind())
                        ? AstHelper.firstLine(statement.text()).trim()
                        : statement.text().trim())
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return "Block " + id + (statements.isEmpty() ? " (empty)" : " at line " + getLine());
    }
}
