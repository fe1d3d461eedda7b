package org.dxworks.codeflow.ast;

import java.util.List;

/**
 * Read-only view of a syntax node, as exposed by a front end.
 * <p>
 * Roles are canonical names ({@code condition}, {@code consequence}, {@code alternative},
 * {@code body}, {@code parameters}, {@code name}, {@code target}, {@code iterable}, {@code left},
 * {@code right}, {@code operator}, {@code declarator}, {@code definition}); each front end maps them
 * onto its own grammar.
 */
public interface AstNode {

    /** Raw node type as named by the grammar. */
    String type();

    NodeKind kind();

    String text();

    /** 1-based line of the first character of this node. */
    int line();

    List<AstNode> namedChildren();

    /** First child carrying {@code role}, or {@code null} when there is none. */
    AstNode child(String role);

    /** All children carrying {@code role}, in source order. */
    List<AstNode> children(String role);
}
