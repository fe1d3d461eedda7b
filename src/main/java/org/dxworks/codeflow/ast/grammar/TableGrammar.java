package org.dxworks.codeflow.ast.grammar;

import org.dxworks.codeflow.ast.NodeKind;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link Grammar} backed by a node-type table and a table of field aliases.
 */
abstract class TableGrammar implements Grammar {

    private final Map<String, NodeKind> kinds = new HashMap<>();
    private final Map<String, String> fieldAliases = new HashMap<>();
    private final TokenTable tokens;

    protected TableGrammar(TokenTable tokens) {
        this.tokens = tokens;
    }

    protected void kind(NodeKind kind, String... nodeTypes) {
        for (String nodeType : nodeTypes) {
            kinds.put(nodeType, kind);
        }
    }

    protected void alias(String nodeType, String role, String field) {
        fieldAliases.put(nodeType + "." + role, field);
    }

    @Override
    public NodeKind kindOf(String nodeType) {
        return kinds.getOrDefault(nodeType, NodeKind.OTHER);
    }

    @Override
    public String fieldFor(String nodeType, String role) {
        return fieldAliases.getOrDefault(nodeType + "." + role, role);
    }

    @Override
    public TokenTable tokens() {
        return tokens;
    }
}
