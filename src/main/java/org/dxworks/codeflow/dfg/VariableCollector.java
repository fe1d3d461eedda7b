package org.dxworks.codeflow.dfg;

import org.dxworks.codeflow.ast.AstNode;
import org.dxworks.codeflow.ast.NodeKind;
import org.dxworks.codeflow.ast.grammar.TokenTable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the variables a procedure owns: its parameters and the locals it declares or assigns.
 * Nested procedures and classes are not entered.
 */
public class VariableCollector {

    private final VariableExtractor extractor;
    private final TokenTable tokens;

    public VariableCollector(VariableExtractor extractor, TokenTable tokens) {
        this.extractor = extractor;
        this.tokens = tokens;
    }

    public ProcedureVariables collect(AstNode procedure) {
        Set<String> locals = new LinkedHashSet<>();
        AstNode body = procedure.child("body");
        if (body != null) {
            Deque<AstNode> stack = new ArrayDeque<>();
            stack.push(body);
            while (!stack.isEmpty()) {
                AstNode node = stack.pop();
                switch (node.kind()) {
                    case PROCEDURE, CLASS, DECORATED -> {
                        continue;
                    }
                    case DECLARATOR -> addName(node.child("name"), locals);
                    case ASSIGNMENT -> addTargets(node.child("left"), locals);
                    case FOR_EACH -> addTargets(node.child("target"), locals);
                    default -> {
                    }
                }
                List<AstNode> children = node.namedChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
        return new ProcedureVariables(extractor.parameters(procedure), locals);
    }

    /** A plain name, or the names of a flat tuple such as {@code a, b = ...}. */
    private void addTargets(AstNode target, Set<String> locals) {
        if (target == null) return;
        if (target.kind() == NodeKind.IDENTIFIER) {
            addName(target, locals);
            return;
        }
        List<AstNode> parts = target.namedChildren();
        if (!parts.isEmpty() && parts.stream().allMatch(part -> part.kind() == NodeKind.IDENTIFIER)) {
            parts.forEach(part -> addName(part, locals));
        }
    }

    private void addName(AstNode name, Set<String> locals) {
        if (name != null && name.kind() == NodeKind.IDENTIFIER && !tokens.isKeyword(name.text())) {
            locals.add(name.text());
        }
    }
}
