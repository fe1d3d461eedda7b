package org.dxworks.codeflow.analyzer;

import org.dxworks.codeflow.ast.AstNode;
import org.dxworks.codeflow.cfg.CfgBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the outermost procedures of a file. Procedures nested in other procedures are left to the
 * CFG builder; methods are named after their enclosing classes, e.g. {@code Outer.Inner.run}.
 */
public final class ProcedureLocator {

    private ProcedureLocator() {
    }

    public static List<LocatedProcedure> locate(AstNode root) {
        List<LocatedProcedure> result = new ArrayList<>();
        visit(root, "", result);
        return result;
    }

    private static void visit(AstNode node, String prefix, List<LocatedProcedure> result) {
        switch (node.kind()) {
            case PROCEDURE -> result.add(new LocatedProcedure(prefix + CfgBuilder.procedureName(node), node));
            case DECORATED -> {
                AstNode definition = node.child("definition");
                if (definition != null) {
                    visit(definition, prefix, result);
                }
            }
            case CLASS -> {
                String classPrefix = prefix + CfgBuilder.procedureName(node) + ".";
                for (AstNode child : node.namedChildren()) {
                    visit(child, classPrefix, result);
                }
            }
            default -> {
                for (AstNode child : node.namedChildren()) {
                    visit(child, prefix, result);
                }
            }
        }
    }

    public static final class LocatedProcedure {
        private final String name;
        private final AstNode node;

        LocatedProcedure(String name, AstNode node) {
            this.name = name;
            this.node = node;
        }

        public String getName() {
            return name;
        }

        public AstNode getNode() {
            return node;
        }
    }
}
