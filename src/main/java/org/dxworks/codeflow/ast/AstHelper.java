package org.dxworks.codeflow.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class AstHelper {

    /**
     * Collapse all whitespace (including newlines and tabs) to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static String firstLine(String s) {
        if (s == null) return null;
        int newline = s.indexOf('\n');
        return newline < 0 ? s : s.substring(0, newline);
    }

    /**
     * Removes parentheses that enclose the whole expression, e.g. {@code ((a) && b)} becomes
     * {@code (a) && b}, while {@code (a) && (b)} is left untouched.
     */
    public static String stripEnclosingParentheses(String s) {
        if (s == null) return null;
        String result = s.trim();
        while (result.length() >= 2 && result.charAt(0) == '(' && closingParenthesis(result, 0) == result.length() - 1) {
            result = result.substring(1, result.length() - 1).trim();
        }
        return result;
    }

    /** Index of the parenthesis closing the one at {@code open}, or -1 when unbalanced. */
    public static int closingParenthesis(String s, int open) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    public static AstNode findFirstChild(AstNode parent, NodeKind kind) {
        if (parent == null) return null;
        for (AstNode child : parent.namedChildren()) {
            if (child.kind() == kind) {
                return child;
            }
        }
        return null;
    }

    public static List<AstNode> findAllDescendants(AstNode root, NodeKind kind) {
        List<AstNode> result = new ArrayList<>();
        if (root == null) return result;

        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            if (node.kind() == kind) {
                result.add(node);
            }
            List<AstNode> children = node.namedChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    public static boolean isKindOneOf(AstNode node, NodeKind... kinds) {
        if (node == null) return false;
        for (NodeKind kind : kinds) {
            if (node.kind() == kind) return true;
        }
        return false;
    }
}
