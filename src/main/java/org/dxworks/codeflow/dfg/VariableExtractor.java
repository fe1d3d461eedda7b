package org.dxworks.codeflow.dfg;

import org.dxworks.codeflow.ast.AstHelper;
import org.dxworks.codeflow.ast.AstNode;
import org.dxworks.codeflow.ast.NodeKind;
import org.dxworks.codeflow.ast.grammar.TokenTable;
import org.dxworks.codeflow.model.Occurrence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds the variables a single statement refers to.
 * <p>
 * Compound statements contribute only their header: the condition of an if or loop, the target
 * and iterated expression of a for-each, the subject of a switch. Their bodies are extracted when
 * the body statements are visited. Declarations contribute only the declared names.
 */
public class VariableExtractor {

    private static final Pattern IDENTIFIER = Pattern.compile("\\b[A-Za-z_][A-Za-z0-9_]*\\b");
    private static final Pattern LINE_ASSIGNMENT = Pattern.compile("\\b([A-Za-z_][A-Za-z0-9_]*)\\s*(<<|>>>|>>|\\*\\*|//|[-+*/%&|^])?=(?!=)");
    private static final Pattern LINE_UPDATE = Pattern.compile("(?:\\+\\+|--)\\s*([A-Za-z_][A-Za-z0-9_]*)|([A-Za-z_][A-Za-z0-9_]*)\\s*(?:\\+\\+|--)");

    private final TokenTable tokens;

    public VariableExtractor(TokenTable tokens) {
        this.tokens = tokens;
    }

    public List<Occurrence> extract(AstNode statement) {
        return extract(statement, null);
    }

    /**
     * Occurrences in {@code statement}, ordered by line and deduplicated.
     *
     * @param tracked names to keep, or {@code null} to keep every variable
     */
    public List<Occurrence> extract(AstNode statement, Set<String> tracked) {
        return accesses(statement).stream()
                .map(VariableAccess::getOccurrence)
                .filter(occurrence -> tracked == null || tracked.contains(occurrence.getName()))
                .collect(Collectors.toList());
    }

    /**
     * Occurrences in {@code statement} classified as definitions and uses, ordered by line.
     * Repeated references on one line are merged.
     */
    public List<VariableAccess> accesses(AstNode statement) {
        Accumulator accumulator = new Accumulator();
        switch (statement.kind()) {
            case IF, WHILE, FOR -> scan(statement.child("condition"), accumulator, false, true);
            case FOR_EACH -> {
                scan(statement.child("target"), accumulator, true, false);
                scan(statement.child("iterable"), accumulator, false, true);
            }
            case SWITCH -> {
                for (AstNode subject : statement.children("condition")) {
                    scan(subject, accumulator, false, true);
                }
            }
            case DECLARATION -> scanDeclaration(statement, accumulator);
            case PROCEDURE -> {
                for (Occurrence parameter : parameters(statement)) {
                    accumulator.add(parameter.getName(), parameter.getLine(), true, false);
                }
            }
            case DECORATED -> {
                AstNode definition = statement.child("definition");
                if (definition != null && definition.kind() == NodeKind.PROCEDURE) {
                    for (Occurrence parameter : parameters(definition)) {
                        accumulator.add(parameter.getName(), parameter.getLine(), true, false);
                    }
                }
            }
            case LINE -> scanLine(statement.text(), statement.line(), accumulator);
            case CLASS, BLOCK, ELSE, CASE, CASE_ARM, BREAK, CONTINUE, LABELED, COMMENT, STRING_LITERAL -> {
            }
            case LABEL, RETURN, THROW, DECLARATOR, ASSIGNMENT, UPDATE, EXPRESSION, IDENTIFIER, OTHER ->
                    scan(statement, accumulator, false, true);
        }
        return accumulator.toList();
    }

    /**
     * Formal parameter names of {@code procedure}, located at the line of the parameter list.
     */
    public List<Occurrence> parameters(AstNode procedure) {
        List<Occurrence> result = new ArrayList<>();
        AstNode parameters = procedure.child("parameters");
        if (parameters == null) return result;

        for (AstNode parameter : parameters.namedChildren()) {
            AstNode name = parameter.kind() == NodeKind.IDENTIFIER ? parameter : parameter.child("name");
            if (name == null || name.kind() != NodeKind.IDENTIFIER) {
                List<AstNode> identifiers = AstHelper.findAllDescendants(parameter, NodeKind.IDENTIFIER);
                name = identifiers.isEmpty() ? null : identifiers.get(0);
            }
            if (name != null && !tokens.isKeyword(name.text())) {
                Occurrence occurrence = new Occurrence(name.text(), parameters.line());
                if (!result.contains(occurrence)) {
                    result.add(occurrence);
                }
            }
        }
        return result;
    }

    private void scan(AstNode node, Accumulator accumulator, boolean definition, boolean use) {
        if (node == null) return;
        switch (node.kind()) {
            case STRING_LITERAL, COMMENT, PROCEDURE, CLASS, DECORATED -> {
            }
            case IDENTIFIER -> accumulator.add(node.text(), node.line(), definition, use);
            case ASSIGNMENT -> {
                AstNode left = node.child("left");
                AstNode operator = node.child("operator");
                boolean compound = operator != null && !"=".equals(operator.text().trim());
                for (AstNode child : node.namedChildren()) {
                    if (child.equals(left)) {
                        scan(child, accumulator, true, compound);
                    } else {
                        scan(child, accumulator, false, true);
                    }
                }
            }
            case UPDATE -> {
                for (AstNode child : node.namedChildren()) {
                    scan(child, accumulator, true, true);
                }
            }
            case DECLARATOR -> {
                AstNode name = node.child("name");
                for (AstNode child : node.namedChildren()) {
                    if (child.equals(name)) {
                        scan(child, accumulator, true, false);
                    } else {
                        scan(child, accumulator, false, true);
                    }
                }
            }
            case LINE -> scanLine(node.text(), node.line(), accumulator);
            default -> {
                for (AstNode child : node.namedChildren()) {
                    scan(child, accumulator, definition, use);
                }
            }
        }
    }

    private void scanDeclaration(AstNode declaration, Accumulator accumulator) {
        List<AstNode> names = new ArrayList<>();
        List<AstNode> declarators = declaration.children("declarator");
        if (declarators.isEmpty()) {
            names.addAll(AstHelper.findAllDescendants(declaration, NodeKind.IDENTIFIER));
        }
        for (AstNode declarator : declarators) {
            AstNode name = declarator.child("name");
            if (name != null && name.kind() == NodeKind.IDENTIFIER) {
                names.add(name);
            }
        }
        for (AstNode name : names) {
            if (!tokens.looksLikeTypeName(name.text())) {
                accumulator.add(name.text(), name.line(), true, false);
            }
        }
    }

    private void scanLine(String text, int line, Accumulator accumulator) {
        String code = tokens.stripCommentsAndStrings(text);

        Matcher assignment = LINE_ASSIGNMENT.matcher(code);
        String assigned = null;
        boolean compound = false;
        if (assignment.find()) {
            assigned = assignment.group(1);
            compound = assignment.group(2) != null;
        }
        List<String> updated = new ArrayList<>();
        Matcher update = LINE_UPDATE.matcher(code);
        while (update.find()) {
            updated.add(update.group(1) != null ? update.group(1) : update.group(2));
        }

        Matcher identifier = IDENTIFIER.matcher(code);
        while (identifier.find()) {
            String name = identifier.group();
            if (updated.contains(name)) {
                accumulator.add(name, line, true, true);
            } else if (name.equals(assigned) && identifier.start() == assignment.start(1)) {
                accumulator.add(name, line, true, compound);
            } else {
                accumulator.add(name, line, false, true);
            }
        }
    }

    private final class Accumulator {
        private final Map<Occurrence, boolean[]> accesses = new LinkedHashMap<>();

        void add(String name, int line, boolean definition, boolean use) {
            if (name == null || name.isEmpty() || tokens.isKeyword(name)) return;
            boolean[] flags = accesses.computeIfAbsent(new Occurrence(name, line), key -> new boolean[2]);
            flags[0] |= definition;
            flags[1] |= use;
        }

        List<VariableAccess> toList() {
            return accesses.entrySet().stream()
                    .map(entry -> new VariableAccess(entry.getKey(), entry.getValue()[0], entry.getValue()[1]))
                    .sorted(Comparator.comparingInt(VariableAccess::getLine))
                    .collect(Collectors.toList());
        }
    }
}
