package org.dxworks.codeflow.cfg;

import org.dxworks.codeflow.ast.AstHelper;
import org.dxworks.codeflow.ast.AstNode;
import org.dxworks.codeflow.ast.NodeKind;
import org.dxworks.codeflow.model.Block;
import org.dxworks.codeflow.model.Cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the control-flow graph of one procedure from its syntax tree.
 * <p>
 * A builder carries the state of a single build. Building again requires {@link #reset()};
 * otherwise {@link IllegalStateException} is raised. Nested procedures are built by fresh
 * builders and attached to the enclosing graph by name.
 */
public class CfgBuilder {

    private static final Pattern SIMPLE_NEGATION = Pattern.compile("![\\w.]+");

    private final boolean separateNodeBlocks;
    private final boolean modelSwitchFallthrough;

    private final Deque<Block> loopGuardStack = new ArrayDeque<>();
    private final Deque<Block> afterLoopStack = new ArrayDeque<>();
    private final Deque<Block> afterSwitchStack = new ArrayDeque<>();
    private final Map<String, Block> labelledGuards = new HashMap<>();
    private final Map<String, Block> labelledExits = new HashMap<>();

    private Cfg cfg;
    private Block currentBlock;
    private String pendingLabel;
    private int nextId;

    public CfgBuilder() {
        this(false, false);
    }

    /**
     * @param separateNodeBlocks     put every simple statement in a block of its own
     * @param modelSwitchFallthrough let a case group without break flow into the next case
     */
    public CfgBuilder(boolean separateNodeBlocks, boolean modelSwitchFallthrough) {
        this.separateNodeBlocks = separateNodeBlocks;
        this.modelSwitchFallthrough = modelSwitchFallthrough;
    }

    public Cfg build(String name, AstNode procedure) {
        start(name, procedure);
        AstNode body = procedure.child("body");
        if (body != null) {
            visit(body);
        }
        if (!currentBlock.isEmpty() && !currentBlock.hasExits()) {
            cfg.addFinalBlock(currentBlock);
        }
        GraphNormalizer.normalize(cfg);
        return cfg;
    }

    /**
     * Degraded build: one block per child of {@code body}, chained in order, the last one final.
     */
    public Cfg buildSequential(String name, AstNode body) {
        start(name, null);
        for (AstNode line : body.namedChildren()) {
            if (!currentBlock.isEmpty()) {
                Block next = newBlock();
                currentBlock.addExit(next, null);
                currentBlock = next;
            }
            currentBlock.addStatement(line);
        }
        if (!currentBlock.isEmpty()) {
            cfg.addFinalBlock(currentBlock);
        }
        GraphNormalizer.normalize(cfg);
        return cfg;
    }

    public void reset() {
        cfg = null;
        currentBlock = null;
        nextId = 0;
        loopGuardStack.clear();
        afterLoopStack.clear();
        afterSwitchStack.clear();
        labelledGuards.clear();
        labelledExits.clear();
        pendingLabel = null;
    }

    private void start(String name, AstNode procedure) {
        if (cfg != null) {
            throw new IllegalStateException("CfgBuilder already built " + cfg.getName() + "; call reset() before building again");
        }
        reset();
        cfg = new Cfg(name, procedure);
        currentBlock = newBlock();
        cfg.setEntryBlock(currentBlock);
    }

    private Block newBlock() {
        Block block = new Block(++nextId);
        cfg.addBlock(block);
        return block;
    }

    private void visit(AstNode node) {
        switch (node.kind()) {
            case BLOCK -> visitBlock(node);
            case IF -> visitIf(node);
            case ELSE -> visit(requireChild(node, "body"));
            case WHILE, FOR, FOR_EACH -> visitLoop(node);
            case SWITCH -> visitSwitch(node);
            case RETURN, THROW -> visitExit(node);
            case BREAK -> visitBreak(node);
            case CONTINUE -> visitContinue(node);
            case LABELED -> visitLabeled(node);
            case PROCEDURE, CLASS -> visitNestedDefinition(node, node);
            case DECORATED -> visitDecorated(node);
            case EXPRESSION -> visitExpression(node);
            case COMMENT -> {
            }
            case CASE, CASE_ARM, LABEL, DECLARATION, DECLARATOR, ASSIGNMENT, UPDATE, IDENTIFIER,
                    STRING_LITERAL, LINE, OTHER -> visitGeneric(node);
        }
    }

    private void visitGeneric(AstNode node) {
        currentBlock.addStatement(node);
        if (separateNodeBlocks) {
            Block next = newBlock();
            currentBlock.addExit(next, null);
            currentBlock = next;
        }
    }

    private void visitBlock(AstNode node) {
        for (AstNode child : node.namedChildren()) {
            visit(child);
        }
    }

    /**
     * {@code label: statement}; the label comes first, the labelled statement last. A label on a
     * loop or switch becomes a target for {@code break label} and {@code continue label}.
     */
    private void visitLabeled(AstNode node) {
        List<AstNode> children = node.namedChildren();
        if (children.size() < 2) {
            throw new MalformedNodeException(node, "statement");
        }
        AstNode statement = children.get(children.size() - 1);
        if (AstHelper.isKindOneOf(statement, NodeKind.WHILE, NodeKind.FOR, NodeKind.FOR_EACH, NodeKind.SWITCH)) {
            pendingLabel = children.get(0).text();
        }
        visit(statement);
    }

    private void visitExpression(AstNode node) {
        List<AstNode> children = node.namedChildren();
        if (children.size() == 1 && children.get(0).kind() == NodeKind.SWITCH) {
            visitSwitch(children.get(0));
        } else {
            visitGeneric(node);
        }
    }

    private void visitIf(AstNode node) {
        currentBlock.addStatement(node);
        visitConditional(node, node.children("alternative"));
    }

    /**
     * Branches on {@code node}'s condition, already recorded in the current block. An {@code elif}
     * among the alternatives becomes a nested conditional in the else block that inherits the
     * alternatives following it.
     */
    private void visitConditional(AstNode node, List<AstNode> alternatives) {
        String condition = conditionText(requireChild(node, "condition"));
        Block conditionBlock = currentBlock;
        Block ifBlock = newBlock();
        conditionBlock.addExit(ifBlock, condition);
        Block afterIf = newBlock();

        if (alternatives.isEmpty()) {
            conditionBlock.addExit(afterIf, negate(condition));
        } else {
            Block elseBlock = newBlock();
            conditionBlock.addExit(elseBlock, negate(condition));
            currentBlock = elseBlock;

            AstNode alternative = alternatives.get(0);
            if (alternative.kind() == NodeKind.IF) {
                currentBlock.addStatement(alternative);
                List<AstNode> remaining = new ArrayList<>(alternative.children("alternative"));
                remaining.addAll(alternatives.subList(1, alternatives.size()));
                visitConditional(alternative, remaining);
            } else {
                visit(alternative);
            }
            if (!currentBlock.hasExits()) {
                currentBlock.addExit(afterIf, null);
            }
        }

        currentBlock = ifBlock;
        visit(requireChild(node, "consequence"));
        if (!currentBlock.hasExits()) {
            currentBlock.addExit(afterIf, null);
        }
        currentBlock = afterIf;
    }

    private void visitLoop(AstNode node) {
        String label = takePendingLabel();
        Block loopGuard = newLoopGuard();
        loopGuard.addStatement(node);

        AstNode conditionNode = node.kind() == NodeKind.WHILE ? requireChild(node, "condition") : node.child("condition");
        String condition = conditionNode == null ? null : conditionText(conditionNode);
        String exitCondition = condition == null ? null : negate(condition);

        Block bodyBlock = newBlock();
        loopGuard.addExit(bodyBlock, condition);
        Block afterLoop = newBlock();

        AstNode orElse = node.child("alternative");
        Block elseBlock = null;
        if (orElse != null) {
            elseBlock = newBlock();
            loopGuard.addExit(elseBlock, exitCondition);
        } else {
            loopGuard.addExit(afterLoop, exitCondition);
        }

        AstNode body = requireChild(node, "body");
        loopGuardStack.push(loopGuard);
        afterLoopStack.push(afterLoop);
        if (label != null) {
            labelledGuards.put(label, loopGuard);
            labelledExits.put(label, afterLoop);
        }
        try {
            currentBlock = bodyBlock;
            visit(body);
            if (!currentBlock.hasExits()) {
                currentBlock.addExit(loopGuard, null);
            }
        } finally {
            loopGuardStack.pop();
            afterLoopStack.pop();
            if (label != null) {
                labelledGuards.remove(label);
                labelledExits.remove(label);
            }
        }

        if (elseBlock != null) {
            currentBlock = elseBlock;
            visit(orElse);
            if (!currentBlock.hasExits()) {
                currentBlock.addExit(afterLoop, null);
            }
        }
        currentBlock = afterLoop;
    }

    /** The current block if it is still blank, otherwise a new block entered from it. */
    private Block newLoopGuard() {
        if (currentBlock.isEmpty() && !currentBlock.hasExits()) {
            return currentBlock;
        }
        Block loopGuard = newBlock();
        currentBlock.addExit(loopGuard, null);
        currentBlock = loopGuard;
        return loopGuard;
    }

    private void visitSwitch(AstNode node) {
        String label = takePendingLabel();
        currentBlock.addStatement(node);
        AstNode body = requireChild(node, "body");
        List<AstNode> groups = body.namedChildren().stream()
                .filter(child -> AstHelper.isKindOneOf(child, NodeKind.CASE, NodeKind.CASE_ARM))
                .collect(Collectors.toList());

        Block afterSwitch = newBlock();
        if (groups.isEmpty()) {
            currentBlock.addExit(afterSwitch, null);
            currentBlock = afterSwitch;
            return;
        }

        afterSwitchStack.push(afterSwitch);
        if (label != null) {
            labelledExits.put(label, afterSwitch);
        }
        try {
            Block dispatch = currentBlock;
            Block fallthrough = null;
            for (int i = 0; i < groups.size(); i++) {
                AstNode group = groups.get(i);
                boolean last = i == groups.size() - 1;

                Block caseBlock = newBlock();
                dispatch.addExit(caseBlock, caseLabel(group));
                if (fallthrough != null) {
                    fallthrough.addExit(caseBlock, null);
                    fallthrough = null;
                }
                Block nextDispatch = last ? afterSwitch : newBlock();
                dispatch.addExit(nextDispatch, null);

                currentBlock = caseBlock;
                for (AstNode statement : group.namedChildren()) {
                    if (statement.kind() != NodeKind.LABEL) {
                        visit(statement);
                    }
                }
                if (!currentBlock.hasExits()) {
                    if (modelSwitchFallthrough && group.kind() == NodeKind.CASE && !last) {
                        fallthrough = currentBlock;
                    } else {
                        currentBlock.addExit(afterSwitch, null);
                    }
                }
                dispatch = nextDispatch;
            }
        } finally {
            afterSwitchStack.pop();
            if (label != null) {
                labelledExits.remove(label);
            }
        }
        currentBlock = afterSwitch;
    }

    private void visitExit(AstNode node) {
        currentBlock.addStatement(node);
        cfg.addFinalBlock(currentBlock);
        currentBlock = newBlock();
    }

    /**
     * A labelled break leaves the loop or switch carrying its label. Otherwise it links to the
     * innermost after-switch block while any switch is open, else to the innermost after-loop
     * block, so a loop nested in a case breaks out of the switch.
     */
    private void visitBreak(AstNode node) {
        currentBlock.addStatement(node);
        Block target = labelledExits.get(jumpLabel(node));
        if (target == null) {
            target = !afterSwitchStack.isEmpty() ? afterSwitchStack.peek() : afterLoopStack.peek();
        }
        if (target == null) {
            cfg.addDiagnostic("break outside loop or switch at line " + node.line() + " ignored");
            return;
        }
        currentBlock.addExit(target, null);
    }

    private void visitContinue(AstNode node) {
        currentBlock.addStatement(node);
        Block loopGuard = labelledGuards.get(jumpLabel(node));
        if (loopGuard == null) {
            loopGuard = loopGuardStack.peek();
        }
        if (loopGuard == null) {
            cfg.addDiagnostic("continue outside loop at line " + node.line() + " ignored");
            return;
        }
        currentBlock.addExit(loopGuard, null);
    }

    private void visitDecorated(AstNode node) {
        AstNode definition = node.child("definition");
        if (definition == null) {
            visitGeneric(node);
        } else {
            visitNestedDefinition(node, definition);
        }
    }

    /**
     * Records {@code statement} and builds separate graphs for the procedure it defines, or for
     * the methods of the class it defines.
     */
    private void visitNestedDefinition(AstNode statement, AstNode definition) {
        currentBlock.addStatement(statement);
        if (definition.kind() == NodeKind.PROCEDURE) {
            String name = procedureName(definition);
            cfg.addFunctionCfg(name, newNestedBuilder().build(name, definition));
        } else if (definition.kind() == NodeKind.CLASS) {
            String className = procedureName(definition);
            AstNode body = definition.child("body");
            if (body == null) return;
            for (AstNode member : body.namedChildren()) {
                AstNode method = member.kind() == NodeKind.DECORATED ? member.child("definition") : member;
                if (method != null && method.kind() == NodeKind.PROCEDURE) {
                    String name = className + "." + procedureName(method);
                    cfg.addFunctionCfg(name, newNestedBuilder().build(name, method));
                }
            }
        }
    }

    private String takePendingLabel() {
        String label = pendingLabel;
        pendingLabel = null;
        return label;
    }

    /** The label of {@code break label} or {@code continue label}, or an empty string. */
    private static String jumpLabel(AstNode jump) {
        AstNode label = AstHelper.findFirstChild(jump, NodeKind.IDENTIFIER);
        return label != null ? label.text() : "";
    }

    private CfgBuilder newNestedBuilder() {
        return new CfgBuilder(separateNodeBlocks, modelSwitchFallthrough);
    }

    public static String procedureName(AstNode definition) {
        AstNode name = definition.child("name");
        return name != null ? name.text() : "<anonymous@" + definition.line() + ">";
    }

    private static String caseLabel(AstNode group) {
        List<String> labels = new ArrayList<>();
        for (AstNode child : group.namedChildren()) {
            if (child.kind() == NodeKind.LABEL) {
                labels.add(AstHelper.normalizeInline(child.text()));
            }
        }
        return labels.isEmpty() ? null : String.join(", ", labels);
    }

    static String conditionText(AstNode condition) {
        return AstHelper.stripEnclosingParentheses(AstHelper.normalizeInline(condition.text()));
    }

    /**
     * Syntactic negation: {@code !(c)} and {@code !name} lose their {@code !}, anything else is
     * wrapped as {@code !(c)}.
     */
    static String negate(String condition) {
        if (condition.startsWith("!(") && AstHelper.closingParenthesis(condition, 1) == condition.length() - 1) {
            return condition.substring(2, condition.length() - 1);
        }
        if (SIMPLE_NEGATION.matcher(condition).matches()) {
            return condition.substring(1);
        }
        return "!(" + condition + ")";
    }

    private static AstNode requireChild(AstNode node, String role) {
        AstNode child = node.child(role);
        if (child == null) {
            throw new MalformedNodeException(node, role);
        }
        return child;
    }
}
