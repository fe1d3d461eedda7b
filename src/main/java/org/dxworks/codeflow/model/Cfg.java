package org.dxworks.codeflow.model;

import org.dxworks.codeflow.ast.AstNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control-flow graph of one procedure. The graph owns its blocks, addressed by id.
 */
public final class Cfg {

    private final String name;
    private final AstNode procedure;
    private final Map<Integer, Block> blocks = new LinkedHashMap<>();
    private final List<Block> finalBlocks = new ArrayList<>();
    private final Map<String, Cfg> functionCfgs = new LinkedHashMap<>();
    private final List<String> diagnostics = new ArrayList<>();
    private Block entryBlock;

    public Cfg(String name, AstNode procedure) {
        this.name = name;
        this.procedure = procedure;
    }

    public String getName() {
        return name;
    }

    /** Declaration this graph was built from; {@code null} for graphs built from raw lines. */
    public AstNode getProcedure() {
        return procedure;
    }

    public Block getEntryBlock() {
        return entryBlock;
    }

    public void setEntryBlock(Block entryBlock) {
        this.entryBlock = entryBlock;
    }

    public void addBlock(Block block) {
        if (blocks.putIfAbsent(block.getId(), block) != null) {
            throw new IllegalArgumentException("Duplicate block id " + block.getId() + " in " + name);
        }
    }

    public Block getBlock(int id) {
        return blocks.get(id);
    }

    /** Every block of the arena, in creation order. */
    public Collection<Block> getAllBlocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    public List<Block> getFinalBlocks() {
        return Collections.unmodifiableList(finalBlocks);
    }

    public void addFinalBlock(Block block) {
        if (!finalBlocks.contains(block)) {
            finalBlocks.add(block);
        }
    }

    public boolean isFinal(Block block) {
        return finalBlocks.contains(block);
    }

    public Map<String, Cfg> getFunctionCfgs() {
        return Collections.unmodifiableMap(functionCfgs);
    }

    public void addFunctionCfg(String functionName, Cfg cfg) {
        functionCfgs.put(functionName, cfg);
    }

    public List<String> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public void addDiagnostic(String diagnostic) {
        diagnostics.add(diagnostic);
    }

    /** Blocks reachable from the entry, in breadth-first order. */
    public List<Block> blocks() {
        List<Block> result = new ArrayList<>();
        if (entryBlock == null) return result;

        BitSet visited = new BitSet();
        Deque<Block> queue = new ArrayDeque<>();
        queue.add(entryBlock);
        visited.set(entryBlock.getId());
        while (!queue.isEmpty()) {
            Block block = queue.poll();
            result.add(block);
            for (Link exit : block.getExits()) {
                Block target = exit.getTarget();
                if (!visited.get(target.getId())) {
                    visited.set(target.getId());
                    queue.add(target);
                }
            }
        }
        return result;
    }

    /** Links leaving reachable blocks, in block order. */
    public List<Link> links() {
        List<Link> result = new ArrayList<>();
        for (Block block : blocks()) {
            result.addAll(block.getExits());
        }
        return result;
    }

    /**
     * Drops every block not reachable from the entry, together with its links.
     */
    public void retainReachable() {
        BitSet reachable = new BitSet();
        for (Block block : blocks()) {
            reachable.set(block.getId());
        }

        List<Block> unreachable = new ArrayList<>();
        for (Block block : blocks.values()) {
            if (!reachable.get(block.getId())) {
                unreachable.add(block);
            }
        }
        for (Block block : unreachable) {
            for (Link exit : new ArrayList<>(block.getExits())) {
                block.removeExit(exit);
            }
            for (Link predecessor : new ArrayList<>(block.getPredecessors())) {
                predecessor.getSource().removeExit(predecessor);
            }
            blocks.remove(block.getId());
        }
        finalBlocks.removeIf(block -> !reachable.get(block.getId()));
    }

    @Override
    public String toString() {
        return "CFG for " + name;
    }
}
