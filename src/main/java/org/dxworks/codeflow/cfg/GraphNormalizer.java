package org.dxworks.codeflow.cfg;

import org.dxworks.codeflow.model.Block;
import org.dxworks.codeflow.model.Cfg;
import org.dxworks.codeflow.model.Link;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Removes empty blocks by linking their predecessors straight to their successors, then drops
 * whatever is no longer reachable from the entry. The entry block is never removed.
 */
public final class GraphNormalizer {

    private GraphNormalizer() {
    }

    public static void normalize(Cfg cfg) {
        Block entry = cfg.getEntryBlock();
        if (entry == null) return;

        BitSet visited = new BitSet();
        Deque<Block> worklist = new ArrayDeque<>();
        worklist.push(entry);
        while (!worklist.isEmpty()) {
            Block block = worklist.pop();
            if (visited.get(block.getId())) continue;
            visited.set(block.getId());

            List<Block> successors = new ArrayList<>();
            for (Link exit : block.getExits()) {
                successors.add(exit.getTarget());
            }
            if (block.isEmpty() && block != entry) {
                splice(block);
            }
            for (int i = successors.size() - 1; i >= 0; i--) {
                worklist.push(successors.get(i));
            }
        }
        cfg.retainReachable();
    }

    /**
     * Replaces every (incoming, outgoing) pair of links through {@code block} with one direct link
     * and detaches the block. The outgoing label wins; an unlabeled exit keeps the incoming label.
     */
    private static void splice(Block block) {
        List<Link> incoming = new ArrayList<>(block.getPredecessors());
        List<Link> outgoing = new ArrayList<>(block.getExits());

        for (Link predecessor : incoming) {
            if (predecessor.getSource() == block) continue;
            for (Link exit : outgoing) {
                if (exit.getTarget() == block) continue;
                String exitcase = exit.getExitcase() != null ? exit.getExitcase() : predecessor.getExitcase();
                predecessor.getSource().addExit(exit.getTarget(), exitcase);
            }
        }
        for (Link predecessor : incoming) {
            predecessor.getSource().removeExit(predecessor);
        }
        for (Link exit : outgoing) {
            if (block.getExits().contains(exit)) {
                block.removeExit(exit);
            }
        }
    }
}
