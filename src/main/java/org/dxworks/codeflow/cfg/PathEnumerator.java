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
 * Enumerates block routes from the entry to a final block or a block without exits.
 * <p>
 * A block already on the current route is never entered again, so each route passes through a
 * loop body at most once. Routes longer than {@code maxDepth} blocks are not explored and
 * enumeration stops after {@code maxPaths} routes.
 */
public class PathEnumerator {

    private final int maxDepth;
    private final int maxPaths;

    public PathEnumerator(int maxDepth, int maxPaths) {
        if (maxDepth <= 0 || maxPaths <= 0) {
            throw new IllegalArgumentException("Path bounds must be positive");
        }
        this.maxDepth = maxDepth;
        this.maxPaths = maxPaths;
    }

    public List<List<Block>> enumerate(Cfg cfg) {
        List<List<Block>> routes = new ArrayList<>();
        Block entry = cfg.getEntryBlock();
        if (entry == null) return routes;

        Deque<Frame> stack = new ArrayDeque<>();
        List<Block> route = new ArrayList<>();
        BitSet onRoute = new BitSet();
        push(stack, route, onRoute, entry);

        while (!stack.isEmpty() && routes.size() < maxPaths) {
            Frame frame = stack.peek();
            Block block = frame.block;

            if (frame.nextExit == 0 && isTerminal(cfg, block)) {
                routes.add(List.copyOf(route));
                pop(stack, route, onRoute);
                continue;
            }

            List<Link> exits = block.getExits();
            if (frame.nextExit < exits.size()) {
                Block target = exits.get(frame.nextExit++).getTarget();
                if (!onRoute.get(target.getId()) && route.size() < maxDepth) {
                    push(stack, route, onRoute, target);
                }
            } else {
                pop(stack, route, onRoute);
            }
        }
        return routes;
    }

    private static boolean isTerminal(Cfg cfg, Block block) {
        return cfg.isFinal(block) || !block.hasExits();
    }

    private static void push(Deque<Frame> stack, List<Block> route, BitSet onRoute, Block block) {
        stack.push(new Frame(block));
        route.add(block);
        onRoute.set(block.getId());
    }

    private static void pop(Deque<Frame> stack, List<Block> route, BitSet onRoute) {
        Frame frame = stack.pop();
        route.remove(route.size() - 1);
        onRoute.clear(frame.block.getId());
    }

    private static final class Frame {
        private final Block block;
        private int nextExit;

        private Frame(Block block) {
            this.block = block;
        }
    }
}
