package org.dxworks.codeflow.dfg;

import org.dxworks.codeflow.ast.AstNode;
import org.dxworks.codeflow.model.Block;
import org.dxworks.codeflow.model.Cfg;
import org.dxworks.codeflow.model.DefUsePath;
import org.dxworks.codeflow.model.Link;
import org.dxworks.codeflow.model.Occurrence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Finds block routes from each definition of a variable to each of its uses in another block.
 * <p>
 * The search is breadth-first, never repeats a block within a route and gives up on routes longer
 * than {@code maxDepth} blocks. Parameters are defined in {@link #PARAMETER_BLOCK}, which leads to
 * the entry block.
 */
public class DefUseAnalyzer {

    public static final int PARAMETER_BLOCK = 0;

    private final VariableExtractor extractor;
    private final int maxDepth;
    private final int maxPathsPerPair;

    public DefUseAnalyzer(VariableExtractor extractor, int maxDepth, int maxPathsPerPair) {
        this.extractor = extractor;
        this.maxDepth = maxDepth;
        this.maxPathsPerPair = maxPathsPerPair;
    }

    public List<DefUsePath> analyze(Cfg cfg, List<Occurrence> parameters, Set<String> tracked) {
        Map<String, Set<Site>> definitions = new LinkedHashMap<>();
        Map<String, Set<Site>> uses = new LinkedHashMap<>();

        for (Occurrence parameter : parameters) {
            definitions.computeIfAbsent(parameter.getName(), name -> new LinkedHashSet<>())
                    .add(new Site(PARAMETER_BLOCK, parameter.getLine()));
        }
        for (Block block : cfg.blocks()) {
            for (AstNode statement : block.getStatements()) {
                for (VariableAccess access : extractor.accesses(statement)) {
                    if (tracked != null && !tracked.contains(access.getName())) continue;
                    Site site = new Site(block.getId(), access.getLine());
                    if (access.isDefinition()) {
                        definitions.computeIfAbsent(access.getName(), name -> new LinkedHashSet<>()).add(site);
                    }
                    if (access.isUse()) {
                        uses.computeIfAbsent(access.getName(), name -> new LinkedHashSet<>()).add(site);
                    }
                }
            }
        }

        List<DefUsePath> result = new ArrayList<>();
        for (Map.Entry<String, Set<Site>> variable : definitions.entrySet()) {
            Set<Site> variableUses = uses.getOrDefault(variable.getKey(), Collections.emptySet());
            for (Site definition : variable.getValue()) {
                for (Site use : variableUses) {
                    if (definition.block == use.block) continue;
                    for (List<Integer> route : findRoutes(cfg, definition.block, use.block)) {
                        DefUsePath path = new DefUsePath();
                        path.variable = variable.getKey();
                        path.definitionBlock = definition.block;
                        path.definitionLine = definition.line;
                        path.useBlock = use.block;
                        path.useLine = use.line;
                        path.blocks = route;
                        result.add(path);
                    }
                }
            }
        }
        return result;
    }

    List<List<Integer>> findRoutes(Cfg cfg, int from, int to) {
        List<List<Integer>> routes = new ArrayList<>();
        Deque<List<Integer>> queue = new ArrayDeque<>();
        queue.add(List.of(from));
        int budget = maxPathsPerPair * maxDepth;

        while (!queue.isEmpty() && routes.size() < maxPathsPerPair && budget-- > 0) {
            List<Integer> route = queue.poll();
            int last = route.get(route.size() - 1);
            if (last == to) {
                routes.add(route);
                continue;
            }
            if (route.size() >= maxDepth) continue;

            for (int successor : successors(cfg, last)) {
                if (!route.contains(successor)) {
                    List<Integer> extended = new ArrayList<>(route);
                    extended.add(successor);
                    queue.add(extended);
                }
            }
        }
        return routes;
    }

    private static List<Integer> successors(Cfg cfg, int blockId) {
        if (blockId == PARAMETER_BLOCK) {
            return cfg.getEntryBlock() == null ? List.of() : List.of(cfg.getEntryBlock().getId());
        }
        Block block = cfg.getBlock(blockId);
        if (block == null) return List.of();
        List<Integer> successors = new ArrayList<>();
        for (Link exit : block.getExits()) {
            if (!successors.contains(exit.getTarget().getId())) {
                successors.add(exit.getTarget().getId());
            }
        }
        return successors;
    }

    private static final class Site {
        private final int block;
        private final int line;

        private Site(int block, int line) {
            this.block = block;
            this.line = line;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Site)) return false;
            Site site = (Site) o;
            return block == site.block && line == site.line;
        }

        @Override
        public int hashCode() {
            return Objects.hash(block, line);
        }
    }
}
