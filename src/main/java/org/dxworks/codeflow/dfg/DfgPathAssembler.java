package org.dxworks.codeflow.dfg;

import org.dxworks.codeflow.ast.AstNode;
import org.dxworks.codeflow.model.Block;
import org.dxworks.codeflow.model.DfgPath;
import org.dxworks.codeflow.model.Occurrence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns enumerated block routes into data-flow paths.
 * <p>
 * In {@link AssemblyMode#SEPARATED} mode every seeded variable gets one path per route, and every
 * other variable met on a route gets a path of its own. In {@link AssemblyMode#JOINT} mode a route
 * yields a single path with all its occurrences. Equal paths are kept once, in first-seen order.
 */
public class DfgPathAssembler {

    private final VariableExtractor extractor;
    private final AssemblyMode mode;

    public DfgPathAssembler(VariableExtractor extractor, AssemblyMode mode) {
        this.extractor = extractor;
        this.mode = mode;
    }

    /**
     * @param routes           block routes from {@code PathEnumerator}
     * @param startOccurrences seeds, usually the formal parameters at the declaration line
     * @param tracked          names to report, or {@code null} for all
     */
    public List<DfgPath> assemble(List<List<Block>> routes, List<Occurrence> startOccurrences, Set<String> tracked) {
        Map<Block, List<Occurrence>> blockOccurrences = new IdentityHashMap<>();
        Set<DfgPath> paths = new LinkedHashSet<>();

        if (mode == AssemblyMode.JOINT) {
            for (List<Block> route : routes) {
                List<Occurrence> path = new ArrayList<>();
                startOccurrences.forEach(seed -> append(path, seed));
                for (Block block : route) {
                    occurrencesOf(block, tracked, blockOccurrences).forEach(occurrence -> append(path, occurrence));
                }
                addIfNotEmpty(paths, path);
            }
            return new ArrayList<>(paths);
        }

        Map<String, List<Occurrence>> seeds = new LinkedHashMap<>();
        for (Occurrence seed : startOccurrences) {
            seeds.computeIfAbsent(seed.getName(), name -> new ArrayList<>()).add(seed);
        }

        for (Map.Entry<String, List<Occurrence>> seed : seeds.entrySet()) {
            for (List<Block> route : routes) {
                List<Occurrence> path = new ArrayList<>();
                seed.getValue().forEach(occurrence -> append(path, occurrence));
                for (Block block : route) {
                    for (Occurrence occurrence : occurrencesOf(block, tracked, blockOccurrences)) {
                        if (occurrence.getName().equals(seed.getKey())) {
                            append(path, occurrence);
                        }
                    }
                }
                addIfNotEmpty(paths, path);
            }
        }

        for (List<Block> route : routes) {
            Map<String, List<Occurrence>> byVariable = new LinkedHashMap<>();
            for (Block block : route) {
                for (Occurrence occurrence : occurrencesOf(block, tracked, blockOccurrences)) {
                    if (!seeds.containsKey(occurrence.getName())) {
                        append(byVariable.computeIfAbsent(occurrence.getName(), name -> new ArrayList<>()), occurrence);
                    }
                }
            }
            byVariable.values().forEach(path -> addIfNotEmpty(paths, path));
        }
        return new ArrayList<>(paths);
    }

    /** Groups paths by owning variable; groups and paths keep first-seen order. */
    public static Map<String, List<DfgPath>> groupByVariable(Collection<DfgPath> paths) {
        Map<String, List<DfgPath>> grouped = new LinkedHashMap<>();
        for (DfgPath path : paths) {
            grouped.computeIfAbsent(path.getVariable(), name -> new ArrayList<>()).add(path);
        }
        return grouped;
    }

    private List<Occurrence> occurrencesOf(Block block, Set<String> tracked, Map<Block, List<Occurrence>> cache) {
        return cache.computeIfAbsent(block, key -> {
            Set<Occurrence> occurrences = new LinkedHashSet<>();
            for (AstNode statement : key.getStatements()) {
                occurrences.addAll(extractor.extract(statement, tracked));
            }
            return new ArrayList<>(occurrences);
        });
    }

    /** Appends unless it repeats the last occurrence. */
    private static void append(List<Occurrence> path, Occurrence occurrence) {
        if (path.isEmpty() || !path.get(path.size() - 1).equals(occurrence)) {
            path.add(occurrence);
        }
    }

    private static void addIfNotEmpty(Set<DfgPath> paths, List<Occurrence> path) {
        if (!path.isEmpty()) {
            paths.add(new DfgPath(path));
        }
    }
}
