package org.dxworks.codeflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codeflow.analyzer.FlowAnalyzer;
import org.dxworks.codeflow.model.BlockInfo;
import org.dxworks.codeflow.model.EdgeInfo;
import org.dxworks.codeflow.model.FileFlowAnalysis;
import org.dxworks.codeflow.model.ProcedureFlow;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.fail;

public class TestUtils {
    public static final ObjectMapper MAPPER = new ObjectMapper();

    public static FileFlowAnalysis analyzeSample(String relativePath, Language language) throws IOException {
        Path file = Paths.get("src/test/resources/samples").resolve(relativePath);
        return App.analyzeFile(file, language, new FlowAnalyzer(CodeflowConfig.defaults()));
    }

    public static ProcedureFlow procedure(FileFlowAnalysis analysis, String name) {
        for (ProcedureFlow flow : analysis.procedures) {
            if (flow.name.equals(name)) {
                return flow;
            }
            for (ProcedureFlow nested : flow.nestedProcedures) {
                if (nested.name.equals(name)) {
                    return nested;
                }
            }
        }
        return fail("no procedure " + name);
    }

    /** The block whose source starts with {@code prefix}. */
    public static BlockInfo block(ProcedureFlow flow, String prefix) {
        return flow.blocks.stream()
                .filter(block -> block.source.startsWith(prefix))
                .findFirst()
                .orElseGet(() -> fail("no block starting with " + prefix));
    }

    public static List<String> exitLabels(BlockInfo block) {
        List<String> labels = new ArrayList<>();
        for (EdgeInfo edge : block.exits) {
            labels.add(edge.exitcase);
        }
        return labels;
    }

    public static List<Integer> exitTargets(BlockInfo block) {
        List<Integer> targets = new ArrayList<>();
        for (EdgeInfo edge : block.exits) {
            targets.add(edge.target);
        }
        return targets;
    }
}
