package org.dxworks.codeflow.analyzer;

import org.dxworks.codeflow.Language;
import org.dxworks.codeflow.model.BlockInfo;
import org.dxworks.codeflow.model.FileFlowAnalysis;
import org.dxworks.codeflow.model.ProcedureFlow;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.codeflow.TestUtils.analyzeSample;
import static org.dxworks.codeflow.TestUtils.block;
import static org.dxworks.codeflow.TestUtils.exitLabels;
import static org.dxworks.codeflow.TestUtils.exitTargets;
import static org.dxworks.codeflow.TestUtils.procedure;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PythonFlowAnalyzerTest {

    private static FileFlowAnalysis analysis;

    @BeforeAll
    static void analyze() throws IOException {
        analysis = analyzeSample("python/control_flow.py", Language.PYTHON);
    }

    @Test
    void locatesTopLevelFunctionsInOrder() {
        assertFalse(analysis.degraded);
        assertEquals("python", analysis.language);
        assertEquals(List.of("classify", "countdown", "outer", "route", "search"),
                analysis.procedures.stream().map(p -> p.name).collect(Collectors.toList()));
    }

    @Test
    void ifElse_branchesOnConditionAndItsNegation() {
        ProcedureFlow classify = procedure(analysis, "classify");

        BlockInfo condition = block(classify, "if x > 0:");
        assertEquals(List.of("x > 0", "!(x > 0)"), exitLabels(condition));
        assertEquals(2, classify.finalBlocks.size());
        assertEquals(2, classify.pathCount);
        assertEquals(1, classify.line);
    }

    @Test
    void whileLoop_bodyLeadsBackToGuard() {
        ProcedureFlow countdown = procedure(analysis, "countdown");

        BlockInfo guard = block(countdown, "while x > 0:");
        BlockInfo body = block(countdown, "x -= 1");
        assertEquals(List.of(guard.id), exitTargets(body));
        assertEquals(List.of("x > 0", "!(x > 0)"), exitLabels(guard));
        assertEquals(1, countdown.pathCount);
        assertEquals(List.of(block(countdown, "return x").id), countdown.finalBlocks);
    }

    @Test
    void whileLoop_defUsePathsStartAtParameterBlock() {
        List<String> defUse = procedure(analysis, "countdown").defUsePaths.stream()
                .map(p -> p.variable + " " + p.definitionLine + "@" + p.definitionBlock
                        + " -> " + p.useLine + "@" + p.useBlock + " via " + p.blocks)
                .collect(Collectors.toList());

        assertTrue(defUse.contains("x 8@0 -> 9@1 via [0, 1]"), defUse::toString);
        assertTrue(defUse.contains("x 8@0 -> 11@3 via [0, 1, 3]"), defUse::toString);
        assertTrue(defUse.contains("x 10@2 -> 9@1 via [2, 1]"), defUse::toString);
    }

    @Test
    void nestedFunction_isAnalyzedUnderItsParent() {
        ProcedureFlow outer = procedure(analysis, "outer");

        assertEquals(1, outer.nestedProcedures.size());
        ProcedureFlow inner = outer.nestedProcedures.get(0);
        assertEquals("outer.inner", inner.name);
        assertEquals(1, inner.finalBlocks.size());
        assertEquals(List.of("(b, 15) -> (b, 16)"), inner.dataFlowPaths.get("b"));
        assertTrue(block(outer, "def inner(b):").source.endsWith("return inner(a)"));
    }

    @Test
    void match_dispatchesOnCasePatterns() {
        ProcedureFlow route = procedure(analysis, "route");

        BlockInfo dispatch = block(route, "match command:");
        assertEquals(Arrays.asList("\"start\"", "\"stop\"", "_", null), exitLabels(dispatch));
        assertEquals(List.of(block(route, "return command").id), route.finalBlocks);
        assertEquals(List.of("(command, 20) -> (command, 21) -> (command, 28)"),
                route.dataFlowPaths.get("command"));
    }

    @Test
    void forElse_breakSkipsElseClause() {
        ProcedureFlow search = procedure(analysis, "search");

        BlockInfo guard = block(search, "for item in items:");
        assertEquals(Arrays.asList(null, null), exitLabels(guard));
        assertEquals(List.of(block(search, "return item").id), exitTargets(block(search, "break")));
        assertEquals(List.of("item == wanted", "!(item == wanted)"), exitLabels(block(search, "if item == wanted:")));
        assertTrue(search.finalBlocks.contains(block(search, "return None").id));
        assertEquals(2, search.finalBlocks.size());
    }
}
