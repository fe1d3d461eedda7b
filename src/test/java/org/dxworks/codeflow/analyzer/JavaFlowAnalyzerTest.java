package org.dxworks.codeflow.analyzer;

import org.dxworks.codeflow.CodeflowConfig;
import org.dxworks.codeflow.Language;
import org.dxworks.codeflow.model.BlockInfo;
import org.dxworks.codeflow.model.FileFlowAnalysis;
import org.dxworks.codeflow.model.ProcedureFlow;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
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

public class JavaFlowAnalyzerTest {

    private static FileFlowAnalysis analysis;

    @BeforeAll
    static void analyze() throws IOException {
        analysis = analyzeSample("java/Dispatcher.java", Language.JAVA);
    }

    @Test
    void methodsAreNamedAfterEnclosingClasses() {
        assertFalse(analysis.degraded);
        assertEquals(List.of("Dispatcher.classify", "Dispatcher.countdown", "Dispatcher.dispatch",
                        "Dispatcher.sum", "Dispatcher.Counter.next"),
                analysis.procedures.stream().map(p -> p.name).collect(Collectors.toList()));
    }

    @Test
    void ifElse_conditionLosesItsParentheses() {
        ProcedureFlow classify = procedure(analysis, "Dispatcher.classify");

        assertEquals(List.of("x > 0", "!(x > 0)"), exitLabels(block(classify, "if (x > 0) {")));
        assertEquals(2, classify.finalBlocks.size());
    }

    @Test
    void whileLoop_bodyLeadsBackToGuard() {
        ProcedureFlow countdown = procedure(analysis, "Dispatcher.countdown");

        BlockInfo guard = block(countdown, "while (x > 0) {");
        assertEquals(List.of(guard.id), exitTargets(block(countdown, "x--;")));
        assertEquals(1, countdown.pathCount);
        assertEquals(1, countdown.finalBlocks.size());
    }

    @Test
    void switch_dispatchesOnCaseLabelsAndRejoinsAfterwards() {
        ProcedureFlow dispatch = procedure(analysis, "Dispatcher.dispatch");

        BlockInfo selector = block(dispatch, "switch (code) {");
        assertEquals(Arrays.asList("case 1", "case 2", "default", null), exitLabels(selector));

        BlockInfo after = block(dispatch, "System.out.println(\"After match\");");
        assertEquals("System.out.println(\"After match\");", after.source);
        assertEquals(List.of(after.id), dispatch.finalBlocks);
        assertEquals(List.of(after.id), exitTargets(block(dispatch, "System.out.println(\"One\");")));
        assertEquals(List.of(after.id), exitTargets(block(dispatch, "System.out.println(\"Other\");")));
    }

    @Test
    void forLoop_continueAndBreakTargetGuardAndExit() {
        ProcedureFlow sum = procedure(analysis, "Dispatcher.sum");

        BlockInfo guard = block(sum, "for (int i = 0; i < values.length; i++) {");
        BlockInfo exit = block(sum, "return total;");
        assertEquals(List.of("i < values.length", "!(i < values.length)"), exitLabels(guard));
        assertEquals(List.of(guard.id), exitTargets(block(sum, "continue;")));
        assertEquals(List.of(exit.id), exitTargets(block(sum, "break;")));
        assertEquals(List.of(exit.id), sum.finalBlocks);

        BlockInfo accumulate = block(sum, "total += values[i];");
        assertEquals(List.of("total > limit", "!(total > limit)"), exitLabels(accumulate));
        assertTrue(exitTargets(accumulate).contains(guard.id));
    }

    @Test
    void forLoop_groupsPathsByParametersThenLocals() {
        ProcedureFlow sum = procedure(analysis, "Dispatcher.sum");

        assertEquals(List.of("values", "limit", "total", "i"), new ArrayList<>(sum.dataFlowPaths.keySet()));
        assertTrue(sum.diagnostics.isEmpty());
    }

    @Test
    void labelledWhile_keepsLoopStructureAndBreaksToItsExit() throws IOException {
        ProcedureFlow drain = procedure(analyzeSample("java/Labels.java", Language.JAVA), "Labels.drain");

        BlockInfo guard = block(drain, "while (n > 0) {");
        BlockInfo body = block(drain, "n--;");
        assertEquals(List.of("n > 0", "!(n > 0)"), exitLabels(guard));
        assertEquals(List.of("n == 3", "!(n == 3)"), exitLabels(body));
        assertTrue(exitTargets(body).contains(guard.id));
        assertEquals(List.of(block(drain, "return n;").id), exitTargets(block(drain, "break outer;")));
        assertEquals(2, drain.pathCount);
        assertTrue(drain.blocks.stream().noneMatch(b -> b.source.contains("outer:")));
    }

    @Test
    void labelledContinue_returnsToTheOuterLoop() throws IOException {
        ProcedureFlow scan = procedure(analyzeSample("java/Labels.java", Language.JAVA), "Labels.scan");

        BlockInfo rows = block(scan, "for (int[] row : grid) {");
        BlockInfo cells = block(scan, "for (int cell : row) {");
        assertEquals(List.of(rows.id), exitTargets(block(scan, "continue rows;")));
        assertEquals(List.of(cells.id), exitTargets(block(scan, "found++;")));
        assertTrue(exitTargets(cells).contains(rows.id));
    }

    @Test
    void breakInLoopInsideCase_leavesTheSwitch() throws IOException {
        ProcedureFlow route = procedure(analyzeSample("java/Labels.java", Language.JAVA), "Labels.route");

        BlockInfo after = block(route, "done();");
        assertEquals(List.of(after.id), exitTargets(block(route, "n--;")));
        assertEquals(List.of(after.id), exitTargets(block(route, "start();")));
    }

    @Test
    void syntaxError_fallsBackToLineByLineAnalysis() {
        String source = "class Broken {\n    void f( {\n        a = 1;\n    }\n";

        FileFlowAnalysis degraded = new FlowAnalyzer(CodeflowConfig.defaults())
                .analyze("samples/Broken.java", source, Language.JAVA);

        assertTrue(degraded.degraded);
        assertEquals(1, degraded.procedures.size());
        ProcedureFlow flow = degraded.procedures.get(0);
        assertEquals("Broken", flow.name);
        assertEquals(List.of("void f( {", "a = 1;"),
                flow.blocks.stream().map(b -> b.source).collect(Collectors.toList()));
        assertEquals(List.of(flow.blocks.get(1).id), flow.finalBlocks);
        assertEquals(List.of("(a, 3)"), flow.dataFlowPaths.get("a"));
    }
}
