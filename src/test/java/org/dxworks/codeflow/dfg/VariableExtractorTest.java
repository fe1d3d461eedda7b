package org.dxworks.codeflow.dfg;

import org.dxworks.codeflow.ast.AstNode;
import org.dxworks.codeflow.ast.LineAstNode;
import org.dxworks.codeflow.ast.NodeKind;
import org.dxworks.codeflow.ast.grammar.TokenTable;
import org.dxworks.codeflow.model.Occurrence;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.dxworks.codeflow.ast.StubNode.block;
import static org.dxworks.codeflow.ast.StubNode.expression;
import static org.dxworks.codeflow.ast.StubNode.identifier;
import static org.dxworks.codeflow.ast.StubNode.ifNode;
import static org.dxworks.codeflow.ast.StubNode.node;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VariableExtractorTest {

    private final VariableExtractor java = new VariableExtractor(TokenTable.JAVA);
    private final VariableExtractor python = new VariableExtractor(TokenTable.PYTHON);

    @Test
    void conditional_contributesOnlyItsCondition() {
        AstNode statement = ifNode("x > y", 2, block(2, expression("z = 1", 3)));

        assertEquals(List.of(occ("x", 2), occ("y", 2)), java.extract(statement));
    }

    @Test
    void forEach_contributesTargetAndIterable() {
        AstNode loop = node(NodeKind.FOR_EACH, "for item in items:", 2)
                .with("target", identifier("item", 2))
                .with("iterable", identifier("items", 2))
                .with("body", block(2, expression("total += item", 3)));

        assertEquals(List.of(occ("item", 2), occ("items", 2)), python.extract(loop));
        assertEquals(List.of("(item, 2) def", "(items, 2) use"), describe(python.accesses(loop)));
    }

    @Test
    void declaration_contributesDeclaredNamesExceptTypeLikeOnes() {
        AstNode declaration = node(NodeKind.DECLARATION, "int Total = seed, count, Integer;", 4)
                .with("declarator", node(NodeKind.DECLARATOR, "Total = seed", 4)
                        .with("name", identifier("Total", 4))
                        .with("value", identifier("seed", 4)))
                .with("declarator", node(NodeKind.DECLARATOR, "count", 4).with("name", identifier("count", 4)))
                .with("declarator", node(NodeKind.DECLARATOR, "Integer", 4).with("name", identifier("Integer", 4)));

        assertEquals(List.of(occ("count", 4), occ("Integer", 4)), java.extract(declaration));
    }

    @Test
    void line_skipsKeywordsStringsAndComments() {
        AstNode line = LineAstNode.line("String label = \"total count\"; // count it", 7);

        assertEquals(List.of(occ("label", 7)), java.extract(line));
    }

    @Test
    void pythonLine_usesPythonKeywords() {
        AstNode line = LineAstNode.line("for item in items:  # walk the items", 3);

        assertEquals(List.of(occ("item", 3), occ("items", 3)), python.extract(line));
    }

    @Test
    void trackedNames_restrictTheResult() {
        AstNode statement = expression("a = b + c", 2);

        assertEquals(List.of(occ("a", 2), occ("c", 2)), java.extract(statement, Set.of("a", "c")));
    }

    @Test
    void repeatedReferences_onOneLineAreMerged() {
        assertEquals(List.of(occ("x", 5)), java.extract(expression("x = x + x", 5)));
    }

    @Test
    void multiLineStatement_isOrderedByLine() {
        AstNode call = node(NodeKind.EXPRESSION, "call(\n b,\n a)", 8)
                .add(identifier("call", 8))
                .add(identifier("a", 10))
                .add(identifier("b", 9));

        assertEquals(List.of(occ("call", 8), occ("b", 9), occ("a", 10)), java.extract(call));
    }

    @Test
    void compoundAssignment_isDefinitionAndUse() {
        AstNode assignment = node(NodeKind.ASSIGNMENT, "total += x", 3)
                .with("left", identifier("total", 3))
                .with("operator", node(NodeKind.OTHER, "+=", 3))
                .with("right", identifier("x", 3));

        assertEquals(List.of("(total, 3) def use", "(x, 3) use"), describe(java.accesses(assignment)));
    }

    @Test
    void plainAssignment_definesItsTarget() {
        AstNode assignment = node(NodeKind.ASSIGNMENT, "total = x", 3)
                .with("left", identifier("total", 3))
                .with("right", identifier("x", 3));

        assertEquals(List.of("(total, 3) def", "(x, 3) use"), describe(python.accesses(assignment)));
    }

    @Test
    void update_isDefinitionAndUse() {
        AstNode update = node(NodeKind.UPDATE, "i++", 6).add(identifier("i", 6));

        assertEquals(List.of("(i, 6) def use"), describe(java.accesses(update)));
    }

    @Test
    void lineAssignment_isClassifiedByPattern() {
        assertEquals(List.of("(count, 2) def use", "(step, 2) use"),
                describe(java.accesses(LineAstNode.line("count += step;", 2))));
        assertEquals(List.of("(n, 3) def", "(limit, 3) use"),
                describe(java.accesses(LineAstNode.line("int n = limit;", 3))));
        assertEquals(List.of("(i, 4) def use"),
                describe(java.accesses(LineAstNode.line("i++;", 4))));
    }

    @Test
    void parameters_areTakenFromTheParameterList() {
        AstNode procedure = node(NodeKind.PROCEDURE, "def f(a, b=1):", 1)
                .with("name", identifier("f", 1))
                .with("parameters", node(NodeKind.OTHER, "(a, b=1)", 1)
                        .add(identifier("a", 1))
                        .add(node(NodeKind.OTHER, "b=1", 1).with("name", identifier("b", 1))));

        assertEquals(List.of(occ("a", 1), occ("b", 1)), python.parameters(procedure));
        assertEquals(List.of("(a, 1) def", "(b, 1) def"), describe(python.accesses(procedure)));
    }

    @Test
    void switch_contributesItsSubject() {
        AstNode select = node(NodeKind.SWITCH, "match command:", 2)
                .with("condition", identifier("command", 2))
                .with("body", block(2, expression("other", 3)));

        assertEquals(List.of(occ("command", 2)), python.extract(select));
    }

    @Test
    void jumpLabels_areNotVariables() {
        AstNode jump = node(NodeKind.BREAK, "break outer;", 4).add(identifier("outer", 4));

        assertTrue(java.extract(jump).isEmpty());
    }

    private static Occurrence occ(String name, int line) {
        return new Occurrence(name, line);
    }

    private static List<String> describe(List<VariableAccess> accesses) {
        return accesses.stream().map(VariableAccess::toString).collect(Collectors.toList());
    }
}
