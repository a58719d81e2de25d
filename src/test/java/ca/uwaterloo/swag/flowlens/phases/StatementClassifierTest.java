package ca.uwaterloo.swag.flowlens.phases;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.uwaterloo.swag.flowlens.models.LineAnalysisInfo;
import ca.uwaterloo.swag.flowlens.models.LineRecord;
import ca.uwaterloo.swag.flowlens.models.VariableAccess;
import ca.uwaterloo.swag.flowlens.models.VariableRecord;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class StatementClassifierTest {

    private static final List<String> ALLOCATORS = Arrays.asList("malloc", "calloc", "realloc");

    private static LineAnalysisInfo classify(String... lines) {
        return new StatementClassifier(Arrays.asList(lines), ALLOCATORS).classify();
    }

    @Test
    void declarationOnlyLineDefinesOnceWithoutUses() {
        LineAnalysisInfo info = classify("int x;");
        VariableRecord x = info.variables.get("x");

        assertEquals(List.of(new VariableAccess(1, "Declaration of x")), x.getDefinitions());
        assertTrue(x.getUses().isEmpty());
        assertEquals("Declaration of x", info.lineRecords.get(1).getOperation());
    }

    @Test
    void pointerDeclarationIsRecorded() {
        LineAnalysisInfo info = classify("int *p;");
        assertEquals("Declaration of p pointer", info.lineRecords.get(1).getOperation());
        assertEquals(Set.of("p"), info.lineRecords.get(1).getWrites());
    }

    @Test
    void declarationListDefinesEveryName() {
        LineAnalysisInfo info = classify("int a, b;");
        assertEquals(Set.of("a", "b"), info.lineRecords.get(1).getWrites());
        assertEquals(1, info.variables.get("b").getDefinitions().size());
    }

    @Test
    void initializedDeclarationReadsItsExpression() {
        LineAnalysisInfo info = classify("int a = 10;", "int b = 5;", "int sum = a + b;");
        LineRecord sumLine = info.lineRecords.get(3);

        assertEquals(Set.of("sum"), sumLine.getWrites());
        assertEquals(Set.of("a", "b"), sumLine.getReads());
        assertEquals("Declaration and assignment of sum", sumLine.getOperation());
        assertEquals(List.of(new VariableAccess(3, "Used in: Declaration and assignment of sum")),
            info.variables.get("a").getUses());
    }

    @Test
    void pointerDereferenceAssignmentWritesPseudoVariable() {
        LineRecord line = classify("*ptr = a + b;").lineRecords.get(1);

        assertEquals(Set.of("*ptr"), line.getWrites());
        assertEquals(Set.of("ptr", "a", "b"), line.getReads());
        assertEquals("Pointer dereference assignment: *ptr = value", line.getOperation());
    }

    @Test
    void pointerIsRecordedAsUsedOnDereferenceLine() {
        LineAnalysisInfo info = classify("*ptr = a + b;");
        VariableRecord ptr = info.variables.get("ptr");
        assertEquals(1, ptr.getUses().size());
        assertEquals(1, ptr.getUses().get(0).getLine());
        assertTrue(info.variables.get("*ptr").isDereference());
    }

    @Test
    void plainAssignmentWritesTarget() {
        LineRecord line = classify("i = i + 1;").lineRecords.get(1);
        assertEquals(Set.of("i"), line.getWrites());
        assertEquals(Set.of("i"), line.getReads());
        assertEquals("Assignment to i", line.getOperation());
    }

    @Test
    void comparisonIsNotAnAssignment() {
        LineRecord line = classify("if (a == b) {").lineRecords.get(1);
        assertTrue(line.getWrites().isEmpty());
        assertEquals(Set.of("a", "b"), line.getReads());
        assertEquals("Control flow: if statement", line.getOperation());
    }

    @Test
    void controlHeaderIsNotMistakenForCall() {
        LineRecord line = classify("while (count < limit) {").lineRecords.get(1);
        assertEquals("Control flow: while statement", line.getOperation());
        assertEquals(Set.of("count", "limit"), line.getReads());
    }

    @Test
    void callStatementReadsArguments() {
        LineRecord line = classify("printf(\"%d\", total);").lineRecords.get(1);
        assertEquals("Function call: printf()", line.getOperation());
        assertEquals(Set.of("total"), line.getReads());
        assertTrue(line.getWrites().isEmpty());
    }

    @Test
    void callInsideAssignmentReadsEveryArgumentWord() {
        LineRecord line = classify("result = add(\"%d\", count);").lineRecords.get(1);
        assertEquals("Assignment to result", line.getOperation());
        assertEquals(Set.of("d", "count"), line.getReads());
    }

    @Test
    void conditionSpansBalancedParentheses() {
        LineRecord line = classify("if (is_valid(a)) {").lineRecords.get(1);
        assertEquals("Control flow: if statement", line.getOperation());
        assertEquals(Set.of("a"), line.getReads());
    }

    @Test
    void trailingCommentIsIgnoredWhenMatchingRules() {
        LineRecord line = classify("y = 2; // a == b").lineRecords.get(1);
        assertEquals("Assignment to y", line.getOperation());
        assertEquals(Set.of("y"), line.getWrites());
        assertTrue(line.getReads().isEmpty());
    }

    @Test
    void castAllocationWritesTarget() {
        LineRecord line = classify("buf = (char *) malloc(10);").lineRecords.get(1);
        assertEquals(Set.of("buf"), line.getWrites());
        assertEquals("Memory allocation: buf = malloc(...)", line.getOperation());
    }

    @Test
    void allocatorsComeFromTheCatalog() {
        LineRecord withoutCatalogEntry = new StatementClassifier(List.of("buf = (char *) xalloc(10);"), ALLOCATORS)
            .classify().lineRecords.get(1);
        assertTrue(withoutCatalogEntry.getWrites().isEmpty());

        LineRecord line = new StatementClassifier(List.of("buf = (char *) xalloc(10);"), List.of("xalloc"))
            .classify().lineRecords.get(1);
        assertEquals(Set.of("buf"), line.getWrites());
    }

    @Test
    void returnReadsItsValue() {
        LineRecord line = classify("return result;").lineRecords.get(1);
        assertEquals("Return statement", line.getOperation());
        assertEquals(Set.of("result"), line.getReads());
    }

    @Test
    void functionDefinitionRecordsNothing() {
        LineRecord line = classify("int add(int a, int b) {").lineRecords.get(1);
        assertEquals("Function definition", line.getOperation());
        assertTrue(line.getReads().isEmpty());
        assertTrue(line.getWrites().isEmpty());
    }

    @Test
    void unmatchedLineGetsEmptyRecord() {
        LineRecord line = classify("}").lineRecords.get(1);
        assertEquals("", line.getOperation());
        assertTrue(line.getReads().isEmpty());
        assertTrue(line.getWrites().isEmpty());
    }

    @Test
    void commentsDirectivesAndBlanksAreSkipped() {
        LineAnalysisInfo info = classify("#include <stdio.h>", "", "// x = 1;", "int y = 2; // y = z");
        assertEquals(Set.of(4), info.lineRecords.keySet());
        assertFalse(info.variables.containsKey("z"));
    }
}
