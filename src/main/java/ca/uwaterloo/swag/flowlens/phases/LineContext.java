package ca.uwaterloo.swag.flowlens.phases;

import ca.uwaterloo.swag.flowlens.models.LineRecord;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of the line currently being classified. A {@link StatementRule} fills it in; the classifier turns
 * it into a {@link LineRecord}.
 */
final class LineContext {

    private final int lineNumber;
    private final VariableTable variableTable;
    private final ExpressionVariableExtractor extractor;
    private final List<String> allocationFunctions;
    private final Set<String> reads = new LinkedHashSet<>();
    private final Set<String> writes = new LinkedHashSet<>();
    private String operation = "";

    LineContext(int lineNumber, VariableTable variableTable, ExpressionVariableExtractor extractor,
                List<String> allocationFunctions) {
        this.lineNumber = lineNumber;
        this.variableTable = variableTable;
        this.extractor = extractor;
        this.allocationFunctions = allocationFunctions;
    }

    void label(String operation) {
        this.operation = operation;
    }

    /**
     * Records a write of {@code varName}, once per line.
     *
     * @return false when the variable was already written on this line
     */
    boolean define(String varName, String details) {
        if (!writes.add(varName)) {
            return false;
        }
        variableTable.recordDefinition(varName, lineNumber, details);
        return true;
    }

    void read(String varName) {
        reads.add(varName);
    }

    void readExpression(String expression) {
        reads.addAll(extractor.extract(expression));
    }

    boolean isAllocationFunction(String functionName) {
        return allocationFunctions.contains(functionName);
    }

    String operation() {
        return operation;
    }

    Set<String> reads() {
        return reads;
    }

    LineRecord toLineRecord() {
        return new LineRecord(lineNumber, reads, writes, operation);
    }
}
