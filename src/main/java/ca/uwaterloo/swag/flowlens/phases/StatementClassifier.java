package ca.uwaterloo.swag.flowlens.phases;

import ca.uwaterloo.swag.flowlens.models.LineAnalysisInfo;
import ca.uwaterloo.swag.flowlens.models.LineRecord;
import ca.uwaterloo.swag.flowlens.util.CSyntax;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link StatementClassifier} walks the source line by line, settles each statement line on one
 * {@link StatementRule} and records which variables the line reads and writes.
 *
 * @since 0.0.1
 */
public class StatementClassifier {

    private static final Logger log = Logger.getLogger(StatementClassifier.class.getName());
    private final List<String> sourceLines;
    private final List<String> allocationFunctions;
    private final ExpressionVariableExtractor extractor;
    private final VariableTable variableTable;
    private final SortedMap<Integer, LineRecord> lineRecords;

    public StatementClassifier(List<String> sourceLines, List<String> allocationFunctions) {
        this.sourceLines = sourceLines;
        this.allocationFunctions = allocationFunctions;
        this.extractor = new ExpressionVariableExtractor();
        this.variableTable = new VariableTable();
        this.lineRecords = new TreeMap<>();
    }

    public LineAnalysisInfo classify() {
        for (int i = 0; i < sourceLines.size(); i++) {
            String line = sourceLines.get(i);
            if (CSyntax.isNonStatement(line)) {
                continue;
            }
            int lineNumber = i + 1;
            LineRecord lineRecord = classifyLine(lineNumber, CSyntax.stripLineComment(line));
            lineRecords.put(lineNumber, lineRecord);
        }
        return new LineAnalysisInfo(lineRecords, variableTable.toRecords());
    }

    private LineRecord classifyLine(int lineNumber, String statement) {
        LineContext context = new LineContext(lineNumber, variableTable, extractor, allocationFunctions);
        for (StatementRule rule : StatementRule.values()) {
            if (rule.matches(statement)) {
                rule.apply(statement, context);
                if (log.isLoggable(Level.FINE)) {
                    log.fine("Line " + lineNumber + " classified as " + rule);
                }
                break;
            }
        }

        for (String varName : context.reads()) {
            variableTable.recordUse(varName, lineNumber, "Used in: " + context.operation());
        }
        return context.toLineRecord();
    }
}
