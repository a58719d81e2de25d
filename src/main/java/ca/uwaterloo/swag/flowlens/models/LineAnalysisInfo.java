package ca.uwaterloo.swag.flowlens.models;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;

/**
 * Output of the statement classifier: per-line records keyed by line number and the variable table they built.
 */
public class LineAnalysisInfo {

    public final SortedMap<Integer, LineRecord> lineRecords;
    public final Map<String, VariableRecord> variables;

    public LineAnalysisInfo(SortedMap<Integer, LineRecord> lineRecords, Map<String, VariableRecord> variables) {
        this.lineRecords = Collections.unmodifiableSortedMap(lineRecords);
        this.variables = Collections.unmodifiableMap(variables);
    }
}
