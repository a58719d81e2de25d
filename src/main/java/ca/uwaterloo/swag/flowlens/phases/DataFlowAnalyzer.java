package ca.uwaterloo.swag.flowlens.phases;

import ca.uwaterloo.swag.flowlens.models.LineAnalysisInfo;
import ca.uwaterloo.swag.flowlens.models.LineRecord;
import ca.uwaterloo.swag.flowlens.models.VariableAccess;
import ca.uwaterloo.swag.flowlens.models.VariableRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

/**
 * {@link DataFlowAnalyzer} aggregates the per-line records into variable dependencies, the dependency graph and
 * the reaching definitions of every line.
 *
 * @since 0.0.1
 */
public class DataFlowAnalyzer {

    private static final Logger log = Logger.getLogger(DataFlowAnalyzer.class.getName());
    private final LineAnalysisInfo lineAnalysisInfo;
    private final Map<String, List<String>> dependencies;
    private final SortedMap<Integer, List<String>> reachingDefinitions;
    private final Graph<String, DefaultEdge> dependencyGraph;

    public DataFlowAnalyzer(LineAnalysisInfo lineAnalysisInfo) {
        this.lineAnalysisInfo = lineAnalysisInfo;
        this.dependencies = new LinkedHashMap<>();
        this.reachingDefinitions = new TreeMap<>();
        this.dependencyGraph = new DefaultDirectedGraph<>(DefaultEdge.class);
    }

    public void analyze() {
        buildDependencies();
        computeReachingDefinitions();
        log.fine("Found " + dependencies.size() + " dependent variables");
    }

    private void buildDependencies() {
        Map<String, Set<String>> dependentVars = new LinkedHashMap<>();
        for (LineRecord lineRecord : lineAnalysisInfo.lineRecords.values()) {
            for (String writtenVar : lineRecord.getWrites()) {
                for (String readVar : lineRecord.getReads()) {
                    if (readVar.equals(writtenVar)) {
                        continue;
                    }
                    dependentVars.computeIfAbsent(writtenVar, k -> new LinkedHashSet<>()).add(readVar);
                }
            }
        }

        for (Map.Entry<String, Set<String>> entry : dependentVars.entrySet()) {
            String writtenVar = entry.getKey();
            dependencies.put(writtenVar, Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            dependencyGraph.addVertex(writtenVar);
            for (String readVar : entry.getValue()) {
                dependencyGraph.addVertex(readVar);
                dependencyGraph.addEdge(readVar, writtenVar);
            }
        }
    }

    private void computeReachingDefinitions() {
        Map<String, VariableRecord> variables = lineAnalysisInfo.variables;
        for (LineRecord lineRecord : lineAnalysisInfo.lineRecords.values()) {
            int lineNumber = lineRecord.getLineNumber();
            List<String> reaching = new ArrayList<>();
            for (String readVar : lineRecord.getReads()) {
                VariableRecord variable = variables.get(readVar);
                if (variable == null) {
                    continue;
                }
                int latestDefinition = findLatestDefinitionBefore(variable, lineNumber);
                if (latestDefinition > 0) {
                    reaching.add("Line " + latestDefinition + " (defines " + readVar + ")");
                }
            }
            reachingDefinitions.put(lineNumber, Collections.unmodifiableList(reaching));
        }
    }

    private int findLatestDefinitionBefore(VariableRecord variable, int lineNumber) {
        int latest = 0;
        for (VariableAccess definition : variable.getDefinitions()) {
            if (definition.getLine() < lineNumber && definition.getLine() > latest) {
                latest = definition.getLine();
            }
        }
        return latest;
    }

    public Map<String, List<String>> getDependencies() {
        return dependencies;
    }

    public SortedMap<Integer, List<String>> getReachingDefinitions() {
        return reachingDefinitions;
    }

    public Graph<String, DefaultEdge> getDependencyGraph() {
        return dependencyGraph;
    }
}
