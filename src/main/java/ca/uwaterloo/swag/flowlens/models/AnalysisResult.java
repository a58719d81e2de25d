package ca.uwaterloo.swag.flowlens.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.jgrapht.Graph;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultEdge;

/**
 * Everything one analysis run produces. Instances are never modified after construction.
 *
 * <p>The dependency graph is a view over the dependency map and takes no part in equality.
 */
public final class AnalysisResult {

    private final List<String> sourceLines;
    private final Map<String, VariableRecord> variables;
    private final Map<String, List<String>> dependencies;
    private final Graph<String, DefaultEdge> dependencyGraph;
    private final SortedMap<Integer, LineRecord> lineAnalysis;
    private final SortedMap<Integer, List<String>> reachingDefinitions;
    private final OperationSequence operations;
    private final List<ControlStructure> controlStructures;
    private final List<Block> blocks;
    private final List<Arc> arcs;
    private final List<String> syntaxErrors;

    public AnalysisResult(List<String> sourceLines, Map<String, VariableRecord> variables,
                          Map<String, List<String>> dependencies, Graph<String, DefaultEdge> dependencyGraph,
                          SortedMap<Integer, LineRecord> lineAnalysis,
                          SortedMap<Integer, List<String>> reachingDefinitions, OperationSequence operations,
                          List<ControlStructure> controlStructures, List<Block> blocks, List<Arc> arcs,
                          List<String> syntaxErrors) {
        this.sourceLines = Collections.unmodifiableList(new ArrayList<>(sourceLines));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        Map<String, List<String>> dependenciesCopy = new LinkedHashMap<>();
        copyValues(dependencies, dependenciesCopy);
        this.dependencies = Collections.unmodifiableMap(dependenciesCopy);
        this.dependencyGraph = new AsUnmodifiableGraph<>(dependencyGraph);
        this.lineAnalysis = Collections.unmodifiableSortedMap(new TreeMap<>(lineAnalysis));
        SortedMap<Integer, List<String>> reachingCopy = new TreeMap<>();
        copyValues(reachingDefinitions, reachingCopy);
        this.reachingDefinitions = Collections.unmodifiableSortedMap(reachingCopy);
        this.operations = operations;
        this.controlStructures = Collections.unmodifiableList(new ArrayList<>(controlStructures));
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        this.arcs = Collections.unmodifiableList(new ArrayList<>(arcs));
        this.syntaxErrors = Collections.unmodifiableList(new ArrayList<>(syntaxErrors));
    }

    private static <K> void copyValues(Map<K, List<String>> source, Map<K, List<String>> target) {
        for (Map.Entry<K, List<String>> entry : source.entrySet()) {
            target.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
    }

    public List<String> getSourceLines() {
        return sourceLines;
    }

    public Map<String, VariableRecord> getVariables() {
        return variables;
    }

    public Map<String, List<String>> getDependencies() {
        return dependencies;
    }

    public Graph<String, DefaultEdge> getDependencyGraph() {
        return dependencyGraph;
    }

    public SortedMap<Integer, LineRecord> getLineAnalysis() {
        return lineAnalysis;
    }

    public SortedMap<Integer, List<String>> getReachingDefinitions() {
        return reachingDefinitions;
    }

    public OperationSequence getOperations() {
        return operations;
    }

    public List<ControlStructure> getControlStructures() {
        return controlStructures;
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    public List<Arc> getArcs() {
        return arcs;
    }

    public List<String> getSyntaxErrors() {
        return syntaxErrors;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof AnalysisResult)) {
            return false;
        }
        AnalysisResult other = (AnalysisResult) obj;
        return this.sourceLines.equals(other.sourceLines) && this.variables.equals(other.variables) &&
            this.dependencies.equals(other.dependencies) && this.lineAnalysis.equals(other.lineAnalysis) &&
            this.reachingDefinitions.equals(other.reachingDefinitions) &&
            this.operations.equals(other.operations) && this.controlStructures.equals(other.controlStructures) &&
            this.blocks.equals(other.blocks) && this.arcs.equals(other.arcs) &&
            this.syntaxErrors.equals(other.syntaxErrors);
    }

    @Override
    public int hashCode() {
        int result = 17;
        result = 31 * result + this.sourceLines.hashCode();
        result = 31 * result + this.operations.hashCode();
        result = 31 * result + this.blocks.hashCode();
        result = 31 * result + this.arcs.hashCode();
        return result;
    }
}
