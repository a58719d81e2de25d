package ca.uwaterloo.swag.flowlens;

import ca.uwaterloo.swag.flowlens.models.AnalysisResult;
import ca.uwaterloo.swag.flowlens.models.Arc;
import ca.uwaterloo.swag.flowlens.models.Block;
import ca.uwaterloo.swag.flowlens.models.LineAnalysisInfo;
import ca.uwaterloo.swag.flowlens.models.OperationSequence;
import ca.uwaterloo.swag.flowlens.phases.ArcBuilder;
import ca.uwaterloo.swag.flowlens.phases.BlockOperationBinder;
import ca.uwaterloo.swag.flowlens.phases.BlockPartitioner;
import ca.uwaterloo.swag.flowlens.phases.DataFlowAnalyzer;
import ca.uwaterloo.swag.flowlens.phases.OperationSequenceBuilder;
import ca.uwaterloo.swag.flowlens.phases.StatementClassifier;
import ca.uwaterloo.swag.flowlens.phases.SyntaxChecker;
import ca.uwaterloo.swag.flowlens.util.CSyntax;
import ca.uwaterloo.swag.flowlens.util.FunctionCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link FlowLens} runs every analysis phase over one C source text and collects the outputs into an
 * {@link AnalysisResult}. Each call to {@link #analyze(String)} creates fresh phase instances, so the same
 * {@link FlowLens} can be reused and repeated calls on the same text give equal results.
 *
 * @since 0.0.1
 */
public class FlowLens {

    private static final Logger log = Logger.getLogger(FlowLens.class.getName());
    private final List<String> allocationFunctions;
    private final List<String> deallocationFunctions;

    /**
     * Uses the allocation and deallocation functions listed in the bundled XML catalogs.
     */
    public FlowLens() {
        this(FunctionCatalog.loadResource(FunctionCatalog.DEFAULT_ALLOCATION_FUNCTIONS_FILE),
            FunctionCatalog.loadResource(FunctionCatalog.DEFAULT_DEALLOCATION_FUNCTIONS_FILE));
    }

    public FlowLens(List<String> allocationFunctions, List<String> deallocationFunctions) {
        this.allocationFunctions = new ArrayList<>(Objects.requireNonNull(allocationFunctions));
        this.deallocationFunctions = new ArrayList<>(Objects.requireNonNull(deallocationFunctions));
    }

    public AnalysisResult analyze(String sourceText) {
        Objects.requireNonNull(sourceText, "source text");
        List<String> sourceLines = CSyntax.splitLines(sourceText);

        List<String> syntaxErrors = new SyntaxChecker(sourceLines).check();

        LineAnalysisInfo lineAnalysisInfo = new StatementClassifier(sourceLines, allocationFunctions).classify();
        DataFlowAnalyzer dataFlowAnalyzer = new DataFlowAnalyzer(lineAnalysisInfo);
        dataFlowAnalyzer.analyze();

        OperationSequence operations = new OperationSequenceBuilder(sourceLines, lineAnalysisInfo.lineRecords,
            deallocationFunctions).build();

        BlockPartitioner blockPartitioner = new BlockPartitioner(sourceLines);
        List<Block> blocks = blockPartitioner.partition();
        List<Arc> arcs = new ArcBuilder(blocks).build();
        List<Block> boundBlocks = new BlockOperationBinder(blocks, operations).bind();

        log.fine("Analyzed " + sourceLines.size() + " lines into " + boundBlocks.size() + " blocks and " +
            arcs.size() + " arcs");
        return new AnalysisResult(sourceLines, lineAnalysisInfo.variables, dataFlowAnalyzer.getDependencies(),
            dataFlowAnalyzer.getDependencyGraph(), lineAnalysisInfo.lineRecords,
            dataFlowAnalyzer.getReachingDefinitions(), operations, blockPartitioner.getControlStructures(),
            boundBlocks, arcs, syntaxErrors);
    }

    public List<String> getAllocationFunctions() {
        return allocationFunctions;
    }

    public List<String> getDeallocationFunctions() {
        return deallocationFunctions;
    }
}
