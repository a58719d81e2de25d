package ca.uwaterloo.swag.flowlens.export;

import ca.uwaterloo.swag.flowlens.models.Arc;
import ca.uwaterloo.swag.flowlens.models.Block;
import ca.uwaterloo.swag.flowlens.models.BlockType;
import ca.uwaterloo.swag.flowlens.models.VariableRecord;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedPseudograph;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;

/**
 * {@link GraphExporter} writes the variable dependency graph and the TTA block graph in Graphviz DOT.
 *
 * @since 0.0.1
 */
public class GraphExporter {

    public static final String DEPENDENCY_GRAPH_FILE = "dependency_graph.dot";
    public static final String TTA_GRAPH_FILE = "tta_graph.dot";
    private static final Logger log = Logger.getLogger(GraphExporter.class.getName());
    private static final Map<BlockType, String> BLOCK_COLORS = new EnumMap<>(BlockType.class);

    static {
        BLOCK_COLORS.put(BlockType.START, "lightgreen");
        BLOCK_COLORS.put(BlockType.END, "lightcoral");
        BLOCK_COLORS.put(BlockType.XOR, "lightyellow");
        BLOCK_COLORS.put(BlockType.LOOP, "lightblue");
        BLOCK_COLORS.put(BlockType.ACTIVITY, "lightgray");
    }

    /**
     * Variable names such as {@code *p} are not valid DOT identifiers, so vertices get positional ids and carry the
     * name as their label.
     */
    public String dependencyGraphDot(Graph<String, DefaultEdge> dependencyGraph) {
        Map<String, String> vertexIds = new HashMap<>();
        for (String varName : dependencyGraph.vertexSet()) {
            vertexIds.put(varName, "v" + vertexIds.size());
        }

        DOTExporter<String, DefaultEdge> exporter = new DOTExporter<>(vertexIds::get);
        exporter.setVertexAttributeProvider(varName -> {
            Map<String, Attribute> attributes = new LinkedHashMap<>();
            attributes.put("label", DefaultAttribute.createAttribute(varName));
            attributes.put("style", DefaultAttribute.createAttribute("filled"));
            attributes.put("fillcolor", DefaultAttribute.createAttribute(
                varName.startsWith(VariableRecord.DEREFERENCE_PREFIX) ? "lightpink" : "lightblue"));
            return attributes;
        });
        StringWriter writer = new StringWriter();
        exporter.exportGraph(dependencyGraph, writer);
        return writer.toString();
    }

    public String ttaGraphDot(List<Block> blocks, List<Arc> arcs) {
        Map<Integer, Block> blocksById = new HashMap<>();
        Graph<Integer, Arc> ttaGraph = new DirectedPseudograph<>(Arc.class);
        for (Block block : blocks) {
            blocksById.put(block.getId(), block);
            ttaGraph.addVertex(block.getId());
        }
        for (Arc arc : arcs) {
            ttaGraph.addEdge(arc.getFrom(), arc.getTo(), arc);
        }

        DOTExporter<Integer, Arc> exporter = new DOTExporter<>(blockId -> "block_" + blockId);
        exporter.setVertexAttributeProvider(blockId -> {
            Block block = blocksById.get(blockId);
            Map<String, Attribute> attributes = new LinkedHashMap<>();
            attributes.put("label", DefaultAttribute.createAttribute(block.getType().name() + " [" +
                block.getStartLine() + "-" + block.getEndLine() + "]"));
            attributes.put("shape", DefaultAttribute.createAttribute("box"));
            attributes.put("style", DefaultAttribute.createAttribute("filled"));
            attributes.put("fillcolor", DefaultAttribute.createAttribute(BLOCK_COLORS.get(block.getType())));
            return attributes;
        });
        exporter.setEdgeAttributeProvider(arc -> {
            Map<String, Attribute> attributes = new LinkedHashMap<>();
            attributes.put("label", DefaultAttribute.createAttribute(arc.getDescription()));
            attributes.put("style", DefaultAttribute.createAttribute(arc.getType().lineStyle()));
            return attributes;
        });
        StringWriter writer = new StringWriter();
        exporter.exportGraph(ttaGraph, writer);
        return writer.toString();
    }

    public void exportAll(File outputDir, Graph<String, DefaultEdge> dependencyGraph, List<Block> blocks,
                          List<Arc> arcs) throws IOException {
        File dependencyFile = new File(outputDir, DEPENDENCY_GRAPH_FILE);
        FileUtils.writeStringToFile(dependencyFile, dependencyGraphDot(dependencyGraph), StandardCharsets.UTF_8);
        File ttaFile = new File(outputDir, TTA_GRAPH_FILE);
        FileUtils.writeStringToFile(ttaFile, ttaGraphDot(blocks, arcs), StandardCharsets.UTF_8);
        log.fine("Exported " + dependencyFile.getPath() + " and " + ttaFile.getPath());
    }
}
