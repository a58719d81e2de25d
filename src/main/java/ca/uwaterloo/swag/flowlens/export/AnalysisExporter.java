package ca.uwaterloo.swag.flowlens.export;

import ca.uwaterloo.swag.flowlens.models.AnalysisResult;
import ca.uwaterloo.swag.flowlens.models.Arc;
import ca.uwaterloo.swag.flowlens.models.ArcType;
import ca.uwaterloo.swag.flowlens.models.Block;
import ca.uwaterloo.swag.flowlens.models.BlockType;
import ca.uwaterloo.swag.flowlens.models.ControlStructure;
import ca.uwaterloo.swag.flowlens.models.LineRecord;
import ca.uwaterloo.swag.flowlens.models.Operation;
import ca.uwaterloo.swag.flowlens.models.OperationSequence;
import ca.uwaterloo.swag.flowlens.models.OperationType;
import ca.uwaterloo.swag.flowlens.models.VariableAccess;
import ca.uwaterloo.swag.flowlens.models.VariableRecord;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;

/**
 * {@link AnalysisExporter} renders an {@link AnalysisResult} as the three JSON documents of the tool: the dataflow
 * analysis, the operation log as a C linked list and the TTA block graph.
 *
 * <p>Field names are fixed; consumers read them by name. The only varying content between two exports of the same
 * result is the timestamp, which comes from the {@link Clock} given at construction.
 *
 * @since 0.0.1
 */
public class AnalysisExporter {

    public static final String DATAFLOW_FILE = "dataflow_analysis.json";
    public static final String LINKED_LIST_FILE = "c_dataflow_linked_list.json";
    public static final String TTA_GRAPH_FILE = "tta_graph_analysis.json";
    static final String DATAFLOW_VERSION = "2.1";
    static final String TTA_VERSION = "1.0";

    private static final Logger log = Logger.getLogger(AnalysisExporter.class.getName());
    private final Clock clock;
    private final Gson gson;

    public AnalysisExporter(Clock clock) {
        this.clock = clock;
        this.gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();
    }

    /**
     * Writes all three documents into {@code outputDir}, creating the directory when needed.
     */
    public List<File> exportAll(File outputDir, String sourceText, AnalysisResult result) throws IOException {
        List<File> written = new ArrayList<>();
        written.add(write(new File(outputDir, DATAFLOW_FILE), dataflowDocument(sourceText, result)));
        written.add(write(new File(outputDir, LINKED_LIST_FILE), linkedListDocument(result.getOperations())));
        written.add(write(new File(outputDir, TTA_GRAPH_FILE), ttaGraphDocument(result)));
        return written;
    }

    public String toJson(JsonElement document) {
        return gson.toJson(document);
    }

    private File write(File file, JsonObject document) throws IOException {
        FileUtils.writeStringToFile(file, toJson(document), StandardCharsets.UTF_8);
        log.fine("Exported " + file.getPath());
        return file;
    }

    public JsonObject dataflowDocument(String sourceText, AnalysisResult result) {
        JsonObject codeStats = new JsonObject();
        codeStats.addProperty("lines", result.getSourceLines().size());
        codeStats.addProperty("characters", sourceText.length());
        codeStats.addProperty("words", countWords(sourceText));

        JsonObject metadata = new JsonObject();
        metadata.addProperty("timestamp", timestamp());
        metadata.addProperty("c_dataflow_version", DATAFLOW_VERSION);
        metadata.addProperty("analysis_type", "comprehensive_dataflow");
        metadata.add("code_stats", codeStats);

        JsonObject dataflowAnalysis = new JsonObject();
        dataflowAnalysis.add("variables", variablesJson(result.getVariables()));
        dataflowAnalysis.add("dependencies", stringListMapJson(result.getDependencies()));
        dataflowAnalysis.add("line_analysis", lineAnalysisJson(result.getLineAnalysis()));
        dataflowAnalysis.add("reaching_definitions", stringListMapJson(result.getReachingDefinitions()));

        JsonObject document = new JsonObject();
        document.add("metadata", metadata);
        document.add("syntax_errors", stringArray(result.getSyntaxErrors()));
        document.add("dataflow_analysis", dataflowAnalysis);
        return document;
    }

    public JsonObject linkedListDocument(OperationSequence operations) {
        JsonObject metadata = new JsonObject();
        metadata.addProperty("structure_type", "C_LINKED_LIST");
        metadata.addProperty("node_type", "operation_element");
        metadata.add("operation_types", enumNames(OperationType.values()));
        metadata.addProperty("total_operations", operations.size());
        metadata.add("list_head", pointer(operations.head()));
        metadata.addProperty("timestamp", timestamp());
        metadata.addProperty("c_dataflow_version", DATAFLOW_VERSION);

        JsonObject operationTypes = new JsonObject();
        for (OperationType type : OperationType.values()) {
            operationTypes.addProperty(type.name(), type.description());
        }
        JsonObject operationElement = new JsonObject();
        operationElement.addProperty("operation_id", "int");
        operationElement.addProperty("variable_name", "string");
        operationElement.addProperty("operation", "operation_types");
        operationElement.addProperty("line_number", "int");
        operationElement.addProperty("details", "string");
        operationElement.addProperty("next", "int* (pointer to next operation_id, NULL if last)");
        JsonObject typeDefinitions = new JsonObject();
        typeDefinitions.add("operation_types", operationTypes);
        typeDefinitions.add("operation_element", operationElement);

        JsonObject document = new JsonObject();
        document.add("metadata", metadata);
        document.add("type_definitions", typeDefinitions);
        document.add("linked_list_data", operationsJson(operations, operations));
        document.addProperty("c_style_representation", CStyleRenderer.renderOperations(operations));
        return document;
    }

    public JsonObject ttaGraphDocument(AnalysisResult result) {
        List<Block> blocks = result.getBlocks();
        List<Arc> arcs = result.getArcs();

        JsonObject metadata = new JsonObject();
        metadata.addProperty("structure_type", "TTA_GRAPH");
        metadata.addProperty("timestamp", timestamp());
        metadata.addProperty("tta_version", TTA_VERSION);
        metadata.addProperty("total_blocks", blocks.size());
        metadata.addProperty("total_arcs", arcs.size());

        JsonArray arcTypes = new JsonArray();
        for (ArcType arcType : ArcType.values()) {
            arcTypes.add(arcType.label());
        }
        JsonObject ttaNode = new JsonObject();
        ttaNode.addProperty("node_type", "node_types");
        ttaNode.addProperty("operation_sequence", "LinkedList<operation_element>");
        for (ArcType arcType : ArcType.values()) {
            ttaNode.addProperty(arcType.lineStyle() + "_arc", "ttagraph_node*");
        }
        JsonObject typeDefinitions = new JsonObject();
        typeDefinitions.add("node_types", enumNames(BlockType.values()));
        typeDefinitions.add("operation_types", enumNames(OperationType.values()));
        typeDefinitions.add("arc_types", arcTypes);
        typeDefinitions.add("ttagraph_node", ttaNode);

        JsonArray blocksJson = new JsonArray();
        for (Block block : blocks) {
            blocksJson.add(blockJson(block, result.getOperations()));
        }
        JsonArray arcsJson = new JsonArray();
        for (Arc arc : arcs) {
            arcsJson.add(arcJson(arc));
        }

        JsonObject document = new JsonObject();
        document.add("metadata", metadata);
        document.add("type_definitions", typeDefinitions);
        document.add("control_structures", controlStructuresJson(result.getControlStructures()));
        document.add("blocks", blocksJson);
        document.add("arcs", arcsJson);
        document.addProperty("c_style_representation", CStyleRenderer.renderBlocks(blocks));
        return document;
    }

    private JsonObject variablesJson(Map<String, VariableRecord> variables) {
        JsonObject variablesJson = new JsonObject();
        for (VariableRecord variable : variables.values()) {
            JsonObject variableJson = new JsonObject();
            variableJson.add("definitions", accessesJson(variable.getDefinitions()));
            variableJson.add("uses", accessesJson(variable.getUses()));
            variablesJson.add(variable.getName(), variableJson);
        }
        return variablesJson;
    }

    /**
     * Each access is a {@code [line, details]} pair.
     */
    private JsonArray accessesJson(List<VariableAccess> accesses) {
        JsonArray accessesJson = new JsonArray();
        for (VariableAccess access : accesses) {
            JsonArray pair = new JsonArray();
            pair.add(access.getLine());
            pair.add(access.getDetails());
            accessesJson.add(pair);
        }
        return accessesJson;
    }

    private JsonObject lineAnalysisJson(Map<Integer, LineRecord> lineAnalysis) {
        JsonObject lineAnalysisJson = new JsonObject();
        for (LineRecord lineRecord : lineAnalysis.values()) {
            JsonObject recordJson = new JsonObject();
            recordJson.add("reads", stringArray(lineRecord.getReads()));
            recordJson.add("writes", stringArray(lineRecord.getWrites()));
            recordJson.addProperty("operation", lineRecord.getOperation());
            lineAnalysisJson.add(String.valueOf(lineRecord.getLineNumber()), recordJson);
        }
        return lineAnalysisJson;
    }

    private JsonObject stringListMapJson(Map<?, List<String>> map) {
        JsonObject mapJson = new JsonObject();
        for (Map.Entry<?, List<String>> entry : map.entrySet()) {
            mapJson.add(String.valueOf(entry.getKey()), stringArray(entry.getValue()));
        }
        return mapJson;
    }

    /**
     * Operations carry their successor in the whole sequence, so a block's slice still points past its end.
     */
    private JsonArray operationsJson(List<Operation> operations, OperationSequence sequence) {
        JsonArray operationsJson = new JsonArray();
        for (Operation operation : operations) {
            JsonObject operationJson = new JsonObject();
            operationJson.addProperty("operation_id", operation.getId());
            operationJson.addProperty("variable_name", operation.getVariableName());
            operationJson.addProperty("operation", operation.getType().name());
            operationJson.addProperty("line_number", operation.getLineNumber());
            operationJson.addProperty("details", operation.getDetails());
            operationJson.add("next", pointer(sequence.nextOf(operation)));
            operationsJson.add(operationJson);
        }
        return operationsJson;
    }

    private JsonObject blockJson(Block block, OperationSequence sequence) {
        JsonObject blockJson = new JsonObject();
        blockJson.addProperty("block_id", block.getId());
        blockJson.addProperty("node_type", block.getType().name());
        blockJson.addProperty("start_line", block.getStartLine());
        blockJson.addProperty("end_line", block.getEndLine());
        blockJson.add("lines", stringArray(block.getLines()));
        blockJson.addProperty("code_preview", block.getCodePreview());
        blockJson.add("operation_sequence", operationsJson(block.getOperations(), sequence));
        return blockJson;
    }

    private JsonObject arcJson(Arc arc) {
        JsonObject arcJson = new JsonObject();
        arcJson.addProperty("from", arc.getFrom());
        arcJson.addProperty("to", arc.getTo());
        arcJson.addProperty("arc_type", arc.getType().label());
        arcJson.addProperty("line_style", arc.getType().lineStyle());
        arcJson.addProperty("description", arc.getDescription());
        return arcJson;
    }

    private JsonArray controlStructuresJson(List<ControlStructure> controlStructures) {
        JsonArray structuresJson = new JsonArray();
        for (ControlStructure structure : controlStructures) {
            JsonObject structureJson = new JsonObject();
            structureJson.addProperty("type", structure.getKind().name());
            structureJson.addProperty("start_line", structure.getStartLine());
            if (structure.getEndLine().isPresent()) {
                structureJson.addProperty("end_line", structure.getEndLine().getAsInt());
            } else {
                structureJson.add("end_line", JsonNull.INSTANCE);
            }
            structuresJson.add(structureJson);
        }
        return structuresJson;
    }

    private static JsonElement pointer(int operationId) {
        if (operationId == OperationSequence.TERMINAL) {
            return JsonNull.INSTANCE;
        }
        return new JsonPrimitive(operationId);
    }

    private static JsonArray stringArray(Collection<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }

    private static JsonArray enumNames(Enum<?>[] constants) {
        JsonArray array = new JsonArray();
        for (Enum<?> constant : constants) {
            array.add(constant.name());
        }
        return array;
    }

    private static int countWords(String sourceText) {
        String stripped = sourceText.strip();
        return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    }

    private String timestamp() {
        return LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
