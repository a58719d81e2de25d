package ca.uwaterloo.swag.flowlens.export;

import ca.uwaterloo.swag.flowlens.models.Block;
import ca.uwaterloo.swag.flowlens.models.BlockType;
import ca.uwaterloo.swag.flowlens.models.Operation;
import ca.uwaterloo.swag.flowlens.models.OperationSequence;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the operation log and the block graph as commented C declarations, one node per entry.
 */
final class CStyleRenderer {

    private static final List<String> OPERATION_ELEMENT_STRUCT = Arrays.asList(
        "struct operation_element {",
        "    int operation_id;",
        "    char* variable_name;",
        "    operation_types operation;",
        "    int line_number;",
        "    char* details;",
        "    struct operation_element* next;",
        "};",
        "");

    private CStyleRenderer() {
    }

    static String renderOperations(OperationSequence operations) {
        List<String> cLines = new ArrayList<>();
        cLines.add("// C Structure Definitions");
        cLines.add("typedef enum {");
        cLines.add("    WRITE,");
        cLines.add("    READ,");
        cLines.add("    KILL");
        cLines.add("} operation_types;");
        cLines.add("");
        cLines.addAll(OPERATION_ELEMENT_STRUCT);
        cLines.add("// Linked List Nodes (conceptual representation)");

        for (Operation operation : operations) {
            int id = operation.getId();
            int next = operations.nextOf(operation);
            String nextPointer = next == OperationSequence.TERMINAL ? "NULL" : "&node_" + next;
            cLines.add("// Node " + id + ":");
            cLines.add("// operation_element node_" + id + " = {");
            cLines.add("//     .operation_id = " + id + ",");
            cLines.add("//     .variable_name = \"" + operation.getVariableName() + "\",");
            cLines.add("//     .operation = " + operation.getType().name() + ",");
            cLines.add("//     .line_number = " + operation.getLineNumber() + ",");
            cLines.add("//     .details = \"" + operation.getDetails() + "\",");
            cLines.add("//     .next = " + nextPointer);
            cLines.add("// };");
            cLines.add("");
        }
        return String.join("\n", cLines);
    }

    static String renderBlocks(List<Block> blocks) {
        List<String> cLines = new ArrayList<>();
        cLines.add("// TTA Graph C Structure Definitions");
        cLines.add("typedef enum {");
        cLines.add("    " + Arrays.stream(BlockType.values()).map(Enum::name).collect(Collectors.joining(", ")));
        cLines.add("} node_types;");
        cLines.add("");
        cLines.add("typedef enum {");
        cLines.add("    WRITE, READ, KILL");
        cLines.add("} operation_types;");
        cLines.add("");
        cLines.addAll(OPERATION_ELEMENT_STRUCT);
        cLines.add("struct ttagraph_node {");
        cLines.add("    node_types node_type;");
        cLines.add("    struct operation_element* operation_sequence;");
        cLines.add("    struct ttagraph_node* solid_arc;");
        cLines.add("    struct ttagraph_node* dashed_arc;");
        cLines.add("    struct ttagraph_node* dotted_arc;");
        cLines.add("};");
        cLines.add("");
        cLines.add("// TTA Graph Nodes");

        for (Block block : blocks) {
            int id = block.getId();
            cLines.add("// Block " + id + " - " + block.getType().name() + " (Lines " + block.getStartLine() + "-" +
                block.getEndLine() + ")");
            cLines.add("// Code: " + block.getCodePreview());
            cLines.add("// ttagraph_node block_" + id + " = {");
            cLines.add("//     .node_type = " + block.getType().name() + ",");
            cLines.add("//     .operation_sequence = /* " + block.getOperations().size() + " operations */,");
            cLines.add("//     .solid_arc = /* determined by arcs */,");
            cLines.add("//     .dashed_arc = /* determined by arcs */,");
            cLines.add("//     .dotted_arc = /* determined by arcs */");
            cLines.add("// };");
            cLines.add("");
        }
        return String.join("\n", cLines);
    }
}
