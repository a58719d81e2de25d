package ca.uwaterloo.swag.flowlens.phases;

import ca.uwaterloo.swag.flowlens.models.VariableAccess;
import ca.uwaterloo.swag.flowlens.models.VariableRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only table of definitions and uses, filled while the classifier walks the source and frozen into
 * {@link VariableRecord}s afterwards.
 */
final class VariableTable {

    private final Map<String, List<VariableAccess>> definitions = new LinkedHashMap<>();
    private final Map<String, List<VariableAccess>> uses = new LinkedHashMap<>();

    void recordDefinition(String varName, int line, String details) {
        register(varName);
        definitions.get(varName).add(new VariableAccess(line, details));
    }

    void recordUse(String varName, int line, String details) {
        register(varName);
        uses.get(varName).add(new VariableAccess(line, details));
    }

    private void register(String varName) {
        if (!definitions.containsKey(varName)) {
            definitions.put(varName, new ArrayList<>());
            uses.put(varName, new ArrayList<>());
        }
    }

    Map<String, VariableRecord> toRecords() {
        Map<String, VariableRecord> records = new LinkedHashMap<>();
        for (String varName : definitions.keySet()) {
            records.put(varName, new VariableRecord(varName, new ArrayList<>(definitions.get(varName)),
                new ArrayList<>(uses.get(varName))));
        }
        return records;
    }
}
