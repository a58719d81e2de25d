package ca.uwaterloo.swag.flowlens.phases;

import static ca.uwaterloo.swag.flowlens.util.CSyntax.IDENTIFIER;

import ca.uwaterloo.swag.flowlens.models.LineRecord;
import ca.uwaterloo.swag.flowlens.models.Operation;
import ca.uwaterloo.swag.flowlens.models.OperationSequence;
import ca.uwaterloo.swag.flowlens.models.OperationType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link OperationSequenceBuilder} linearizes the per-line reads and writes into the WRITE/READ/KILL operation
 * log. Per line, writes come first (each preceded by a KILL when it redefines a variable), then reads, then a KILL
 * for an explicit deallocation such as {@code free(p)}.
 *
 * @since 0.0.1
 */
public class OperationSequenceBuilder {

    private static final Logger log = Logger.getLogger(OperationSequenceBuilder.class.getName());
    private final List<String> sourceLines;
    private final SortedMap<Integer, LineRecord> lineRecords;
    private final Pattern deallocationCall;
    private final List<Operation> operations;
    private final Map<String, Integer> lastDefinitions;

    public OperationSequenceBuilder(List<String> sourceLines, SortedMap<Integer, LineRecord> lineRecords,
                                    List<String> deallocationFunctions) {
        this.sourceLines = sourceLines;
        this.lineRecords = lineRecords;
        this.deallocationCall = deallocationPattern(deallocationFunctions);
        this.operations = new ArrayList<>();
        this.lastDefinitions = new HashMap<>();
    }

    private static Pattern deallocationPattern(List<String> deallocationFunctions) {
        if (deallocationFunctions.isEmpty()) {
            return null;
        }
        String alternatives = deallocationFunctions.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternatives + ")\\s*\\(\\s*(" + IDENTIFIER + ")\\s*\\)");
    }

    public OperationSequence build() {
        for (LineRecord lineRecord : lineRecords.values()) {
            int lineNumber = lineRecord.getLineNumber();
            String operationLabel = lineRecord.getOperation();

            for (String writtenVar : lineRecord.getWrites()) {
                Integer previousDefinition = lastDefinitions.get(writtenVar);
                if (previousDefinition != null) {
                    append(writtenVar, OperationType.KILL, lineNumber, "Variable '" + writtenVar +
                        "' redefined, killing previous definition from line " + previousDefinition);
                }
                append(writtenVar, OperationType.WRITE, lineNumber, operationLabel);
                lastDefinitions.put(writtenVar, lineNumber);
            }

            for (String readVar : lineRecord.getReads()) {
                append(readVar, OperationType.READ, lineNumber, operationLabel);
            }

            if (deallocationCall == null || lineNumber > sourceLines.size()) {
                continue;
            }
            Matcher freed = deallocationCall.matcher(sourceLines.get(lineNumber - 1));
            if (freed.find()) {
                String freedVar = freed.group(1);
                append(freedVar, OperationType.KILL, lineNumber, "Memory freed for variable '" + freedVar + "'");
            }
        }
        log.fine("Built operation sequence of " + operations.size() + " operations");
        return new OperationSequence(operations);
    }

    private void append(String varName, OperationType type, int lineNumber, String details) {
        operations.add(new Operation(operations.size(), varName, type, lineNumber, details));
    }
}
