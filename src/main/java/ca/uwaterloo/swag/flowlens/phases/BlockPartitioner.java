package ca.uwaterloo.swag.flowlens.phases;

import ca.uwaterloo.swag.flowlens.models.Block;
import ca.uwaterloo.swag.flowlens.models.BlockType;
import ca.uwaterloo.swag.flowlens.models.ControlStructure;
import ca.uwaterloo.swag.flowlens.models.ControlStructure.Kind;
import ca.uwaterloo.swag.flowlens.util.CSyntax;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link BlockPartitioner} cuts the source into START/LOOP/XOR/ACTIVITY/END blocks.
 *
 * <p>A first pass matches braces to find where functions, conditionals, loops and bare blocks open and close. The
 * second pass carves the blocks with a cursor and local look-ahead; it does not consult the first pass, so deeply
 * nested or malformed input can produce overlapping or non-covering block ranges.
 *
 * @since 0.0.1
 */
public class BlockPartitioner {

    private static final Logger log = Logger.getLogger(BlockPartitioner.class.getName());
    private static final Pattern HEADER_KEYWORD = Pattern.compile("\\b(if|for|while|else)\\b");
    private final List<String> sourceLines;
    private final List<ControlStructure> controlStructures;
    private final List<Block> blocks;

    public BlockPartitioner(List<String> sourceLines) {
        this.sourceLines = sourceLines;
        this.controlStructures = new ArrayList<>();
        this.blocks = new ArrayList<>();
    }

    public List<Block> partition() {
        discoverStructures();
        carveBlocks();
        log.fine("Partitioned " + sourceLines.size() + " lines into " + blocks.size() + " blocks");
        return blocks;
    }

    public List<ControlStructure> getControlStructures() {
        return controlStructures;
    }

    private void discoverStructures() {
        Deque<Integer> openStructures = new ArrayDeque<>();
        for (int i = 0; i < sourceLines.size(); i++) {
            String line = sourceLines.get(i);
            if (CSyntax.isNonStatement(line)) {
                continue;
            }
            int lineNumber = i + 1;
            boolean opensBrace = line.indexOf('{') != -1;
            boolean closesBrace = line.indexOf('}') != -1;

            // "} else {" closes the then-branch before the else opens
            boolean closed = false;
            if (closesBrace && line.strip().startsWith("}")) {
                closeInnermost(openStructures, lineNumber);
                closed = true;
            }

            Matcher controlHeader = CSyntax.CONTROL_HEADER.matcher(line);
            Kind kind = null;
            if (CSyntax.FUNCTION_HEADER.matcher(line).find()) {
                kind = Kind.FUNCTION;
            } else if (controlHeader.find()) {
                kind = Kind.valueOf(controlHeader.group(1).toUpperCase(Locale.ROOT));
            } else if (CSyntax.ELSE.matcher(line).find()) {
                kind = Kind.ELSE;
            } else if (opensBrace && !HEADER_KEYWORD.matcher(line).find() && !openStructures.isEmpty()) {
                kind = Kind.BLOCK;
            }

            if (kind != null) {
                controlStructures.add(new ControlStructure(kind, lineNumber));
                if (opensBrace) {
                    openStructures.push(controlStructures.size() - 1);
                }
            }

            if (closesBrace && !closed) {
                closeInnermost(openStructures, lineNumber);
            }
        }
    }

    private void closeInnermost(Deque<Integer> openStructures, int lineNumber) {
        if (openStructures.isEmpty()) {
            return;
        }
        int index = openStructures.pop();
        controlStructures.set(index, controlStructures.get(index).closedAt(lineNumber));
    }

    private void carveBlocks() {
        int i = 0;
        while (i < sourceLines.size()) {
            String line = sourceLines.get(i);
            int lineNumber = i + 1;
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith(CSyntax.DIRECTIVE)) {
                i++;
                continue;
            }

            // comment lines go through the header rules, so "// return early" still ends a block
            if (CSyntax.FUNCTION_HEADER.matcher(line).find()) {
                addBlock(BlockType.START, lineNumber, lineNumber, List.of(line));
                i++;
            } else if (CSyntax.LOOP_HEADER.matcher(line).find()) {
                addBlock(BlockType.LOOP, lineNumber, lineNumber, List.of(line));
                i++;
            } else if (CSyntax.IF_HEADER.matcher(line).find()) {
                addBlock(BlockType.XOR, lineNumber, lineNumber, List.of(line));
                i++;
            } else if (CSyntax.RETURN.matcher(line).find()) {
                i = carveEnd(i) + 1;
            } else if (CSyntax.ELSE.matcher(line).find()) {
                i = carveElse(i);
            } else if (isBodyBrace(i)) {
                i = carveBraceRun(i);
            } else if (stripped.startsWith(CSyntax.LINE_COMMENT)) {
                i++;
            } else {
                i = carveRun(i);
            }
        }
    }

    /**
     * Emits the END block of a return statement, absorbing the next lone closing brace when it is the last one in
     * the file.
     *
     * @return index of the last consumed line
     */
    private int carveEnd(int returnIndex) {
        List<String> blockLines = new ArrayList<>();
        blockLines.add(sourceLines.get(returnIndex));
        int lastIndex = returnIndex;
        for (int j = returnIndex + 1; j < sourceLines.size(); j++) {
            String next = sourceLines.get(j).strip();
            if ("}".equals(next)) {
                if (!hasClosingBraceAfter(j)) {
                    blockLines.add(sourceLines.get(j));
                    lastIndex = j;
                }
                break;
            }
            if (CSyntax.isMeaningful(next)) {
                break;
            }
        }
        addBlock(BlockType.END, returnIndex + 1, lastIndex + 1, blockLines);
        return lastIndex;
    }

    private boolean hasClosingBraceAfter(int index) {
        for (int k = index + 1; k < sourceLines.size(); k++) {
            if (sourceLines.get(k).indexOf('}') != -1) {
                return true;
            }
        }
        return false;
    }

    private int carveElse(int elseIndex) {
        String line = sourceLines.get(elseIndex);
        int startLine = elseIndex + 1;
        List<String> blockLines = new ArrayList<>();
        blockLines.add(line);
        int i = elseIndex + 1;

        if (line.indexOf('{') != -1) {
            int depth = 1;
            while (i < sourceLines.size() && depth > 0) {
                String current = sourceLines.get(i);
                blockLines.add(current);
                depth += CSyntax.count(current, '{') - CSyntax.count(current, '}');
                i++;
            }
            // more than "else {" and "}"
            if (blockLines.size() > 2) {
                addBlock(BlockType.ACTIVITY, startLine, startLine + blockLines.size() - 1, blockLines);
            }
            return i;
        }

        if (i < sourceLines.size()) {
            blockLines.add(sourceLines.get(i));
            i++;
        }
        addBlock(BlockType.ACTIVITY, startLine, startLine + blockLines.size() - 1, blockLines);
        return i;
    }

    private boolean isBodyBrace(int index) {
        return index > 0 && "{".equals(sourceLines.get(index).strip()) &&
            HEADER_KEYWORD.matcher(sourceLines.get(index - 1)).find();
    }

    /**
     * Collects the statements following a brace that opens a control body, up to the next control keyword or
     * closing brace. The block range starts at the brace itself.
     */
    private int carveBraceRun(int braceIndex) {
        List<String> blockLines = new ArrayList<>();
        int endLine = braceIndex + 1;
        int i = braceIndex + 1;
        while (i < sourceLines.size()) {
            String stripped = sourceLines.get(i).strip();
            if (CSyntax.CONTROL_KEYWORD.matcher(stripped).find() || stripped.indexOf('}') != -1) {
                break;
            }
            if (!stripped.isEmpty()) {
                blockLines.add(sourceLines.get(i));
                endLine = i + 1;
            }
            i++;
        }
        if (hasMeaningfulLine(blockLines)) {
            addBlock(BlockType.ACTIVITY, braceIndex + 1, endLine, blockLines);
        }
        return i;
    }

    private int carveRun(int startIndex) {
        List<String> blockLines = new ArrayList<>();
        blockLines.add(sourceLines.get(startIndex));
        int i = startIndex + 1;
        while (i < sourceLines.size()) {
            String stripped = sourceLines.get(i).strip();
            if (endsRun(stripped)) {
                break;
            }
            blockLines.add(sourceLines.get(i));
            i++;
        }
        if (hasMeaningfulLine(blockLines)) {
            addBlock(BlockType.ACTIVITY, startIndex + 1, startIndex + blockLines.size(), blockLines);
        }
        return i;
    }

    private static boolean endsRun(String stripped) {
        return stripped.isEmpty() ||
            stripped.startsWith(CSyntax.DIRECTIVE) ||
            CSyntax.CONTROL_KEYWORD.matcher(stripped).find() ||
            "}".equals(stripped) ||
            (stripped.indexOf('}') != -1 && stripped.indexOf('{') == -1);
    }

    private static boolean hasMeaningfulLine(List<String> lines) {
        for (String line : lines) {
            if (CSyntax.isMeaningful(line)) {
                return true;
            }
        }
        return false;
    }

    private void addBlock(BlockType type, int startLine, int endLine, List<String> lines) {
        blocks.add(new Block(blocks.size(), type, startLine, endLine, new ArrayList<>(lines)));
    }
}
