package ca.uwaterloo.swag.flowlens.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A contiguous run of source lines playing one control-flow role in the TTA graph.
 */
public final class Block {

    public static final String EMPTY_PREVIEW = "{ ... }";
    private static final int PREVIEW_LIMIT = 50;
    private static final int PREVIEW_CUT = 47;

    private final int id;
    private final BlockType type;
    private final int startLine;
    private final int endLine;
    private final List<String> lines;
    private final String codePreview;
    private final List<Operation> operations;

    public Block(int id, BlockType type, int startLine, int endLine, List<String> lines) {
        this(id, type, startLine, endLine, lines, Collections.emptyList());
    }

    private Block(int id, BlockType type, int startLine, int endLine, List<String> lines,
                  List<Operation> operations) {
        this.id = id;
        this.type = type;
        this.startLine = startLine;
        this.endLine = endLine;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.codePreview = preview(this.lines);
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
    }

    private static String preview(List<String> lines) {
        for (String line : lines) {
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith("//")) {
                continue;
            }
            if (stripped.length() > PREVIEW_LIMIT) {
                return stripped.substring(0, PREVIEW_CUT) + "...";
            }
            return stripped;
        }
        return EMPTY_PREVIEW;
    }

    public Block withOperations(List<Operation> boundOperations) {
        return new Block(id, type, startLine, endLine, lines, boundOperations);
    }

    public int getId() {
        return id;
    }

    public BlockType getType() {
        return type;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public List<String> getLines() {
        return lines;
    }

    public String getCodePreview() {
        return codePreview;
    }

    public List<Operation> getOperations() {
        return operations;
    }

    public boolean containsText(String text) {
        for (String line : lines) {
            if (line.contains(text)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Block)) {
            return false;
        }
        Block other = (Block) obj;
        return this.id == other.id && this.type == other.type && this.startLine == other.startLine &&
            this.endLine == other.endLine && this.lines.equals(other.lines) &&
            this.operations.equals(other.operations);
    }

    @Override
    public int hashCode() {
        int result = 17;
        result = 31 * result + this.id;
        result = 31 * result + this.type.hashCode();
        result = 31 * result + this.startLine;
        result = 31 * result + this.endLine;
        return result;
    }

    @Override
    public String toString() {
        return "block_" + id + " " + type + " [" + startLine + "-" + endLine + "] " + codePreview;
    }
}
