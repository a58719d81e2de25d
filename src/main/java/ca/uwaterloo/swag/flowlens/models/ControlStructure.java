package ca.uwaterloo.swag.flowlens.models;

import java.util.OptionalInt;

/**
 * A brace-delimited structure found by the partitioner's discovery pass. The end line stays empty while no closing
 * brace has been matched to it.
 */
public final class ControlStructure {

    private final Kind kind;
    private final int startLine;
    private final Integer endLine;

    public ControlStructure(Kind kind, int startLine) {
        this(kind, startLine, null);
    }

    private ControlStructure(Kind kind, int startLine, Integer endLine) {
        this.kind = kind;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public ControlStructure closedAt(int line) {
        return new ControlStructure(kind, startLine, line);
    }

    public Kind getKind() {
        return kind;
    }

    public int getStartLine() {
        return startLine;
    }

    public OptionalInt getEndLine() {
        return endLine == null ? OptionalInt.empty() : OptionalInt.of(endLine);
    }

    public boolean isClosed() {
        return endLine != null;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ControlStructure)) {
            return false;
        }
        ControlStructure other = (ControlStructure) obj;
        return this.kind == other.kind && this.startLine == other.startLine &&
            getEndLine().equals(other.getEndLine());
    }

    @Override
    public int hashCode() {
        int result = 17;
        result = 31 * result + this.kind.hashCode();
        result = 31 * result + this.startLine;
        result = 31 * result + (this.endLine == null ? 0 : this.endLine);
        return result;
    }

    @Override
    public String toString() {
        return kind + " [" + startLine + "-" + (endLine == null ? "?" : endLine) + "]";
    }

    public enum Kind {
        FUNCTION, IF, FOR, WHILE, ELSE, BLOCK
    }
}
