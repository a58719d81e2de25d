package ca.uwaterloo.swag.flowlens.models;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads, writes and the operation label the statement classifier settled on for one source line.
 */
public final class LineRecord {

    private final int lineNumber;
    private final Set<String> reads;
    private final Set<String> writes;
    private final String operation;

    public LineRecord(int lineNumber, Set<String> reads, Set<String> writes, String operation) {
        this.lineNumber = lineNumber;
        this.reads = Collections.unmodifiableSet(new LinkedHashSet<>(reads));
        this.writes = Collections.unmodifiableSet(new LinkedHashSet<>(writes));
        this.operation = operation;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public Set<String> getReads() {
        return reads;
    }

    public Set<String> getWrites() {
        return writes;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof LineRecord)) {
            return false;
        }
        LineRecord other = (LineRecord) obj;
        return this.lineNumber == other.lineNumber && this.reads.equals(other.reads) &&
            this.writes.equals(other.writes) && this.operation.equals(other.operation);
    }

    @Override
    public int hashCode() {
        int result = 17;
        result = 31 * result + this.lineNumber;
        result = 31 * result + this.reads.hashCode();
        result = 31 * result + this.writes.hashCode();
        result = 31 * result + this.operation.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return lineNumber + ": reads=" + reads + " writes=" + writes + " operation=" + operation;
    }
}
