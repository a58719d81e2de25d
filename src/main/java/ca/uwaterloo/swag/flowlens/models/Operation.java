package ca.uwaterloo.swag.flowlens.models;

/**
 * One WRITE, READ or KILL event of the operation log. The link to the following event is not stored here; see
 * {@link OperationSequence#nextOf(Operation)}.
 */
public final class Operation {

    private final int id;
    private final String variableName;
    private final OperationType type;
    private final int lineNumber;
    private final String details;

    public Operation(int id, String variableName, OperationType type, int lineNumber, String details) {
        this.id = id;
        this.variableName = variableName;
        this.type = type;
        this.lineNumber = lineNumber;
        this.details = details;
    }

    public int getId() {
        return id;
    }

    public String getVariableName() {
        return variableName;
    }

    public OperationType getType() {
        return type;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Operation)) {
            return false;
        }
        Operation other = (Operation) obj;
        return this.id == other.id && this.variableName.equals(other.variableName) && this.type == other.type &&
            this.lineNumber == other.lineNumber && this.details.equals(other.details);
    }

    @Override
    public int hashCode() {
        int result = 17;
        result = 31 * result + this.id;
        result = 31 * result + this.variableName.hashCode();
        result = 31 * result + this.type.hashCode();
        result = 31 * result + this.lineNumber;
        result = 31 * result + this.details.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return id + ":" + type + " " + variableName + "@" + lineNumber;
    }
}
