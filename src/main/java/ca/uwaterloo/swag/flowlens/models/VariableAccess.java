package ca.uwaterloo.swag.flowlens.models;

/**
 * A single definition or use of a variable: the line it happens on and a human readable description.
 */
public final class VariableAccess {

    private final int line;
    private final String details;

    public VariableAccess(int line, String details) {
        this.line = line;
        this.details = details;
    }

    public int getLine() {
        return line;
    }

    public String getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof VariableAccess)) {
            return false;
        }
        VariableAccess other = (VariableAccess) obj;
        return this.line == other.line && this.details.equals(other.details);
    }

    @Override
    public int hashCode() {
        int result = 17;
        result = 31 * result + this.line;
        result = 31 * result + this.details.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "(" + line + ", " + details + ")";
    }
}
