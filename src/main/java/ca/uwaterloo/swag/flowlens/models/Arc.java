package ca.uwaterloo.swag.flowlens.models;

/**
 * A typed, directed edge between two blocks of the TTA graph, identified by block ids.
 */
public final class Arc {

    private final int from;
    private final int to;
    private final ArcType type;
    private final String description;

    public Arc(int from, int to, ArcType type, String description) {
        this.from = from;
        this.to = to;
        this.type = type;
        this.description = description;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public ArcType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Arc)) {
            return false;
        }
        Arc other = (Arc) obj;
        return this.from == other.from && this.to == other.to && this.type == other.type &&
            this.description.equals(other.description);
    }

    @Override
    public int hashCode() {
        int result = 17;
        result = 31 * result + this.from;
        result = 31 * result + this.to;
        result = 31 * result + this.type.hashCode();
        result = 31 * result + this.description.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return from + " -> " + to + " (" + type.label() + ", " + description + ")";
    }
}
