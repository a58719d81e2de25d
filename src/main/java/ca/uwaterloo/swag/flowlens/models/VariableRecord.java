package ca.uwaterloo.swag.flowlens.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Definitions and uses of one variable over a single analysis run. A dereference such as {@code *p} is tracked as
 * its own record, separate from {@code p}.
 */
public final class VariableRecord {

    public static final String DEREFERENCE_PREFIX = "*";

    private final String name;
    private final List<VariableAccess> definitions;
    private final List<VariableAccess> uses;

    public VariableRecord(String name, List<VariableAccess> definitions, List<VariableAccess> uses) {
        this.name = name;
        this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
        this.uses = Collections.unmodifiableList(new ArrayList<>(uses));
    }

    public String getName() {
        return name;
    }

    public List<VariableAccess> getDefinitions() {
        return definitions;
    }

    public List<VariableAccess> getUses() {
        return uses;
    }

    public boolean isDereference() {
        return name.startsWith(DEREFERENCE_PREFIX);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof VariableRecord)) {
            return false;
        }
        VariableRecord other = (VariableRecord) obj;
        return this.name.equals(other.name) && this.definitions.equals(other.definitions) &&
            this.uses.equals(other.uses);
    }

    @Override
    public int hashCode() {
        int result = 17;
        result = 31 * result + this.name.hashCode();
        result = 31 * result + this.definitions.hashCode();
        result = 31 * result + this.uses.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return name + " defs=" + definitions + " uses=" + uses;
    }
}
