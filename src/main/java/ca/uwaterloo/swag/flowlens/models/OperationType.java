package ca.uwaterloo.swag.flowlens.models;

public enum OperationType {
    WRITE("Variable definition or assignment"),
    READ("Variable usage or reference"),
    KILL("Variable goes out of scope, is redefined, or explicitly freed");

    private final String description;

    OperationType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
