package ca.uwaterloo.swag.flowlens.models;

public enum ArcType {
    SEQUENTIAL("sequential", "solid"),
    CONDITIONAL("conditional", "dashed"),
    LOOP_BACK("loop-back", "dotted");

    private final String label;
    private final String lineStyle;

    ArcType(String label, String lineStyle) {
        this.label = label;
        this.lineStyle = lineStyle;
    }

    public String label() {
        return label;
    }

    public String lineStyle() {
        return lineStyle;
    }
}
