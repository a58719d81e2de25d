package ca.uwaterloo.swag.flowlens.models;

public enum BlockType {
    START, LOOP, XOR, ACTIVITY, END
}
