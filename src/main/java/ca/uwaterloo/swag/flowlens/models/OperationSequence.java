package ca.uwaterloo.swag.flowlens.models;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * The operation log of a run, stored as a contiguous array where an operation's id is its index. The successor of
 * an operation is always {@code id + 1}; the last one points to {@link #TERMINAL}.
 */
public final class OperationSequence extends AbstractList<Operation> implements RandomAccess {

    public static final int TERMINAL = -1;

    private final Operation[] operations;

    public OperationSequence(List<Operation> operations) {
        this.operations = operations.toArray(new Operation[0]);
        for (int i = 0; i < this.operations.length; i++) {
            if (this.operations[i].getId() != i) {
                throw new IllegalArgumentException("Operation ids must be dense, found " +
                    this.operations[i].getId() + " at index " + i);
            }
        }
    }

    public static OperationSequence empty() {
        return new OperationSequence(new ArrayList<>());
    }

    @Override
    public Operation get(int index) {
        return operations[index];
    }

    @Override
    public int size() {
        return operations.length;
    }

    public int nextOf(Operation operation) {
        int next = operation.getId() + 1;
        return next < operations.length ? next : TERMINAL;
    }

    public int head() {
        return operations.length > 0 ? 0 : TERMINAL;
    }

    public List<Operation> withinLines(int startLine, int endLine) {
        List<Operation> slice = new ArrayList<>();
        for (Operation operation : operations) {
            if (startLine <= operation.getLineNumber() && operation.getLineNumber() <= endLine) {
                slice.add(operation);
            }
        }
        return slice;
    }
}
