package ca.uwaterloo.swag.flowlens.phases;

import ca.uwaterloo.swag.flowlens.models.Arc;
import ca.uwaterloo.swag.flowlens.models.ArcType;
import ca.uwaterloo.swag.flowlens.models.Block;
import ca.uwaterloo.swag.flowlens.models.BlockType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * {@link ArcBuilder} connects the partitioned blocks with sequential, conditional and loop-back arcs.
 *
 * <p>Branch, merge and loop-exit targets are found by short forward and backward scans over the block list, not
 * by a control-flow derivation. When a scan finds no peer the corresponding arc is left out.
 *
 * @since 0.0.1
 */
public class ArcBuilder {

    private static final Logger log = Logger.getLogger(ArcBuilder.class.getName());
    private static final int NONE = -1;
    private final List<Block> blocks;
    private final List<Arc> arcs;

    public ArcBuilder(List<Block> blocks) {
        this.blocks = blocks;
        this.arcs = new ArrayList<>();
    }

    public List<Arc> build() {
        for (int i = 0; i < blocks.size(); i++) {
            switch (typeOf(i)) {
                case START:
                    if (i + 1 < blocks.size()) {
                        addArc(i, i + 1, ArcType.SEQUENTIAL, "Function entry");
                    }
                    break;
                case ACTIVITY:
                    connectActivity(i);
                    break;
                case LOOP:
                    connectLoop(i);
                    break;
                case XOR:
                    connectConditional(i);
                    break;
                default:
                    break;
            }
        }
        log.fine("Built " + arcs.size() + " arcs over " + blocks.size() + " blocks");
        return arcs;
    }

    private void connectActivity(int activityIdx) {
        if (isBranchBlock(activityIdx)) {
            int mergePoint = findMergePoint(activityIdx);
            if (mergePoint != NONE) {
                addArc(activityIdx, mergePoint, ArcType.SEQUENTIAL, "Branch to merge");
            }
        } else if (activityIdx + 1 < blocks.size() && typeOf(activityIdx + 1) != BlockType.END) {
            addArc(activityIdx, activityIdx + 1, ArcType.SEQUENTIAL, "Sequential");
        }
    }

    private void connectLoop(int loopIdx) {
        if (loopIdx + 1 < blocks.size()) {
            addArc(loopIdx, loopIdx + 1, ArcType.CONDITIONAL, "Loop true");
        }
        int loopExit = findLoopExit(loopIdx);
        if (loopExit != NONE) {
            addArc(loopIdx, loopExit, ArcType.CONDITIONAL, "Loop false");
        }
        int loopBodyEnd = findLoopBodyEnd(loopIdx, loopExit);
        if (loopBodyEnd != NONE) {
            addArc(loopBodyEnd, loopIdx, ArcType.LOOP_BACK, "Loop back");
        }
    }

    private void connectConditional(int xorIdx) {
        List<Integer> branches = findXorBranches(xorIdx);
        if (branches.size() >= 1) {
            addArc(xorIdx, branches.get(0), ArcType.CONDITIONAL, "If true");
        }
        if (branches.size() >= 2) {
            addArc(xorIdx, branches.get(1), ArcType.CONDITIONAL, "If false");
        }
    }

    /**
     * An XOR block among the two blocks before {@code blockIdx}; the first block of the list is never looked at.
     */
    private boolean isBranchBlock(int blockIdx) {
        for (int i = blockIdx - 1; i > Math.max(0, blockIdx - 3); i--) {
            if (typeOf(i) == BlockType.XOR) {
                return true;
            }
        }
        return false;
    }

    private int findMergePoint(int branchIdx) {
        for (int i = branchIdx + 1; i < blocks.size(); i++) {
            BlockType type = typeOf(i);
            if (type == BlockType.LOOP || type == BlockType.XOR || type == BlockType.END) {
                return i;
            }
            if (type == BlockType.ACTIVITY && !isBranchBlock(i)) {
                return i;
            }
        }
        return NONE;
    }

    private List<Integer> findXorBranches(int xorIdx) {
        int trueBranch = xorIdx + 1;
        if (trueBranch >= blocks.size()) {
            return Collections.emptyList();
        }
        List<Integer> branches = new ArrayList<>();
        branches.add(trueBranch);

        int falseBranch = trueBranch + 1;
        if (typeOf(trueBranch) == BlockType.ACTIVITY && falseBranch < blocks.size() &&
            typeOf(falseBranch) == BlockType.ACTIVITY) {
            boolean hasElse = blocks.get(falseBranch).containsText("else");
            if (hasElse || falseBranch == xorIdx + 2) {
                branches.add(falseBranch);
            }
        }
        return branches;
    }

    private int findLoopExit(int loopIdx) {
        int loopDepth = 0;
        for (int i = loopIdx + 1; i < blocks.size(); i++) {
            BlockType type = typeOf(i);
            if (type == BlockType.LOOP) {
                loopDepth++;
            }
            if (loopDepth == 0) {
                if (type == BlockType.XOR || type == BlockType.LOOP || type == BlockType.END) {
                    return i;
                }
                // an activity this far from the header is taken to be past the body
                if (type == BlockType.ACTIVITY && i > loopIdx + 2) {
                    return i;
                }
            }
            if (loopDepth > 0 && blocks.get(i).containsText("}")) {
                loopDepth--;
            }
        }

        for (int i = loopIdx + 1; i < blocks.size(); i++) {
            if (typeOf(i) == BlockType.END) {
                return i;
            }
        }
        return NONE;
    }

    private int findLoopBodyEnd(int loopIdx, int loopExit) {
        int lastActivity = NONE;
        for (int i = loopIdx + 1; i < blocks.size(); i++) {
            if (loopExit != NONE && i >= loopExit) {
                break;
            }
            BlockType type = typeOf(i);
            if (type == BlockType.ACTIVITY) {
                lastActivity = i;
            } else if (type == BlockType.XOR) {
                List<Integer> branches = findXorBranches(i);
                if (!branches.isEmpty()) {
                    lastActivity = Collections.max(branches);
                }
            }
        }
        return lastActivity;
    }

    private BlockType typeOf(int blockIdx) {
        return blocks.get(blockIdx).getType();
    }

    private void addArc(int fromIdx, int toIdx, ArcType type, String description) {
        arcs.add(new Arc(blocks.get(fromIdx).getId(), blocks.get(toIdx).getId(), type, description));
    }
}
