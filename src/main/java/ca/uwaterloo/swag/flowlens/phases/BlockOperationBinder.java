package ca.uwaterloo.swag.flowlens.phases;

import ca.uwaterloo.swag.flowlens.models.Block;
import ca.uwaterloo.swag.flowlens.models.OperationSequence;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link BlockOperationBinder} attaches to every block the operations whose line falls inside the block's range.
 *
 * @since 0.0.1
 */
public class BlockOperationBinder {

    private final List<Block> blocks;
    private final OperationSequence operations;

    public BlockOperationBinder(List<Block> blocks, OperationSequence operations) {
        this.blocks = blocks;
        this.operations = operations;
    }

    public List<Block> bind() {
        List<Block> boundBlocks = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            boundBlocks.add(block.withOperations(operations.withinLines(block.getStartLine(), block.getEndLine())));
        }
        return boundBlocks;
    }
}
