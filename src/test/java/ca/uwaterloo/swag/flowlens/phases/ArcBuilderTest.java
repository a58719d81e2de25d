package ca.uwaterloo.swag.flowlens.phases;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.uwaterloo.swag.flowlens.Samples;
import ca.uwaterloo.swag.flowlens.models.Arc;
import ca.uwaterloo.swag.flowlens.models.ArcType;
import ca.uwaterloo.swag.flowlens.models.Block;
import ca.uwaterloo.swag.flowlens.models.BlockType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ArcBuilderTest {

    private static List<Arc> arcsOf(String sample) {
        return new ArcBuilder(new BlockPartitioner(Samples.lines(sample)).partition()).build();
    }

    @Test
    void ifBlockGetsTrueAndFalseArcs() {
        List<Arc> arcs = arcsOf("if_block.c");

        assertEquals(Arrays.asList(
            new Arc(0, 1, ArcType.SEQUENTIAL, "Sequential"),
            new Arc(1, 2, ArcType.CONDITIONAL, "If true"),
            new Arc(1, 3, ArcType.CONDITIONAL, "If false")), arcs);
    }

    @Test
    void whileLoopGetsEntryExitAndBackArcs() {
        List<Arc> arcs = arcsOf("while_loop.c");

        assertEquals(Arrays.asList(
            new Arc(0, 1, ArcType.SEQUENTIAL, "Function entry"),
            new Arc(1, 2, ArcType.SEQUENTIAL, "Sequential"),
            new Arc(2, 3, ArcType.CONDITIONAL, "Loop true"),
            new Arc(2, 5, ArcType.CONDITIONAL, "Loop false"),
            new Arc(4, 2, ArcType.LOOP_BACK, "Loop back"),
            new Arc(3, 4, ArcType.SEQUENTIAL, "Sequential")), arcs);
    }

    @Test
    void ifElseBranchesMergeAtTheReturn() {
        List<Arc> arcs = arcsOf("if_else.c");

        assertEquals(Arrays.asList(
            new Arc(0, 1, ArcType.SEQUENTIAL, "Function entry"),
            new Arc(1, 2, ArcType.SEQUENTIAL, "Sequential"),
            new Arc(2, 3, ArcType.CONDITIONAL, "If true"),
            new Arc(2, 4, ArcType.CONDITIONAL, "If false"),
            new Arc(3, 5, ArcType.SEQUENTIAL, "Branch to merge"),
            new Arc(4, 5, ArcType.SEQUENTIAL, "Branch to merge")), arcs);
    }

    @Test
    void activityDoesNotFlowIntoEnd() {
        List<Arc> arcs = arcsOf("pointers.c");
        assertEquals(List.of(new Arc(0, 1, ArcType.SEQUENTIAL, "Function entry")), arcs);
    }

    @Test
    void xorWithoutFollowingBlockHasNoArcs() {
        List<Block> blocks = List.of(new Block(0, BlockType.XOR, 1, 1, List.of("if (a) {")));
        assertTrue(new ArcBuilder(blocks).build().isEmpty());
    }

    @Test
    void xorFollowedByNonActivityHasOnlyTrueArc() {
        List<Block> blocks = new ArrayList<>();
        blocks.add(new Block(0, BlockType.XOR, 1, 1, List.of("if (a) {")));
        blocks.add(new Block(1, BlockType.END, 2, 2, List.of("return a;")));
        blocks.add(new Block(2, BlockType.ACTIVITY, 3, 3, List.of("}")));

        assertEquals(List.of(new Arc(0, 1, ArcType.CONDITIONAL, "If true")), new ArcBuilder(blocks).build());
    }

    @Test
    void loopWithoutLaterBlocksFallsBackToNoExit() {
        List<Block> blocks = new ArrayList<>();
        blocks.add(new Block(0, BlockType.LOOP, 1, 1, List.of("while (n) {")));
        blocks.add(new Block(1, BlockType.ACTIVITY, 2, 2, List.of("n = n - 1;")));

        assertEquals(Arrays.asList(
            new Arc(0, 1, ArcType.CONDITIONAL, "Loop true"),
            new Arc(1, 0, ArcType.LOOP_BACK, "Loop back")), new ArcBuilder(blocks).build());
    }

    @Test
    void nestedLoopExitSkipsInnerLoop() {
        List<Block> blocks = new ArrayList<>();
        blocks.add(new Block(0, BlockType.LOOP, 1, 1, List.of("for (i = 0; i < n; i++) {")));
        blocks.add(new Block(1, BlockType.LOOP, 2, 2, List.of("for (j = 0; j < n; j++) {")));
        blocks.add(new Block(2, BlockType.ACTIVITY, 3, 4, List.of("sum = sum + j;", "}")));
        blocks.add(new Block(3, BlockType.ACTIVITY, 5, 5, List.of("}")));
        blocks.add(new Block(4, BlockType.END, 6, 6, List.of("return sum;")));

        List<Arc> arcs = new ArcBuilder(blocks).build();
        assertTrue(arcs.contains(new Arc(0, 3, ArcType.CONDITIONAL, "Loop false")));
        assertTrue(arcs.contains(new Arc(2, 0, ArcType.LOOP_BACK, "Loop back")));
        assertTrue(arcs.contains(new Arc(1, 4, ArcType.CONDITIONAL, "Loop false")));
        assertTrue(arcs.contains(new Arc(3, 1, ArcType.LOOP_BACK, "Loop back")));
    }
}
