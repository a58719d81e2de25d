package ca.uwaterloo.swag.flowlens.phases;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.uwaterloo.swag.flowlens.Samples;
import ca.uwaterloo.swag.flowlens.models.Block;
import ca.uwaterloo.swag.flowlens.models.BlockType;
import ca.uwaterloo.swag.flowlens.models.ControlStructure;
import ca.uwaterloo.swag.flowlens.models.ControlStructure.Kind;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class BlockPartitionerTest {

    private static List<String> describe(List<Block> blocks) {
        return blocks.stream()
            .map(block -> block.getType() + " " + block.getStartLine() + "-" + block.getEndLine())
            .collect(Collectors.toList());
    }

    @Test
    void ifBlockAtTopLevel() {
        List<Block> blocks = new BlockPartitioner(Samples.lines("if_block.c")).partition();

        assertEquals(List.of("ACTIVITY 1-2", "XOR 3-3", "ACTIVITY 4-4", "ACTIVITY 5-5"), describe(blocks));
        assertEquals("if (a > b) {", blocks.get(1).getCodePreview());
    }

    @Test
    void whileLoopInsideMain() {
        List<Block> blocks = new BlockPartitioner(Samples.lines("while_loop.c")).partition();

        assertEquals(List.of("START 1-1", "ACTIVITY 2-2", "LOOP 3-3", "ACTIVITY 4-4", "ACTIVITY 5-5", "END 6-7"),
            describe(blocks));
    }

    @Test
    void elseBranchFormsOneActivity() {
        List<Block> blocks = new BlockPartitioner(Samples.lines("if_else.c")).partition();

        assertEquals(List.of("START 1-1", "ACTIVITY 2-3", "XOR 4-4", "ACTIVITY 5-5", "ACTIVITY 6-8", "END 9-10"),
            describe(blocks));
        assertTrue(blocks.get(4).containsText("else"));
        assertEquals("} else {", blocks.get(4).getCodePreview());
    }

    @Test
    void returnAbsorbsOnlyTheFinalClosingBrace() {
        List<Block> blocks = new BlockPartitioner(Arrays.asList(
            "int f(int n) {",
            "    if (n > 0) {",
            "        return n;",
            "    }",
            "    return 0;",
            "}")).partition();

        assertEquals(List.of("START 1-1", "XOR 2-2", "END 3-3", "ACTIVITY 4-4", "END 5-6"), describe(blocks));
    }

    @Test
    void braceOnItsOwnLineStartsTheBody() {
        List<Block> blocks = new BlockPartitioner(Arrays.asList(
            "while (n > 0)",
            "{",
            "    n = n - 1;",
            "}")).partition();

        assertEquals(List.of("LOOP 1-1", "ACTIVITY 2-3", "ACTIVITY 4-4"), describe(blocks));
        assertEquals("n = n - 1;", blocks.get(1).getCodePreview());
    }

    @Test
    void emptyElseBodyIsDropped() {
        List<Block> blocks = new BlockPartitioner(Arrays.asList(
            "if (a) {",
            "    b = 1;",
            "} else {",
            "}")).partition();

        assertEquals(List.of("XOR 1-1", "ACTIVITY 2-2"), describe(blocks));
    }

    @Test
    void longPreviewIsTruncated() {
        String longLine = "total = first_value + second_value + third_value + fourth_value;";
        Block block = new BlockPartitioner(List.of(longLine)).partition().get(0);

        assertEquals(50, block.getCodePreview().length());
        assertTrue(block.getCodePreview().endsWith("..."));
    }

    @Test
    void commentsAndDirectivesAreNotBlocks() {
        List<Block> blocks = new BlockPartitioner(Arrays.asList("#include <stdio.h>", "// note", "")).partition();
        assertTrue(blocks.isEmpty());
    }

    @Test
    void commentMentioningReturnEndsABlock() {
        List<Block> blocks = new BlockPartitioner(Arrays.asList(
            "int main() {",
            "    // return early when empty",
            "    int x = 1;",
            "    return x;",
            "}")).partition();

        assertEquals(List.of("START 1-1", "END 2-2", "ACTIVITY 3-3", "END 4-5"), describe(blocks));
    }

    @Test
    void plainCommentDoesNotStartARun() {
        List<Block> blocks = new BlockPartitioner(Arrays.asList("// setup", "x = 1;")).partition();

        assertEquals(List.of("ACTIVITY 2-2"), describe(blocks));
    }

    @Test
    void blockIdsAreSequential() {
        List<Block> blocks = new BlockPartitioner(Samples.lines("if_else.c")).partition();
        for (int i = 0; i < blocks.size(); i++) {
            assertEquals(i, blocks.get(i).getId());
        }
    }

    @Test
    void controlStructuresAreMatchedToClosingBraces() {
        BlockPartitioner partitioner = new BlockPartitioner(Samples.lines("if_else.c"));
        partitioner.partition();
        List<ControlStructure> structures = partitioner.getControlStructures();

        assertEquals(3, structures.size());
        assertEquals(Kind.FUNCTION, structures.get(0).getKind());
        assertEquals(10, structures.get(0).getEndLine().getAsInt());
        assertEquals(Kind.IF, structures.get(1).getKind());
        assertEquals(6, structures.get(1).getEndLine().getAsInt());
        assertEquals(Kind.ELSE, structures.get(2).getKind());
        assertEquals(6, structures.get(2).getStartLine());
        assertEquals(8, structures.get(2).getEndLine().getAsInt());
    }

    @Test
    void unclosedStructureHasNoEndLine() {
        BlockPartitioner partitioner = new BlockPartitioner(Arrays.asList("int main() {", "    int x = 1;"));
        List<Block> blocks = partitioner.partition();

        assertEquals(1, partitioner.getControlStructures().size());
        assertFalse(partitioner.getControlStructures().get(0).isClosed());
        assertEquals(BlockType.START, blocks.get(0).getType());
    }
}
