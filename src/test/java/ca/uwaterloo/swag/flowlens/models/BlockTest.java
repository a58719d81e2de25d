package ca.uwaterloo.swag.flowlens.models;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BlockTest {

    @Test
    void linesAreCopiedOnConstruction() {
        List<String> lines = new ArrayList<>(List.of("x = 1;"));
        Block block = new Block(0, BlockType.ACTIVITY, 1, 1, lines);

        lines.add("y = 2;");
        assertEquals(List.of("x = 1;"), block.getLines());
    }

    @Test
    void previewSkipsCommentsAndBlankLines() {
        Block block = new Block(0, BlockType.ACTIVITY, 1, 3, List.of("", "// setup", "  y = 2;"));
        assertEquals("y = 2;", block.getCodePreview());
    }

    @Test
    void commentOnlyBlockHasEmptyPreview() {
        Block block = new Block(0, BlockType.ACTIVITY, 1, 1, List.of("// nothing"));
        assertEquals(Block.EMPTY_PREVIEW, block.getCodePreview());
    }
}
