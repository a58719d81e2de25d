package ca.uwaterloo.swag.flowlens;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.uwaterloo.swag.flowlens.export.AnalysisExporter;
import ca.uwaterloo.swag.flowlens.export.GraphExporter;
import ca.uwaterloo.swag.flowlens.models.AnalysisResult;
import ca.uwaterloo.swag.flowlens.util.ArgumentOptions;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesOptionsAndFlags() {
        ArgumentOptions options = Main.processArguments(
            new String[]{"prog.c", "-out", "build", "--dot", "--debug"});

        assertEquals("prog.c", options.sourceFile);
        assertEquals("build", options.option("-out", "."));
        assertEquals(".", options.option("-allocators", "."));
        assertTrue(options.hasFlag("dot"));
        assertTrue(options.hasFlag("debug"));
    }

    @Test
    void optionWithoutValueIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Main.processArguments(new String[]{"prog.c", "-out"}));
    }

    @Test
    void bareDashesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Main.processArguments(new String[]{"-"}));
        assertThrows(IllegalArgumentException.class, () -> Main.processArguments(new String[]{"--"}));
    }

    @Test
    void sourceFileIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> Main.processArguments(new String[]{"--dot"}));
    }

    @Test
    void missingSourceFileIsRejected() {
        String missing = tempDir.resolve("absent.c").toString();
        assertThrows(IllegalArgumentException.class, () -> Main.run(new String[]{missing}));
    }

    @Test
    void runWritesJsonAndDotExports() throws IOException {
        File source = tempDir.resolve("loop.c").toFile();
        FileUtils.writeStringToFile(source, Samples.read("while_loop.c"), StandardCharsets.UTF_8);
        File outputDir = tempDir.resolve("out").toFile();

        AnalysisResult result = Main.run(new String[]{source.getPath(), "-out", outputDir.getPath(), "--dot"});

        assertEquals(6, result.getBlocks().size());
        for (String name : List.of(AnalysisExporter.DATAFLOW_FILE, AnalysisExporter.LINKED_LIST_FILE,
            AnalysisExporter.TTA_GRAPH_FILE, GraphExporter.DEPENDENCY_GRAPH_FILE, GraphExporter.TTA_GRAPH_FILE)) {
            assertTrue(new File(outputDir, name).isFile(), name);
        }
    }

    @Test
    void customDeallocatorCatalogIsUsed() throws IOException {
        File source = tempDir.resolve("pool.c").toFile();
        FileUtils.writeStringToFile(source, "pool_release(q);\n", StandardCharsets.UTF_8);
        File catalog = tempDir.resolve("dealloc.xml").toFile();
        FileUtils.writeStringToFile(catalog,
            "<functions><function><name>pool_release</name></function></functions>", StandardCharsets.UTF_8);

        AnalysisResult result = Main.run(new String[]{source.getPath(), "-out", tempDir.resolve("o").toString(),
            "-deallocators", catalog.getPath()});

        assertEquals(2, result.getOperations().size());
        assertEquals("Memory freed for variable 'q'", result.getOperations().get(1).getDetails());
    }
}
