package ca.uwaterloo.swag.flowlens.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FunctionCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledCatalogsListStandardAllocators() {
        assertEquals(List.of("malloc", "calloc", "realloc"),
            FunctionCatalog.loadResource(FunctionCatalog.DEFAULT_ALLOCATION_FUNCTIONS_FILE));
        assertEquals(List.of("free"),
            FunctionCatalog.loadResource(FunctionCatalog.DEFAULT_DEALLOCATION_FUNCTIONS_FILE));
    }

    @Test
    void loadsCatalogFromFile() throws IOException {
        File catalog = tempDir.resolve("pool.xml").toFile();
        FileUtils.writeStringToFile(catalog, "<functions>\n" +
            "  <function><name> pool_alloc </name></function>\n" +
            "  <function><name>pool_calloc</name></function>\n" +
            "  <function></function>\n" +
            "</functions>\n", StandardCharsets.UTF_8);

        assertEquals(List.of("pool_alloc", "pool_calloc"), FunctionCatalog.loadFile(catalog.getPath()));
    }

    @Test
    void missingFileIsAnArgumentError() {
        String missing = tempDir.resolve("absent.xml").toString();
        assertThrows(IllegalArgumentException.class, () -> FunctionCatalog.loadFile(missing));
    }

    @Test
    void missingResourceIsAnArgumentError() {
        assertThrows(IllegalArgumentException.class, () -> FunctionCatalog.loadResource("common/absent.xml"));
    }

    @Test
    void malformedXmlIsRethrown() throws IOException {
        File catalog = tempDir.resolve("broken.xml").toFile();
        FileUtils.writeStringToFile(catalog, "<functions><function>", StandardCharsets.UTF_8);

        assertThrows(RuntimeException.class, () -> FunctionCatalog.loadFile(catalog.getPath()));
    }
}
