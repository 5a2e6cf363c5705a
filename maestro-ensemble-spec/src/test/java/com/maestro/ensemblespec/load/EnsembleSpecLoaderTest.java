package com.maestro.ensemblespec.load;

import com.maestro.ensemblespec.model.EnsembleDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnsembleSpecLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_readsNamedFile() throws Exception {
        Files.writeString(tempDir.resolve("ens-1.json"), "{\"guid\":\"ens-1\",\"performers\":[]}");
        EnsembleSpecLoader loader = new EnsembleSpecLoader(tempDir);

        Optional<EnsembleDefinition> def = loader.load("ens-1");

        assertTrue(def.isPresent());
        assertEquals("ens-1", def.get().getGuid());
        assertFalse(loader.load("missing").isPresent());
    }

    @Test
    void loadAll_skipsInvalidFilesAndDefaultsGuidFromFileName() throws Exception {
        Files.writeString(tempDir.resolve("b.json"), "{\"performers\":[]}");
        Files.writeString(tempDir.resolve("a.json"), "{\"guid\":\"alpha\"}");
        Files.writeString(tempDir.resolve("broken.json"), "{ not json");
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        List<EnsembleDefinition> defs = new EnsembleSpecLoader(tempDir).loadAll();

        assertEquals(2, defs.size());
        assertEquals("alpha", defs.get(0).getGuid());
        assertEquals("b", defs.get(1).getGuid());
    }

    @Test
    void loadAll_missingDirectoryReturnsEmpty() {
        assertTrue(new EnsembleSpecLoader(tempDir.resolve("nope")).loadAll().isEmpty());
    }
}
