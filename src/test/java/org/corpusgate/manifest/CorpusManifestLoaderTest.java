package org.corpusgate.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusManifestLoaderTest {
    private static final String MANIFEST_JSON = """
        {
          "version": "1",
          "generated_from": "corpus/local",
          "items": [
            {"id": "forms__b.hwp", "relpath": "forms/b.hwp", "sha256": "ab12", "size_bytes": 2048,
             "category": "a", "flags": {"scanned": true}, "source": {"url": null, "license_note": "internal"},
             "notes": "tax form"},
            {"id": "a.hwp", "relpath": "a.hwp", "category": " C "},
            {"id": "z.hwp", "relpath": "z.hwp", "category": "D"},
            {"id": "y.hwp", "relpath": "y.hwp", "category": null, "unknown_field": [1, 2, 3]},
            {"id": "no-path", "category": "A"},
            "not-an-object"
          ]
        }
        """;

    @Test
    void keepsManifestOrderAndNormalizesCategories(@TempDir Path tempDir) throws Exception {
        Path manifest = tempDir.resolve("manifest.json");
        Files.writeString(manifest, MANIFEST_JSON, StandardCharsets.UTF_8);

        Map<String, Category> categories = CorpusManifestLoader.loadCategoryMap(manifest);

        assertEquals(List.of("forms/b.hwp", "a.hwp", "z.hwp", "y.hwp"), List.copyOf(categories.keySet()));
        assertEquals(Category.A, categories.get("forms/b.hwp"));
        assertEquals(Category.C, categories.get("a.hwp"));
        assertEquals(Category.UNLABELED, categories.get("z.hwp"));
        assertEquals(Category.UNLABELED, categories.get("y.hwp"));
    }

    @Test
    void decodesItemMetadata(@TempDir Path tempDir) throws Exception {
        Path manifest = tempDir.resolve("manifest.json");
        Files.writeString(manifest, MANIFEST_JSON, StandardCharsets.UTF_8);

        CorpusManifest loaded = CorpusManifestLoader.loadLenient(manifest);

        assertEquals("1", loaded.version());
        assertEquals("corpus/local", loaded.generatedFrom());
        CorpusManifest.ManifestItem first = loaded.items().get(0);
        assertEquals("forms__b.hwp", first.id());
        assertEquals("ab12", first.sha256());
        assertEquals(2048L, first.sizeBytes());
        assertEquals(Boolean.TRUE, first.flags().get("scanned"));
        assertNull(first.source().url());
        assertEquals("internal", first.source().licenseNote());
        assertEquals("tax form", first.notes());
    }

    @Test
    void missingManifestYieldsEmptyMapping(@TempDir Path tempDir) {
        assertTrue(CorpusManifestLoader.loadCategoryMap(tempDir.resolve("absent.json")).isEmpty());
    }

    @Test
    void malformedManifestYieldsEmptyMapping(@TempDir Path tempDir) throws Exception {
        Path broken = tempDir.resolve("manifest.json");
        Files.writeString(broken, "{\"items\": [ {\"relpath\": ", StandardCharsets.UTF_8);
        Path wrongShape = tempDir.resolve("shape.json");
        Files.writeString(wrongShape, "{\"items\": \"everything\"}", StandardCharsets.UTF_8);

        assertTrue(CorpusManifestLoader.loadCategoryMap(broken).isEmpty());
        assertTrue(CorpusManifestLoader.loadCategoryMap(wrongShape).isEmpty());
    }

    @Test
    void loadsYamlManifests(@TempDir Path tempDir) throws Exception {
        Path manifest = tempDir.resolve("manifest.yaml");
        Files.writeString(
            manifest,
            """
            version: "1"
            items:
              - relpath: b.hwp
                category: B
              - relpath: a.hwp
            """,
            StandardCharsets.UTF_8
        );

        Map<String, Category> categories = CorpusManifestLoader.loadCategoryMap(manifest);

        assertEquals(List.of("b.hwp", "a.hwp"), List.copyOf(categories.keySet()));
        assertEquals(Category.B, categories.get("b.hwp"));
        assertEquals(Category.UNLABELED, categories.get("a.hwp"));
    }
}
