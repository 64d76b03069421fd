package com.raditha.twx.manifest;

import com.raditha.twx.extraction.ClassRegistry;
import com.raditha.twx.model.ExtractedToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ManifestWriterTest {

    @TempDir
    Path tempDir;

    private final ManifestWriter writer = new ManifestWriter();

    private Manifest sample(Map<String, String> mappings) {
        ClassRegistry registry = new ClassRegistry();
        registry.add(new ExtractedToken("flex", "src/App.jsx", 4, 18));
        registry.add(new ExtractedToken("p-4", "src/App.jsx", 4, 23));
        ManifestBuilder builder = new ManifestBuilder(
                Clock.fixed(Instant.parse("2024-05-06T07:08:09Z"), ZoneOffset.UTC), 10);
        return builder.build(registry, mappings, null, null);
    }

    @Test
    void testToJson_IsoTimestampAndNoNulls() throws Exception {
        String json = writer.toJson(sample(null));

        assertTrue(json.contains("\"generatedAt\" : \"2024-05-06T07:08:09Z\""), json);
        assertFalse(json.contains("null"), json);
        assertFalse(json.contains("\"mappings\""));
        assertFalse(json.contains("\"statistics\""));
        assertFalse(json.contains("\"buildMode\""));
        assertTrue(json.endsWith("}\n"));
    }

    @Test
    void testToJson_Mappings() throws Exception {
        String json = writer.toJson(sample(Map.of("flex", "tw-abc123")));

        assertTrue(json.contains("\"mappings\""));
        assertTrue(json.contains("\"flex\" : \"tw-abc123\""));
        assertTrue(json.contains("\"obfuscationEnabled\" : true"));
    }

    @Test
    void testWriteAndRead() throws Exception {
        Path target = tempDir.resolve("out/manifest.json");
        Manifest manifest = sample(Map.of("flex", "tw-1", "p-4", "tw-2"));

        writer.write(manifest, target);

        assertTrue(Files.exists(target));
        assertTrue(Files.readString(target, StandardCharsets.UTF_8).startsWith("{"));
        Manifest read = writer.read(target);
        assertEquals(manifest, read);
    }
}
