package org.dxworks.vbframe;

import org.dxworks.vbframe.pipeline.ConversionOptions;
import org.dxworks.vbframe.pipeline.EmissionMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VbframeConfigTest {

    @Test
    void load_missingFileGivesDefaults(@TempDir Path dir) {
        VbframeConfig config = VbframeConfig.load(dir.resolve("vbframe-config.yml"));

        assertEquals(EmissionMode.SINGLE, config.getEmissionMode());
        assertEquals("1.0.0", config.getSchemaVersion().getValue());
        assertTrue(config.isPrettyPrint());
        assertTrue(config.isIncludeSourceText());
        assertFalse(config.isStrict());
        assertEquals(20000, config.getMaxFileLines());
        assertEquals(Charset.forName("windows-1252"), config.getDeclaredEncoding());
        assertTrue(config.getWorkers() >= 1);
    }

    @Test
    void load_readsYamlValues(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("vbframe-config.yml");
        Files.writeString(file, String.join("\n",
                "schemaVersion: 1.2.0",
                "workers: 3",
                "emissionMode: manifestInline",
                "prettyPrint: false",
                "includeSourceText: false",
                "declaredEncoding: UTF-8",
                "strict: true",
                "maxFileLines: 500",
                "futureOption: ignored",
                ""));

        VbframeConfig config = VbframeConfig.load(file);

        assertEquals("1.2.0", config.getSchemaVersion().getValue());
        assertEquals(3, config.getWorkers());
        assertEquals(EmissionMode.MANIFEST_INLINE, config.getEmissionMode());
        assertFalse(config.isPrettyPrint());
        assertFalse(config.isIncludeSourceText());
        assertEquals(Charset.forName("UTF-8"), config.getDeclaredEncoding());
        assertTrue(config.isStrict());
        assertEquals(500, config.getMaxFileLines());

        ConversionOptions options = config.toConversionOptions();
        assertEquals(3, options.getWorkers());
        assertFalse(options.toSerializerOptions().isPrettyPrint());
    }

    @Test
    void load_invalidValuesFallBackOneByOne(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("vbframe-config.yml");
        Files.writeString(file, String.join("\n",
                "schemaVersion: latest",
                "workers: 0",
                "emissionMode: zip",
                "declaredEncoding: no-such-charset",
                "maxFileLines: -5",
                "strict: true",
                ""));

        VbframeConfig config = VbframeConfig.load(file);

        assertEquals("1.0.0", config.getSchemaVersion().getValue());
        assertTrue(config.getWorkers() >= 1);
        assertEquals(EmissionMode.SINGLE, config.getEmissionMode());
        assertEquals(Charset.forName("windows-1252"), config.getDeclaredEncoding());
        assertEquals(20000, config.getMaxFileLines());
        assertTrue(config.isStrict());
    }

    @Test
    void load_malformedYamlGivesDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("vbframe-config.yml");
        Files.writeString(file, "workers: [unclosed\n");

        VbframeConfig config = VbframeConfig.load(file);

        assertEquals(EmissionMode.SINGLE, config.getEmissionMode());
        assertFalse(config.isStrict());
    }

    @Test
    void with_overridesSelectedValues() {
        VbframeConfig config = VbframeConfig.with(2, EmissionMode.MANIFEST, false, true, true, 0);

        assertEquals(2, config.getWorkers());
        assertEquals(EmissionMode.MANIFEST, config.getEmissionMode());
        assertFalse(config.isPrettyPrint());
        assertTrue(config.isStrict());
        assertEquals(20000, config.getMaxFileLines());
    }
}
