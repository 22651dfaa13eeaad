package org.dxworks.vbframe;

import org.dxworks.vbframe.pipeline.Converter;
import org.dxworks.vbframe.pipeline.EmissionMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    private static final VbframeConfig LENIENT = VbframeConfig.with(2, EmissionMode.MANIFEST, true, true, false, 0);
    private static final VbframeConfig STRICT = VbframeConfig.with(2, EmissionMode.SINGLE, true, true, true, 0);

    @Test
    void run_withoutArgumentsPrintsUsage() throws Exception {
        assertEquals(App.EXIT_USAGE, App.run(new String[0], LENIENT));
    }

    @Test
    void run_missingInputIsAUsageError(@TempDir Path dir) throws Exception {
        String[] args = {dir.resolve("nothing-here").toString(), dir.resolve("out").toString()};

        assertEquals(App.EXIT_USAGE, App.run(args, LENIENT));
    }

    @Test
    void run_convertsSampleProject(@TempDir Path out) throws Exception {
        String[] args = {TestUtils.SAMPLES.toString(), out.toString()};

        assertEquals(App.EXIT_OK, App.run(args, LENIENT));

        for (String sample : TestUtils.ALL_SAMPLES) {
            assertTrue(Files.isRegularFile(out.resolve(sample + ".json")), sample);
        }
        assertTrue(Files.isRegularFile(out.resolve(Converter.MANIFEST_NAME)));
    }

    @Test
    void run_strictFailsOnUndecodableFile(@TempDir Path dir) throws Exception {
        Path input = Files.createDirectories(dir.resolve("project"));
        Files.writeString(input.resolve("Good.bas"), "Attribute VB_Name = \"Good\"\n", StandardCharsets.US_ASCII);
        Files.write(input.resolve("Bad.bas"), new byte[]{'A', (byte) 0x81, (byte) 0x8D, '\n'});
        String[] args = {input.toString(), dir.resolve("out").toString()};

        assertEquals(App.EXIT_FATAL_FILES, App.run(args, STRICT));
        assertEquals(App.EXIT_OK, App.run(args, LENIENT));
        assertTrue(Files.isRegularFile(dir.resolve("out/Good.bas.json")));
        assertTrue(Files.isRegularFile(dir.resolve("out/Bad.bas.json")));
    }

    @Test
    void collectSourceFiles_filtersBySuffixAndLineLimit(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("Short.bas"), "x = 1\n");
        Files.writeString(dir.resolve("Long.cls"), "x = 1\n".repeat(10));
        Files.writeString(dir.resolve("Form1.frx"), "binary");
        Files.writeString(dir.resolve("Project.vbp"), "Type=Exe\n");

        List<String> paths = App.collectSourceFiles(dir, 5).stream()
                .map(s -> s.getPath())
                .collect(Collectors.toList());

        assertEquals(List.of("Short.bas"), paths);
        assertFalse(App.collectSourceFiles(dir, 50).isEmpty());
        assertEquals(2, App.collectSourceFiles(dir, 50).size());
    }
}
