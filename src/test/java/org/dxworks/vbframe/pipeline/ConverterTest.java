package org.dxworks.vbframe.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.vbframe.SourceFile;
import org.dxworks.vbframe.TestUtils;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.diagnostics.DiagnosticCodes;
import org.dxworks.vbframe.diagnostics.Severity;
import org.dxworks.vbframe.ir.SourceSpan;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConverterTest {

    private static final String MODULE = "Attribute VB_Name = \"%s\"\nPublic Sub Run()\n    x = %d\nEnd Sub\n";

    /**
     * Keeps every closed output in memory, in the order it was opened.
     */
    private static final class MemorySink implements SinkFactory {
        private final Map<String, byte[]> outputs = new LinkedHashMap<>();

        @Override
        public OutputStream open(String name) {
            outputs.put(name, null);
            return new ByteArrayOutputStream() {
                @Override
                public void close() throws IOException {
                    super.close();
                    outputs.put(name, toByteArray());
                }
            };
        }

        JsonNode json(String name) throws IOException {
            return TestUtils.MAPPER.readTree(outputs.get(name));
        }
    }

    private static SourceDescriptor module(String path, String name, int value) {
        return SourceDescriptor.inMemory(path, String.format(MODULE, name, value).getBytes(StandardCharsets.US_ASCII));
    }

    private static List<SourceDescriptor> modules(int count) {
        List<SourceDescriptor> sources = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            sources.add(module("mod" + i + ".bas", "Mod" + i, i));
        }
        return sources;
    }

    private static ConversionOptions options(EmissionMode mode, int workers) {
        return ConversionOptions.defaults().withEmissionMode(mode).withWorkers(workers);
    }

    @Test
    void convert_undecodableFileDoesNotStopTheBatch() throws Exception {
        List<SourceDescriptor> sources = List.of(
                module("A.bas", "A", 1),
                SourceDescriptor.inMemory("Bad.bas", new byte[]{'A', (byte) 0x81, (byte) 0x8D, '\n'}),
                module("C.bas", "C", 3));
        MemorySink sink = new MemorySink();

        ConversionResult result = new Converter().convert(sources, options(EmissionMode.SINGLE, 2), sink);

        List<FileResult> files = result.getFiles();
        assertEquals(FileResult.Status.OK, files.get(0).getStatus());
        assertEquals(FileResult.Status.FATAL, files.get(1).getStatus());
        assertEquals(FileResult.Status.OK, files.get(2).getStatus());
        Diagnostic fatal = files.get(1).getDiagnostics().get(0);
        assertEquals(DiagnosticCodes.FATAL_DECODE, fatal.getCode());
        assertEquals(Severity.ERROR, fatal.getSeverity());
        assertTrue(sink.json("Bad.bas.json").get("body").isNull());
        assertEquals(1, result.getSummary().getFatalFiles());
        assertEquals(1, result.getSummary().getErrors());
        assertEquals(List.of("A.bas.json", "Bad.bas.json", "C.bas.json"), new ArrayList<>(sink.outputs.keySet()));
    }

    @Test
    void convert_longExpressionChainConvertsAlongsideOtherFiles() throws Exception {
        StringBuilder text = new StringBuilder("Attribute VB_Name = \"Long\"\nPublic Sub Run()\n    s = a0");
        for (int i = 1; i < 2000; i++) {
            text.append(" & a").append(i);
        }
        text.append("\nEnd Sub\n");
        List<SourceDescriptor> sources = List.of(
                module("A.bas", "A", 1),
                SourceDescriptor.inMemory("Long.bas", text.toString().getBytes(StandardCharsets.US_ASCII)),
                module("C.bas", "C", 3));
        MemorySink sink = new MemorySink();

        ConversionResult result = new Converter().convert(sources, options(EmissionMode.SINGLE, 2), sink);

        for (FileResult file : result.getFiles()) {
            assertEquals(FileResult.Status.OK, file.getStatus(), file.getSource().getPath());
        }
        assertTrue(result.getFiles().get(1).getDiagnostics().stream()
                .noneMatch(d -> d.getCode().equals(DiagnosticCodes.PARSER_FAILURE)
                        || d.getCode().equals(DiagnosticCodes.FATAL_INTERNAL)));
        assertTrue(sink.outputs.get("Long.bas.json").length > 0);
        assertEquals("C", sink.json("C.bas.json").get("body").get("name").asText());
    }

    @Test
    void convert_unexpectedFailureIsLocalToItsFile() throws Exception {
        Converter converter = new Converter() {
            @Override
            FilePipeline createPipeline(ConversionOptions options) {
                return new FilePipeline(options.getDeclaredEncoding()) {
                    @Override
                    public FileResult process(SourceDescriptor descriptor) {
                        if (descriptor.getPath().equals("Boom.bas")) {
                            throw new IllegalStateException("boom");
                        }
                        return super.process(descriptor);
                    }
                };
            }
        };
        List<SourceDescriptor> sources = List.of(module("A.bas", "A", 1), module("Boom.bas", "Boom", 2),
                module("C.bas", "C", 3));
        MemorySink sink = new MemorySink();

        ConversionResult result = converter.convert(sources, options(EmissionMode.MANIFEST, 3), sink);

        List<FileResult> files = result.getFiles();
        assertEquals(FileResult.Status.OK, files.get(0).getStatus());
        assertEquals(FileResult.Status.FATAL, files.get(1).getStatus());
        assertEquals(FileResult.Status.OK, files.get(2).getStatus());
        Diagnostic fatal = files.get(1).getDiagnostics().get(0);
        assertEquals(DiagnosticCodes.FATAL_INTERNAL, fatal.getCode());
        assertTrue(fatal.getMessage().contains("boom"));
        assertTrue(sink.json("Boom.bas.json").get("body").isNull());
        assertEquals(1, result.getSummary().getFatalFiles());
        assertTrue(sink.outputs.containsKey(Converter.MANIFEST_NAME));
    }

    @Test
    void internalFailure_keepsDiagnosticsGatheredBeforeTheFailure() {
        SourceDescriptor descriptor = module("A.bas", "A", 1);
        SourceFile source = new SourceFile("A.bas", "abc", "windows-1252", descriptor.getModuleKind());
        Diagnostic earlier = Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.SYNTAX_ERROR, "earlier",
                SourceSpan.EMPTY);

        FileResult result = FilePipeline.internalFailure(descriptor, source, List.of(earlier),
                new StackOverflowError());

        assertEquals(FileResult.Status.FATAL, result.getStatus());
        assertNull(result.getModule());
        assertEquals("abc", result.getSource().getChecksum());
        assertEquals(List.of(DiagnosticCodes.SYNTAX_ERROR, DiagnosticCodes.FATAL_INTERNAL),
                result.getDiagnostics().stream().map(Diagnostic::getCode).collect(Collectors.toList()));
        assertTrue(result.getDiagnostics().get(1).getMessage().endsWith("StackOverflowError"));
    }

    @Test
    void convert_emitsInInputOrderWithManyWorkers() {
        List<SourceDescriptor> sources = modules(24);
        MemorySink sink = new MemorySink();

        ConversionResult result = new Converter().convert(sources, options(EmissionMode.SINGLE, 4), sink);

        List<String> expected = sources.stream().map(SourceDescriptor::getOutputName).collect(Collectors.toList());
        assertEquals(expected, new ArrayList<>(sink.outputs.keySet()));
        assertEquals(sources.stream().map(SourceDescriptor::getPath).collect(Collectors.toList()),
                result.getFiles().stream().map(f -> f.getSource().getPath()).collect(Collectors.toList()));
    }

    @Test
    void convert_outputDoesNotDependOnWorkerCount() {
        MemorySink sequential = new MemorySink();
        MemorySink parallel = new MemorySink();

        new Converter().convert(modules(8), options(EmissionMode.MANIFEST, 1), sequential);
        new Converter().convert(modules(8), options(EmissionMode.MANIFEST, 4), parallel);

        assertEquals(sequential.outputs.keySet(), parallel.outputs.keySet());
        for (String name : sequential.outputs.keySet()) {
            assertEquals(new String(sequential.outputs.get(name), StandardCharsets.UTF_8),
                    new String(parallel.outputs.get(name), StandardCharsets.UTF_8), name);
        }
    }

    @Test
    void convert_manifestReferencesPerFileOutputs() throws Exception {
        MemorySink sink = new MemorySink();

        new Converter().convert(modules(2), options(EmissionMode.MANIFEST, 2), sink);

        assertEquals(List.of("mod0.bas.json", "mod1.bas.json", Converter.MANIFEST_NAME),
                new ArrayList<>(sink.outputs.keySet()));
        JsonNode manifest = sink.json(Converter.MANIFEST_NAME);
        assertEquals("1.0.0", manifest.get("schemaVersion").asText());
        JsonNode first = manifest.get("files").get(0);
        assertEquals("mod0.bas", first.get("path").asText());
        assertEquals("standard", first.get("moduleKind").asText());
        assertEquals("ok", first.get("status").asText());
        assertEquals("mod0.bas.json", first.get("output").asText());
        assertEquals(0, first.get("diagnosticCounts").get("error").asInt());
        assertEquals(0, manifest.get("projectDiagnostics").size());
    }

    @Test
    void convert_inlineManifestEmbedsEnvelopes() throws Exception {
        MemorySink sink = new MemorySink();

        new Converter().convert(modules(2), options(EmissionMode.MANIFEST_INLINE, 2), sink);

        assertEquals(List.of(Converter.MANIFEST_NAME), new ArrayList<>(sink.outputs.keySet()));
        JsonNode files = sink.json(Converter.MANIFEST_NAME).get("files");
        assertEquals(2, files.size());
        assertEquals("mod1.bas", files.get(1).get("source").get("path").asText());
        assertEquals("Mod1", files.get(1).get("body").get("name").asText());
    }

    @Test
    void convert_reportsDuplicateModuleNames() {
        List<SourceDescriptor> sources = List.of(
                module("a/Util.bas", "Util", 1),
                module("b/Util.bas", "UTIL", 2),
                module("Other.bas", "Other", 3));

        ConversionResult result = new Converter().convert(sources, options(EmissionMode.SINGLE, 2), new MemorySink());

        List<Diagnostic> project = result.getSummary().getProjectDiagnostics();
        assertEquals(1, project.size());
        assertEquals(DiagnosticCodes.DUPLICATE_MODULE_NAME, project.get(0).getCode());
        assertEquals(Severity.WARNING, project.get(0).getSeverity());
        assertTrue(project.get(0).getMessage().contains("a/Util.bas, b/Util.bas"));
        assertEquals(1, result.getSummary().getWarnings());
    }

    @Test
    void convert_cancelledBeforeStartSkipsEveryFile() throws Exception {
        Converter converter = new Converter();
        converter.cancel();
        MemorySink sink = new MemorySink();

        ConversionResult result = converter.convert(modules(3), options(EmissionMode.MANIFEST, 2), sink);

        assertTrue(result.getFiles().stream().allMatch(f -> f.getStatus() == FileResult.Status.SKIPPED));
        assertEquals(3, result.getSummary().getSkippedFiles());
        assertEquals(List.of(Converter.MANIFEST_NAME), new ArrayList<>(sink.outputs.keySet()));
        JsonNode manifest = sink.json(Converter.MANIFEST_NAME);
        assertEquals("skipped", manifest.get("files").get(0).get("status").asText());
        assertTrue(manifest.get("files").get(0).get("output").isNull());
        assertEquals(3, manifest.get("projectDiagnostics").size());
        assertEquals(DiagnosticCodes.CANCELLED, manifest.get("projectDiagnostics").get(0).get("code").asText());
    }

    @Test
    void convert_cancelDuringBatchKeepsFinishedFiles() {
        Converter[] holder = new Converter[1];
        holder[0] = new Converter((completed, total, file) -> holder[0].cancel());
        MemorySink sink = new MemorySink();

        ConversionResult result = holder[0].convert(modules(3), options(EmissionMode.SINGLE, 1), sink);

        List<FileResult.Status> statuses = result.getFiles().stream().map(FileResult::getStatus)
                .collect(Collectors.toList());
        assertEquals(List.of(FileResult.Status.OK, FileResult.Status.SKIPPED, FileResult.Status.SKIPPED), statuses);
        assertEquals(List.of("mod0.bas.json"), new ArrayList<>(sink.outputs.keySet()));
        assertTrue(holder[0].isCancelled());
    }

    @Test
    void convert_sinkFailureAbortsTheBatch() {
        Converter converter = new Converter();
        SinkFactory failing = name -> {
            throw new IOException("disk full");
        };

        BatchAbortedException e = assertThrows(BatchAbortedException.class,
                () -> converter.convert(modules(2), options(EmissionMode.SINGLE, 2), failing));

        assertTrue(e.getMessage().contains("mod0.bas.json"));
        assertEquals("disk full", e.getCause().getMessage());
        assertTrue(converter.isCancelled());
    }

    @Test
    void convert_missingFileIsFatal(@TempDir Path dir) {
        SourceDescriptor missing = SourceDescriptor.forFile(dir, dir.resolve("Gone.cls"));

        ConversionResult result = new Converter().convert(List.of(missing), options(EmissionMode.SINGLE, 1),
                new MemorySink());

        FileResult file = result.getFiles().get(0);
        assertEquals(FileResult.Status.FATAL, file.getStatus());
        assertEquals(DiagnosticCodes.FATAL_IO, file.getDiagnostics().get(0).getCode());
        assertNull(file.getSource().getChecksum());
        assertFalse(file.hasBody());
    }

    @Test
    void fileSink_writesBelowOutputDirectory(@TempDir Path dir) throws Exception {
        List<SourceDescriptor> sources = List.of(module("forms/Main.bas", "Main", 1));

        new Converter().convert(sources, options(EmissionMode.MANIFEST, 1), new FileSinkFactory(dir));

        assertTrue(Files.isRegularFile(dir.resolve("forms/Main.bas.json")));
        assertTrue(Files.isRegularFile(dir.resolve(Converter.MANIFEST_NAME)));
        assertThrows(IOException.class, () -> new FileSinkFactory(dir).open("../escape.json"));
    }

    @Test
    void emissionMode_parsesConfigNames() {
        assertEquals(EmissionMode.MANIFEST_INLINE, EmissionMode.fromName("manifestinline"));
        assertThrows(IllegalArgumentException.class, () -> EmissionMode.fromName("zip"));
    }
}
