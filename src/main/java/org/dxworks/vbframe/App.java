package org.dxworks.vbframe;

import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.pipeline.BatchAbortedException;
import org.dxworks.vbframe.pipeline.ConversionResult;
import org.dxworks.vbframe.pipeline.Converter;
import org.dxworks.vbframe.pipeline.DiagnosticsSummary;
import org.dxworks.vbframe.pipeline.FileResult;
import org.dxworks.vbframe.pipeline.FileSinkFactory;
import org.dxworks.vbframe.pipeline.SourceDescriptor;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL_FILES = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_BATCH_ABORTED = 3;

    public static void main(String[] args) throws Exception {
        int exitCode = run(args, VbframeConfig.load());
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, VbframeConfig config) throws IOException {
        if (args.length < 2) {
            System.err.println("Usage: java -jar vbframe.jar <input-path> <output-dir>");
            System.err.println("  <input-path>: VB6 project directory or a single .bas/.cls/.frm file");
            System.err.println("  <output-dir>: Directory receiving the JSON output");
            return EXIT_USAGE;
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            return EXIT_USAGE;
        }
        Path outputDir = Paths.get(args[1]);

        System.out.println("Starting VB6 conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<SourceDescriptor> sources = collectSourceFiles(input, config.getMaxFileLines());
        System.out.println("Found " + sources.size() + " source files");

        Instant startTime = Instant.now();
        Converter converter = new Converter((completed, total, result) -> {
            synchronized (System.out) {
                System.out.println("[" + completed + "/" + total + "] Converted "
                        + result.getSource().getModuleKind().getName() + ": " + result.getSource().getPath());
            }
            if (result.getStatus() == FileResult.Status.FATAL) {
                synchronized (System.err) {
                    for (Diagnostic d : result.getDiagnostics()) {
                        System.err.println("  " + result.getSource().getPath() + ": " + d.getMessage());
                    }
                }
            }
        });

        ConversionResult result;
        try {
            result = converter.convert(sources, config.toConversionOptions(), new FileSinkFactory(outputDir));
        } catch (BatchAbortedException e) {
            System.err.println("Error: " + e.getMessage()
                    + (e.getCause() != null ? ": " + e.getCause().getMessage() : ""));
            return EXIT_BATCH_ABORTED;
        }

        DiagnosticsSummary summary = result.getSummary();
        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Converted: " + (result.getFiles().size() - summary.getFatalFiles()
                - summary.getSkippedFiles()) + " files");
        if (summary.getFatalFiles() > 0) {
            System.out.println("Failed: " + summary.getFatalFiles() + " files");
        }
        System.out.println("Diagnostics: " + summary.getErrors() + " errors, " + summary.getWarnings()
                + " warnings, " + summary.getInfos() + " infos");
        for (Diagnostic d : summary.getProjectDiagnostics()) {
            System.out.println("  " + d.getSeverity().getName() + " " + d.getCode() + ": " + d.getMessage());
        }
        System.out.println("Duration: " + Duration.between(startTime, Instant.now()).toMillis() + " ms");
        System.out.println("Output written to: " + outputDir.toAbsolutePath());
        System.out.println("=".repeat(60));

        return config.isStrict() && summary.getFatalFiles() > 0 ? EXIT_FATAL_FILES : EXIT_OK;
    }

    static List<SourceDescriptor> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<SourceDescriptor> sources = new ArrayList<>();
        if (Files.isDirectory(input)) {
            List<Path> files;
            try (Stream<Path> stream = Files.walk(input)) {
                files = stream.filter(Files::isRegularFile)
                        .filter(p -> ModuleKind.detect(p).isPresent())
                        .filter(p -> withinMaxLines(p, maxFileLines))
                        .sorted()
                        .collect(Collectors.toList());
            }
            for (Path file : files) {
                sources.add(SourceDescriptor.forFile(input, file));
            }
        } else if (Files.isRegularFile(input)
                && ModuleKind.detect(input).isPresent()
                && withinMaxLines(input, maxFileLines)) {
            Path root = input.toAbsolutePath().getParent();
            sources.add(SourceDescriptor.forFile(root, input.toAbsolutePath()));
        }
        return sources;
    }

    // ISO-8859-1 maps every byte, so counting never fails on legacy encodings
    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
            long count = reader.lines().limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException e) {
            // unreadable files are kept so the converter reports them
            return true;
        }
    }
}
