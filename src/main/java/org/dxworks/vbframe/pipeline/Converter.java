package org.dxworks.vbframe.pipeline;

import org.dxworks.vbframe.SourceFile;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.diagnostics.DiagnosticCodes;
import org.dxworks.vbframe.diagnostics.DiagnosticsCollector;
import org.dxworks.vbframe.diagnostics.Severity;
import org.dxworks.vbframe.ir.SourceSpan;
import org.dxworks.vbframe.serialization.JsonSerializer;
import org.dxworks.vbframe.serialization.ManifestEntry;
import org.dxworks.vbframe.serialization.ManifestWriter;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Converts a batch of source files on a fixed-size worker pool.
 * <p>
 * Each worker runs one file through the whole pipeline, serialization included, and shares nothing with the
 * others. Finished files are written to the sink by the calling thread in input order, whatever order the
 * workers complete in, so manifests and outputs are reproducible. {@link #cancel()} stops files that have not
 * started yet; files already running finish and are written normally. A cancelled converter stays cancelled.
 * <p>
 * Sink failures abort the whole batch with {@link BatchAbortedException}. Everything else, unreadable,
 * undecodable and unconvertible files included, is reported through diagnostics of that file alone.
 */
public class Converter {

    public static final String MANIFEST_NAME = "vbframe-manifest.json";

    // parse trees and the IR are walked recursively; deeply nested sources need more than the default stack
    static final long WORKER_STACK_SIZE = 64L * 1024 * 1024;

    private static final AtomicInteger WORKER_COUNTER = new AtomicInteger();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final ProgressListener listener;

    public Converter() {
        this(ProgressListener.NONE);
    }

    public Converter(ProgressListener listener) {
        this.listener = listener;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public ConversionResult convert(List<SourceDescriptor> sources, ConversionOptions options, SinkFactory sinks) {
        JsonSerializer serializer = new JsonSerializer(options.toSerializerOptions());
        FilePipeline pipeline = createPipeline(options);
        EmissionMode mode = options.getEmissionMode();
        boolean perFileOutput = mode != EmissionMode.MANIFEST_INLINE;

        int total = sources.size();
        AtomicInteger completed = new AtomicInteger(0);
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(options.getWorkers(), total)),
                Converter::newWorker);
        try {
            List<Future<Converted>> pending = new ArrayList<>(total);
            for (SourceDescriptor source : sources) {
                pending.add(pool.submit(() -> {
                    Converted converted = convertOne(source, pipeline, serializer, perFileOutput);
                    listener.fileConverted(completed.incrementAndGet(), total, converted.result);
                    return converted;
                }));
            }

            List<FileResult> results = new ArrayList<>(total);
            for (Future<Converted> future : pending) {
                Converted converted = await(future);
                results.add(converted.result);
                if (converted.json != null) {
                    emit(sinks, converted.result.getDescriptor().getOutputName(), converted.json);
                }
            }

            List<Diagnostic> projectDiagnostics = projectDiagnostics(results);
            if (mode != EmissionMode.SINGLE) {
                writeManifest(sinks, serializer, results, projectDiagnostics, !perFileOutput);
            }
            return new ConversionResult(results, new DiagnosticsSummary(results, projectDiagnostics));
        } catch (BatchAbortedException e) {
            cancel();
            throw e;
        } finally {
            pool.shutdown();
        }
    }

    FilePipeline createPipeline(ConversionOptions options) {
        return new FilePipeline(options.getDeclaredEncoding());
    }

    private Converted convertOne(SourceDescriptor source, FilePipeline pipeline, JsonSerializer serializer,
                                 boolean perFileOutput) {
        if (cancelled.get()) {
            return new Converted(FileResult.skipped(source), null);
        }
        FileResult result;
        try {
            result = pipeline.process(source);
        } catch (RuntimeException | StackOverflowError e) {
            SourceFile unread = new SourceFile(source.getPath(), null, null, source.getModuleKind());
            result = FilePipeline.internalFailure(source, unread, List.of(), e);
        }
        if (!perFileOutput) {
            return new Converted(result, null);
        }
        try {
            return new Converted(result, serializer.serialize(result.getSource(), result.getModule(),
                    result.getDiagnostics()));
        } catch (RuntimeException | StackOverflowError e) {
            FileResult failed = FilePipeline.internalFailure(source, result.getSource(), result.getDiagnostics(), e);
            return new Converted(failed, serializer.serialize(failed.getSource(), null, failed.getDiagnostics()));
        }
    }

    private static Thread newWorker(Runnable task) {
        Thread thread = new Thread(null, task, "vbframe-worker-" + WORKER_COUNTER.incrementAndGet(),
                WORKER_STACK_SIZE);
        thread.setDaemon(true);
        return thread;
    }

    private Converted await(Future<Converted> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchAbortedException("Interrupted while waiting for conversion results", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("File conversion failed unexpectedly", e.getCause());
        }
    }

    private static void emit(SinkFactory sinks, String name, byte[] json) {
        try (OutputStream out = sinks.open(name)) {
            out.write(json);
        } catch (IOException e) {
            throw new BatchAbortedException("Could not write output '" + name + "'", e);
        }
    }

    private static void writeManifest(SinkFactory sinks, JsonSerializer serializer, List<FileResult> results,
                                      List<Diagnostic> projectDiagnostics, boolean inline) {
        List<ManifestEntry> entries = new ArrayList<>(results.size());
        for (FileResult result : results) {
            String output = inline || result.getStatus() == FileResult.Status.SKIPPED
                    ? null
                    : result.getDescriptor().getOutputName();
            entries.add(new ManifestEntry(result.getSource(), result.getStatus().getName(), output,
                    result.getModule(), result.getDiagnostics()));
        }
        try (OutputStream out = sinks.open(MANIFEST_NAME)) {
            new ManifestWriter(serializer).write(entries, projectDiagnostics, inline, out);
        } catch (IOException e) {
            throw new BatchAbortedException("Could not write manifest '" + MANIFEST_NAME + "'", e);
        }
    }

    static List<Diagnostic> projectDiagnostics(List<FileResult> results) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        Map<String, List<FileResult>> byModuleName = new LinkedHashMap<>();
        for (FileResult result : results) {
            if (result.hasBody() && result.getModule().getName() != null) {
                String key = result.getModule().getName().toLowerCase(Locale.ROOT);
                byModuleName.computeIfAbsent(key, k -> new ArrayList<>()).add(result);
            }
        }
        for (List<FileResult> group : byModuleName.values()) {
            if (group.size() > 1) {
                String paths = group.stream().map(r -> r.getSource().getPath()).collect(Collectors.joining(", "));
                diagnostics.add(Diagnostic.semantic(Severity.WARNING, DiagnosticCodes.DUPLICATE_MODULE_NAME,
                        "Module name '" + group.get(0).getModule().getName() + "' is declared by " + paths,
                        SourceSpan.EMPTY).withHint("Give each module a unique VB_Name"));
            }
        }

        for (FileResult result : results) {
            if (result.getStatus() == FileResult.Status.SKIPPED) {
                diagnostics.add(Diagnostic.semantic(Severity.INFO, DiagnosticCodes.CANCELLED,
                        "Conversion of '" + result.getSource().getPath() + "' was cancelled before it started",
                        SourceSpan.EMPTY));
            }
        }
        return DiagnosticsCollector.sortAndDeduplicate(diagnostics);
    }

    private static final class Converted {
        private final FileResult result;
        private final byte[] json;

        Converted(FileResult result, byte[] json) {
            this.result = result;
            this.json = json;
        }
    }
}
