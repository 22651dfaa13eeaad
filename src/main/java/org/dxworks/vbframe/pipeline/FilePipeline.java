package org.dxworks.vbframe.pipeline;

import org.dxworks.vbframe.SourceFile;
import org.dxworks.vbframe.builder.IrBuilder;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.diagnostics.DiagnosticCodes;
import org.dxworks.vbframe.diagnostics.DiagnosticsCollector;
import org.dxworks.vbframe.diagnostics.Severity;
import org.dxworks.vbframe.ingest.IngestionResult;
import org.dxworks.vbframe.ingest.SourceDecoder;
import org.dxworks.vbframe.ingest.SourceText;
import org.dxworks.vbframe.ingest.TreeIngestor;
import org.dxworks.vbframe.ingest.UndecodableSourceException;
import org.dxworks.vbframe.ir.ModuleNode;
import org.dxworks.vbframe.ir.SourceSpan;
import org.dxworks.vbframe.semantic.SemanticEnricher;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.List;

/**
 * Runs one file from raw bytes to an enriched IR with finalized diagnostics.
 * <p>
 * Every call creates its own ingestor, builder and enricher, so a pipeline instance may be shared by
 * concurrent workers. Read and decode failures end the file with a {@link FileResult.Status#FATAL} result, and
 * so does an unexpected failure of a later stage. Everything else is recoverable and only adds diagnostics.
 */
public class FilePipeline {

    private final Charset declaredEncoding;

    public FilePipeline(Charset declaredEncoding) {
        this.declaredEncoding = declaredEncoding;
    }

    public FileResult process(SourceDescriptor descriptor) {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();
        String path = descriptor.getPath();

        byte[] bytes;
        try {
            bytes = descriptor.readBytes();
        } catch (IOException e) {
            diagnostics.add(Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.FATAL_IO,
                    "Could not read '" + path + "': " + e.getMessage(), SourceSpan.EMPTY));
            SourceFile source = new SourceFile(path, null, null, descriptor.getModuleKind());
            return FileResult.fatal(descriptor, source, diagnostics.finalizeDiagnostics());
        }

        String checksum = SourceDecoder.checksum(bytes);
        SourceText text;
        try {
            text = new SourceDecoder(declaredEncoding).decode(bytes);
        } catch (UndecodableSourceException e) {
            diagnostics.add(Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.FATAL_DECODE, e.getMessage(),
                    SourceSpan.EMPTY).withHint("Re-save the file as Windows-1252 or UTF-8"));
            SourceFile source = new SourceFile(path, checksum, null, descriptor.getModuleKind());
            return FileResult.fatal(descriptor, source, diagnostics.finalizeDiagnostics());
        }

        SourceFile source = new SourceFile(path, checksum, text.getCharset().name(), descriptor.getModuleKind());
        ModuleNode module;
        try {
            IngestionResult ingestion = new TreeIngestor().ingest(text, path, diagnostics);
            module = new IrBuilder().build(ingestion, source, diagnostics);
            new SemanticEnricher().enrich(module, diagnostics);
        } catch (RuntimeException | StackOverflowError e) {
            return internalFailure(descriptor, source, diagnostics.snapshot(), e);
        }
        return FileResult.ok(descriptor, source, module, diagnostics.finalizeDiagnostics());
    }

    /**
     * Fatal result for a file whose conversion broke after decoding. Diagnostics gathered so far are kept.
     */
    static FileResult internalFailure(SourceDescriptor descriptor, SourceFile source, List<Diagnostic> gathered,
                                      Throwable failure) {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();
        diagnostics.addAll(gathered);
        String reason = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        diagnostics.add(Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.FATAL_INTERNAL,
                "Conversion of '" + descriptor.getPath() + "' failed: " + reason, SourceSpan.EMPTY)
                .withHint("The file may nest expressions or blocks too deeply"));
        return FileResult.fatal(descriptor, source, diagnostics.finalizeDiagnostics());
    }
}
