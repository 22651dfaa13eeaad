package org.dxworks.vbframe.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.diagnostics.Severity;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Writes the aggregated project manifest: {@code schemaVersion}, {@code files} and
 * {@code projectDiagnostics}, in that order.
 * <p>
 * Files appear in the order given, which callers keep equal to the input order. In reference mode each entry
 * points at its per-file output; in inline mode it embeds the full per-file envelope, encoded exactly as
 * {@link JsonSerializer} encodes it standalone. Skipped files are always listed by reference.
 */
public class ManifestWriter {

    private final JsonSerializer serializer;

    public ManifestWriter(JsonSerializer serializer) {
        this.serializer = serializer;
    }

    public void write(List<ManifestEntry> entries, List<Diagnostic> projectDiagnostics, boolean inline,
                      OutputStream out) throws IOException {
        try (JsonGenerator gen = serializer.createGenerator(out)) {
            gen.writeStartObject();
            gen.writeStringField("schemaVersion", serializer.getOptions().getSchemaVersion().getValue());
            gen.writeArrayFieldStart("files");
            for (ManifestEntry entry : entries) {
                if (inline && !entry.isSkipped()) {
                    serializer.writeEnvelope(gen, entry.getSource(), entry.getModule(), entry.getDiagnostics());
                } else {
                    writeReference(gen, entry);
                }
            }
            gen.writeEndArray();
            gen.writeFieldName("projectDiagnostics");
            serializer.writeDiagnostics(gen, projectDiagnostics);
            gen.writeEndObject();
        }
        out.write('\n');
        out.flush();
    }

    private void writeReference(JsonGenerator gen, ManifestEntry entry) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("path", entry.getSource().getPath());
        gen.writeStringField("moduleKind", entry.getSource().getModuleKind().getName());
        gen.writeStringField("status", entry.getStatus());
        if (entry.getOutput() == null) {
            gen.writeNullField("output");
        } else {
            gen.writeStringField("output", entry.getOutput());
        }
        gen.writeObjectFieldStart("diagnosticCounts");
        for (Severity severity : Severity.values()) {
            gen.writeNumberField(severity.getName(), count(entry.getDiagnostics(), severity));
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }

    private static int count(List<Diagnostic> diagnostics, Severity severity) {
        int n = 0;
        for (Diagnostic d : diagnostics) {
            if (d.getSeverity() == severity) {
                n++;
            }
        }
        return n;
    }
}
