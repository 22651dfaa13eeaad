package org.dxworks.vbframe.serialization;

import org.dxworks.vbframe.SourceFile;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.ir.ModuleNode;

import java.util.List;
import java.util.Objects;

/**
 * One file as listed in the project manifest.
 */
public final class ManifestEntry {

    public static final String SKIPPED = "skipped";

    private final SourceFile source;
    private final String status;
    private final String output;
    private final ModuleNode module;
    private final List<Diagnostic> diagnostics;

    /**
     * @param status     result status name ({@code ok}, {@code fatal}, {@code skipped})
     * @param output     name of the per-file output, null when none was written
     * @param module     IR root, null for fatal and skipped files
     */
    public ManifestEntry(SourceFile source, String status, String output, ModuleNode module,
                         List<Diagnostic> diagnostics) {
        this.source = Objects.requireNonNull(source, "source");
        this.status = Objects.requireNonNull(status, "status");
        this.output = output;
        this.module = module;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public SourceFile getSource() {
        return source;
    }

    public String getStatus() {
        return status;
    }

    public boolean isSkipped() {
        return SKIPPED.equals(status);
    }

    public String getOutput() {
        return output;
    }

    public ModuleNode getModule() {
        return module;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
