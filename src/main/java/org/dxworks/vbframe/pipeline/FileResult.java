package org.dxworks.vbframe.pipeline;

import org.dxworks.vbframe.SourceFile;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.ir.ModuleNode;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one file's pipeline.
 */
public final class FileResult {

    public enum Status {
        OK("ok"),
        // unreadable, undecodable or failed internally: diagnostics only, no body
        FATAL("fatal"),
        // never started because the conversion was cancelled
        SKIPPED("skipped");

        private final String name;

        Status(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    private final SourceDescriptor descriptor;
    private final SourceFile source;
    private final ModuleNode module;
    private final List<Diagnostic> diagnostics;
    private final Status status;

    private FileResult(SourceDescriptor descriptor, SourceFile source, ModuleNode module,
                       List<Diagnostic> diagnostics, Status status) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.source = Objects.requireNonNull(source, "source");
        this.module = module;
        this.diagnostics = List.copyOf(diagnostics);
        this.status = status;
    }

    static FileResult ok(SourceDescriptor descriptor, SourceFile source, ModuleNode module,
                         List<Diagnostic> diagnostics) {
        return new FileResult(descriptor, source, Objects.requireNonNull(module, "module"), diagnostics, Status.OK);
    }

    static FileResult fatal(SourceDescriptor descriptor, SourceFile source, List<Diagnostic> diagnostics) {
        return new FileResult(descriptor, source, null, diagnostics, Status.FATAL);
    }

    static FileResult skipped(SourceDescriptor descriptor) {
        SourceFile source = new SourceFile(descriptor.getPath(), null, null, descriptor.getModuleKind());
        return new FileResult(descriptor, source, null, List.of(), Status.SKIPPED);
    }

    public SourceDescriptor getDescriptor() {
        return descriptor;
    }

    public SourceFile getSource() {
        return source;
    }

    /**
     * IR root, null unless the status is {@link Status#OK}.
     */
    public ModuleNode getModule() {
        return module;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public Status getStatus() {
        return status;
    }

    public boolean hasBody() {
        return module != null;
    }
}
