package org.dxworks.vbframe.pipeline;

import java.util.List;

public final class ConversionResult {

    private final List<FileResult> files;
    private final DiagnosticsSummary summary;

    ConversionResult(List<FileResult> files, DiagnosticsSummary summary) {
        this.files = List.copyOf(files);
        this.summary = summary;
    }

    /**
     * Per-file results in input order.
     */
    public List<FileResult> getFiles() {
        return files;
    }

    public DiagnosticsSummary getSummary() {
        return summary;
    }
}
