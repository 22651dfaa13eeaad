package org.dxworks.vbframe.pipeline;

import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.diagnostics.Severity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Batch-wide counts over per-file and project diagnostics.
 */
public final class DiagnosticsSummary {

    private final Map<Severity, Integer> counts;
    private final int fatalFiles;
    private final int skippedFiles;
    private final List<Diagnostic> projectDiagnostics;

    DiagnosticsSummary(List<FileResult> results, List<Diagnostic> projectDiagnostics) {
        Map<Severity, Integer> tally = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            tally.put(severity, 0);
        }
        int fatal = 0;
        int skipped = 0;
        for (FileResult result : results) {
            if (result.getStatus() == FileResult.Status.FATAL) {
                fatal++;
            } else if (result.getStatus() == FileResult.Status.SKIPPED) {
                skipped++;
            }
            result.getDiagnostics().forEach(d -> tally.merge(d.getSeverity(), 1, Integer::sum));
        }
        projectDiagnostics.forEach(d -> tally.merge(d.getSeverity(), 1, Integer::sum));
        this.counts = tally;
        this.fatalFiles = fatal;
        this.skippedFiles = skipped;
        this.projectDiagnostics = List.copyOf(projectDiagnostics);
    }

    public int count(Severity severity) {
        return counts.get(severity);
    }

    public int getErrors() {
        return count(Severity.ERROR);
    }

    public int getWarnings() {
        return count(Severity.WARNING);
    }

    public int getInfos() {
        return count(Severity.INFO);
    }

    public int getFatalFiles() {
        return fatalFiles;
    }

    public int getSkippedFiles() {
        return skippedFiles;
    }

    public List<Diagnostic> getProjectDiagnostics() {
        return projectDiagnostics;
    }
}
