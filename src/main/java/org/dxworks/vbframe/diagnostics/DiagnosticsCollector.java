package org.dxworks.vbframe.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Append-only accumulator for the diagnostics of one file's pipeline.
 * <p>
 * Each pipeline owns its own collector and threads it through ingestion, IR construction and enrichment.
 * {@link #finalizeDiagnostics()} sorts and de-duplicates (same span, code and message) and freezes the
 * collector; later appends fail. Instances are not thread-safe and are never shared between files.
 */
public class DiagnosticsCollector {

    private final List<Diagnostic> pending = new ArrayList<>();
    private List<Diagnostic> finalized;

    public void add(Diagnostic diagnostic) {
        if (finalized != null) {
            throw new IllegalStateException("Diagnostics already finalized");
        }
        pending.add(diagnostic);
    }

    public void addAll(Collection<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            add(d);
        }
    }

    /**
     * Diagnostics appended so far, in arrival order.
     */
    public List<Diagnostic> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(finalized != null ? finalized : pending));
    }

    public boolean isFinalized() {
        return finalized != null;
    }

    /**
     * Sorts, removes duplicates and freezes the collector. Calling it again returns the same list.
     */
    public List<Diagnostic> finalizeDiagnostics() {
        if (finalized == null) {
            finalized = Collections.unmodifiableList(sortAndDeduplicate(pending));
        }
        return finalized;
    }

    /**
     * True when any collected diagnostic is at least as severe as {@code minimum}.
     */
    public boolean hasAtLeast(Severity minimum) {
        List<Diagnostic> source = finalized != null ? finalized : pending;
        for (Diagnostic d : source) {
            if (d.getSeverity().isAtLeast(minimum)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasErrors() {
        return hasAtLeast(Severity.ERROR);
    }

    /**
     * Diagnostics at or above {@code minimum}, in finalized order when finalized.
     */
    public List<Diagnostic> atLeast(Severity minimum) {
        List<Diagnostic> out = new ArrayList<>();
        for (Diagnostic d : finalized != null ? finalized : sortAndDeduplicate(pending)) {
            if (d.getSeverity().isAtLeast(minimum)) {
                out.add(d);
            }
        }
        return out;
    }

    public static List<Diagnostic> sortAndDeduplicate(Collection<Diagnostic> diagnostics) {
        List<Diagnostic> sorted = new ArrayList<>(diagnostics);
        Collections.sort(sorted);
        List<Diagnostic> out = new ArrayList<>(sorted.size());
        for (Diagnostic d : sorted) {
            if (!containsSameIssue(out, d)) {
                out.add(d);
            }
        }
        return out;
    }

    // Duplicates share a span start, so they sit in the same run of the sorted list.
    private static boolean containsSameIssue(List<Diagnostic> accepted, Diagnostic candidate) {
        for (int i = accepted.size() - 1; i >= 0; i--) {
            Diagnostic d = accepted.get(i);
            if (d.getSpan().getStartOffset() != candidate.getSpan().getStartOffset()) {
                return false;
            }
            if (d.sameIssue(candidate)) {
                return true;
            }
        }
        return false;
    }
}
