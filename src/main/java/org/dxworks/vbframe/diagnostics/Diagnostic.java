package org.dxworks.vbframe.diagnostics;

import org.dxworks.vbframe.ir.SourceSpan;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable issue report produced by ingestion, IR construction or enrichment.
 * Natural order is (span start, severity, code), with message and span end as tie-breakers
 * so that sorting is total and reproducible.
 */
public final class Diagnostic implements Comparable<Diagnostic> {

    private static final Comparator<Diagnostic> ORDER = Comparator
            .comparingInt((Diagnostic d) -> d.span.getStartOffset())
            .thenComparing(d -> d.severity)
            .thenComparing(d -> d.code)
            .thenComparing(d -> d.message)
            .thenComparingInt(d -> d.span.getEndOffset())
            .thenComparing(d -> d.stage);

    private final Severity severity;
    private final String code;
    private final String message;
    private final SourceSpan span;
    private final Stage stage;
    private final String hint;
    private final List<SourceSpan> relatedSpans;

    public Diagnostic(Severity severity, String code, String message, SourceSpan span, Stage stage,
                      String hint, List<SourceSpan> relatedSpans) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.code = Objects.requireNonNull(code, "code");
        this.message = Objects.requireNonNull(message, "message");
        this.span = span != null ? span : SourceSpan.EMPTY;
        this.stage = Objects.requireNonNull(stage, "stage");
        this.hint = hint;
        this.relatedSpans = relatedSpans == null ? List.of() : List.copyOf(relatedSpans);
    }

    public static Diagnostic syntax(Severity severity, String code, String message, SourceSpan span) {
        return new Diagnostic(severity, code, message, span, Stage.SYNTAX, null, null);
    }

    public static Diagnostic semantic(Severity severity, String code, String message, SourceSpan span) {
        return new Diagnostic(severity, code, message, span, Stage.SEMANTIC, null, null);
    }

    public Diagnostic withHint(String remediation) {
        return new Diagnostic(severity, code, message, span, stage, remediation, relatedSpans);
    }

    public Diagnostic withRelatedSpans(List<SourceSpan> spans) {
        return new Diagnostic(severity, code, message, span, stage, hint, spans);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * Optional remediation hint, may be null.
     */
    public String getHint() {
        return hint;
    }

    public List<SourceSpan> getRelatedSpans() {
        return relatedSpans;
    }

    /**
     * Identity used for de-duplication: two diagnostics with the same span, code and message are one issue.
     */
    public boolean sameIssue(Diagnostic other) {
        return span.equals(other.span) && code.equals(other.code) && message.equals(other.message);
    }

    @Override
    public int compareTo(Diagnostic o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return severity == that.severity
                && code.equals(that.code)
                && message.equals(that.message)
                && span.equals(that.span)
                && stage == that.stage
                && Objects.equals(hint, that.hint)
                && relatedSpans.equals(that.relatedSpans);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, code, message, span, stage, hint, relatedSpans);
    }

    @Override
    public String toString() {
        return severity.getName() + " " + code + " at " + span + ": " + message;
    }
}
