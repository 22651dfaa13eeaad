package org.dxworks.vbframe.diagnostics;

import org.dxworks.vbframe.ir.SourceSpan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DiagnosticsCollectorTest {

    private static SourceSpan at(int start, int end) {
        return new SourceSpan(1, start + 1, 1, end + 1, start, end);
    }

    @Test
    void finalize_sortsBySpanStartThenSeverityThenCode() {
        DiagnosticsCollector collector = new DiagnosticsCollector();
        collector.add(Diagnostic.semantic(Severity.INFO, DiagnosticCodes.UNRESOLVED_TYPE, "late", at(20, 25)));
        collector.add(Diagnostic.semantic(Severity.WARNING, DiagnosticCodes.UNKNOWN_EVENT, "b", at(5, 6)));
        collector.add(Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.UNKNOWN_TOKEN, "a", at(5, 6)));
        collector.add(Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.SYNTAX_ERROR, "c", at(5, 9)));

        List<Diagnostic> sorted = collector.finalizeDiagnostics();

        assertEquals(List.of("c", "a", "b", "late"), sorted.stream().map(Diagnostic::getMessage).toList());
    }

    @Test
    void finalize_dropsSameSpanCodeAndMessage() {
        DiagnosticsCollector collector = new DiagnosticsCollector();
        Diagnostic first = Diagnostic.semantic(Severity.WARNING, DiagnosticCodes.UNKNOWN_EVENT, "same", at(1, 4));
        collector.add(first);
        collector.add(Diagnostic.semantic(Severity.WARNING, DiagnosticCodes.UNKNOWN_EVENT, "same", at(1, 4))
                .withHint("differs only by hint"));
        collector.add(Diagnostic.semantic(Severity.WARNING, DiagnosticCodes.UNKNOWN_EVENT, "other", at(1, 4)));

        List<Diagnostic> result = collector.finalizeDiagnostics();

        assertEquals(2, result.size());
        assertEquals("other", result.get(0).getMessage());
        assertEquals("same", result.get(1).getMessage());
    }

    @Test
    void finalize_freezesTheCollector() {
        DiagnosticsCollector collector = new DiagnosticsCollector();
        collector.add(Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.SYNTAX_ERROR, "x", at(0, 1)));

        List<Diagnostic> once = collector.finalizeDiagnostics();

        assertTrue(collector.isFinalized());
        assertSame(once, collector.finalizeDiagnostics());
        assertThrows(IllegalStateException.class, () -> collector.add(
                Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.SYNTAX_ERROR, "y", at(0, 1))));
    }

    @Test
    void severityQueries() {
        DiagnosticsCollector collector = new DiagnosticsCollector();
        collector.add(Diagnostic.semantic(Severity.INFO, DiagnosticCodes.RESOURCE_REFERENCE, "i", at(0, 1)));
        collector.add(Diagnostic.semantic(Severity.WARNING, DiagnosticCodes.UNMATCHED_EVENT_BINDING, "w", at(2, 3)));

        assertFalse(collector.hasErrors());
        assertTrue(collector.hasAtLeast(Severity.WARNING));
        assertEquals(1, collector.atLeast(Severity.WARNING).size());
        assertEquals(2, collector.atLeast(Severity.INFO).size());
    }

    @Test
    void severity_ordersErrorsFirst() {
        assertTrue(Severity.ERROR.isAtLeast(Severity.WARNING));
        assertFalse(Severity.INFO.isAtLeast(Severity.WARNING));
    }
}
