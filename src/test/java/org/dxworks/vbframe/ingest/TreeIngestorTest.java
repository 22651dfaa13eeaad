package org.dxworks.vbframe.ingest;

import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.diagnostics.DiagnosticCodes;
import org.dxworks.vbframe.diagnostics.DiagnosticsCollector;
import org.dxworks.vbframe.diagnostics.Stage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TreeIngestorTest {

    private final TreeIngestor ingestor = new TreeIngestor();

    @Test
    void ingest_validModuleHasNoDiagnostics() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        IngestionResult result = ingestor.ingest(SourceText.of("Public Sub Main()\n    x = 1\nEnd Sub\n"),
                "Main.bas", diagnostics);

        assertTrue(result.hasTree());
        assertTrue(diagnostics.snapshot().isEmpty());
    }

    @Test
    void ingest_keywordsAreCaseInsensitive() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        ingestor.ingest(SourceText.of("PUBLIC SUB Main()\n    DIM x AS LONG\nend sub\n"), "Main.bas", diagnostics);

        assertTrue(diagnostics.snapshot().isEmpty());
    }

    @Test
    void ingest_unknownCharacterBecomesUnknownTokenDiagnostic() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        IngestionResult result = ingestor.ingest(SourceText.of("Sub Main()\n    x = 1 ~\nEnd Sub\n"),
                "Main.bas", diagnostics);

        assertTrue(result.hasTree());
        List<Diagnostic> unknown = diagnostics.finalizeDiagnostics().stream()
                .filter(d -> d.getCode().equals(DiagnosticCodes.UNKNOWN_TOKEN))
                .toList();
        assertEquals(1, unknown.size());
        assertEquals(Stage.SYNTAX, unknown.get(0).getStage());
        assertEquals(2, unknown.get(0).getSpan().getStartLine());
        assertEquals(11, unknown.get(0).getSpan().getStartColumn());
    }

    @Test
    void ingest_unknownCharacterAtLineStartIsReportedOnce() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        IngestionResult result = ingestor.ingest(SourceText.of("Sub A()\n    x = 1\n    \u00a4 junk\n    y = 3\nEnd Sub\n"),
                "A.bas", diagnostics);

        assertTrue(result.hasTree());
        List<Diagnostic> reported = diagnostics.finalizeDiagnostics();
        assertEquals(1, reported.size());
        assertEquals(DiagnosticCodes.UNKNOWN_TOKEN, reported.get(0).getCode());
        assertEquals(3, reported.get(0).getSpan().getStartLine());
    }

    @Test
    void ingest_identifiersMayUseNonAsciiLetters() {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        ingestor.ingest(SourceText.of("Sub A()\n    Dim Gr\u00f6\u00dfe As Long\n    Gr\u00f6\u00dfe = 2\nEnd Sub\n"),
                "A.bas", diagnostics);

        assertTrue(diagnostics.snapshot().isEmpty());
    }

    @Test
    void ingest_missingTerminatorReportsAtEndOfInput() {
        SourceText text = SourceText.of("Private Type Point\n    X As Long\n");
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        ingestor.ingest(text, "Point.cls", diagnostics);

        List<Diagnostic> reported = diagnostics.snapshot();
        assertEquals(1, reported.size());
        assertEquals(DiagnosticCodes.SYNTAX_ERROR, reported.get(0).getCode());
        assertEquals(text.length(), reported.get(0).getSpan().getStartOffset());
    }

    @Test
    void ingest_everyCallUsesFreshParserState() {
        DiagnosticsCollector first = new DiagnosticsCollector();
        DiagnosticsCollector second = new DiagnosticsCollector();
        SourceText text = SourceText.of("Sub A()\nEnd Sub\n");

        IngestionResult a = ingestor.ingest(text, "A.bas", first);
        IngestionResult b = ingestor.ingest(text, "A.bas", second);

        assertNotSame(a.getTree(), b.getTree());
        assertNotSame(a.getTokens(), b.getTokens());
        assertEquals(a.getTree().toStringTree(), b.getTree().toStringTree());
    }
}
