package org.dxworks.vbframe.ingest;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.diagnostics.DiagnosticCodes;
import org.dxworks.vbframe.diagnostics.DiagnosticsCollector;
import org.dxworks.vbframe.diagnostics.Severity;
import org.dxworks.vbframe.ingest.generated.VisualBasic6Lexer;
import org.dxworks.vbframe.ingest.generated.VisualBasic6Parser;

/**
 * Runs the VB6 lexer and parser over decoded source.
 * <p>
 * A fresh lexer and parser are created for every call, so one ingestor per worker thread is enough.
 * Syntax errors never abort the parse: they land in the collector and the tree keeps whatever
 * {@link LineRecoveryStrategy} recovered.
 */
public class TreeIngestor {

    public IngestionResult ingest(SourceText source, String sourceName, DiagnosticsCollector diagnostics) {
        CollectingErrorListener listener = new CollectingErrorListener(source, diagnostics);

        VisualBasic6Lexer lexer = new VisualBasic6Lexer(CharStreams.fromString(source.getText(), sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        VisualBasic6Parser parser = new VisualBasic6Parser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(listener);
        parser.setErrorHandler(new LineRecoveryStrategy());

        try {
            VisualBasic6Parser.StartRuleContext tree = parser.startRule();
            tokens.fill();
            reportErrorTokens(tokens, listener);
            return new IngestionResult(tree, tokens, source);
        } catch (RuntimeException | StackOverflowError e) {
            diagnostics.add(Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.PARSER_FAILURE,
                    "Parser failed: " + describe(e), source.span(0, source.length())));
            return new IngestionResult(null, tokens, source);
        }
    }

    // error tokens inside an invalid line or a skipped run never reach the listener on their own
    private static void reportErrorTokens(CommonTokenStream tokens, CollectingErrorListener listener) {
        for (Token token : tokens.getTokens()) {
            if (token.getType() == VisualBasic6Lexer.ERRORCHAR) {
                listener.reportUnrecognized(token);
            }
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
