package org.dxworks.vbframe.ingest;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.dxworks.vbframe.diagnostics.Diagnostic;
import org.dxworks.vbframe.diagnostics.DiagnosticCodes;
import org.dxworks.vbframe.diagnostics.DiagnosticsCollector;
import org.dxworks.vbframe.diagnostics.Severity;
import org.dxworks.vbframe.ingest.generated.VisualBasic6Lexer;
import org.dxworks.vbframe.ir.SourceSpan;

/**
 * Turns ANTLR syntax errors into syntax-stage diagnostics instead of printing them to stderr.
 */
public class CollectingErrorListener extends BaseErrorListener {

    private final SourceText source;
    private final DiagnosticsCollector diagnostics;
    private int reported;

    public CollectingErrorListener(SourceText source, DiagnosticsCollector diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg,
                            RecognitionException e) {
        reported++;
        if (offendingSymbol instanceof Token) {
            Token token = (Token) offendingSymbol;
            SourceSpan span = spanOf(token);
            if (token.getType() == VisualBasic6Lexer.ERRORCHAR) {
                diagnostics.add(unrecognizedCharacter(token, span));
            } else {
                diagnostics.add(Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.SYNTAX_ERROR, msg, span));
            }
            return;
        }
        // lexer errors carry only a position
        int lineIndex = Math.max(0, Math.min(line - 1, source.lineCount() - 1));
        int at = source.lineStart(lineIndex) + Math.max(0, charPositionInLine);
        diagnostics.add(Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.UNKNOWN_TOKEN, msg,
                source.span(at, at + 1)));
    }

    /**
     * Reports an error token the parser accepted without complaint, such as the first character of an
     * invalid line. Reporting the same token twice yields one diagnostic after finalization.
     */
    public void reportUnrecognized(Token token) {
        reported++;
        diagnostics.add(unrecognizedCharacter(token, spanOf(token)));
    }

    private static Diagnostic unrecognizedCharacter(Token token, SourceSpan span) {
        return Diagnostic.syntax(Severity.ERROR, DiagnosticCodes.UNKNOWN_TOKEN,
                        "Unrecognized character '" + token.getText() + "'", span)
                .withHint("Remove the character or move it into a string literal or comment");
    }

    /**
     * Number of errors reported through this listener.
     */
    public int getReported() {
        return reported;
    }

    SourceSpan spanOf(Token token) {
        if (token.getType() == Token.EOF) {
            int end = source.length();
            return source.span(end, end);
        }
        int start = source.charIndex(token.getStartIndex());
        int stop = source.charIndex(token.getStopIndex() + 1);
        return source.span(start, Math.max(start, stop));
    }
}
