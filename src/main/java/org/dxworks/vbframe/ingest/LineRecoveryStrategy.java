package org.dxworks.vbframe.ingest;

import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.InputMismatchException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.dxworks.vbframe.ingest.generated.VisualBasic6Lexer;

/**
 * Default recovery, except that a loop meeting tokens it cannot start an element with skips the rest of
 * the line instead of failing the enclosing rule. Without this, two junk characters at module level would
 * end the module rule and drop every procedure after them. Skipped tokens stay in the tree as error nodes.
 */
public class LineRecoveryStrategy extends DefaultErrorStrategy {

    @Override
    public void sync(Parser recognizer) throws RecognitionException {
        try {
            super.sync(recognizer);
        } catch (InputMismatchException e) {
            int type = recognizer.getInputStream().LA(1);
            if (type == VisualBasic6Lexer.NEWLINE || type == Token.EOF) {
                throw e;
            }
            reportError(recognizer, e);
            while (type != VisualBasic6Lexer.NEWLINE && type != Token.EOF) {
                recognizer.consume();
                type = recognizer.getInputStream().LA(1);
            }
        }
    }
}
