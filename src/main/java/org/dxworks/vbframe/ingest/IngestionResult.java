package org.dxworks.vbframe.ingest;

import org.antlr.v4.runtime.CommonTokenStream;
import org.dxworks.vbframe.ingest.generated.VisualBasic6Parser;

/**
 * Parse tree of one module together with the token stream it came from.
 * The tree is null only when the parser itself failed; the failure is already in the diagnostics.
 */
public class IngestionResult {

    private final VisualBasic6Parser.StartRuleContext tree;
    private final CommonTokenStream tokens;
    private final SourceText source;

    public IngestionResult(VisualBasic6Parser.StartRuleContext tree, CommonTokenStream tokens, SourceText source) {
        this.tree = tree;
        this.tokens = tokens;
        this.source = source;
    }

    public VisualBasic6Parser.StartRuleContext getTree() {
        return tree;
    }

    public CommonTokenStream getTokens() {
        return tokens;
    }

    public SourceText getSource() {
        return source;
    }

    public boolean hasTree() {
        return tree != null;
    }
}
