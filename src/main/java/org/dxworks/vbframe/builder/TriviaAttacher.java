package org.dxworks.vbframe.builder;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.dxworks.vbframe.ingest.SourceText;
import org.dxworks.vbframe.ingest.generated.VisualBasic6Lexer;
import org.dxworks.vbframe.ir.IrNode;
import org.dxworks.vbframe.ir.IrWalker;
import org.dxworks.vbframe.ir.NodeKind;
import org.dxworks.vbframe.ir.SourceSpan;
import org.dxworks.vbframe.ir.TriviaNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Places comments and blank-line runs on the structural tree.
 * <p>
 * A comment that ends the line of a statement or declaration becomes trailing trivia of the outermost
 * node ending on that line's last token. Everything else becomes leading trivia of the next structural
 * sibling inside the innermost enclosing node, or trailing trivia of that node when no sibling follows.
 */
class TriviaAttacher {

    private final NodeFactory factory;
    private final SourceText source;
    private final CommonTokenStream tokens;

    TriviaAttacher(NodeFactory factory) {
        this.factory = factory;
        this.source = factory.getSource();
        this.tokens = factory.getTokens();
    }

    void attach(IrNode module) {
        // preorder visits parents first, so the first anchor per end offset is the outermost one
        Map<Integer, IrNode> byEnd = new HashMap<>();
        for (IrNode node : IrWalker.preorder(module)) {
            if (isAnchor(node)) {
                byEnd.putIfAbsent(factory.rangeOf(node)[1], node);
            }
        }
        for (Pending pending : collect()) {
            if (pending.lastCodeToken != null) {
                IrNode owner = byEnd.get(factory.charEnd(pending.lastCodeToken));
                if (owner != null) {
                    owner.addTrailingTrivia(pending.trivia);
                    continue;
                }
            }
            IrNode container = innermostContaining(module, pending.trivia.getSpan());
            IrNode next = nextAnchorChild(container, pending.trivia.getSpan());
            if (next != null) {
                next.addLeadingTrivia(pending.trivia);
            } else {
                container.addTrailingTrivia(pending.trivia);
            }
        }
    }

    private List<Pending> collect() {
        List<Pending> out = new ArrayList<>();
        if (tokens != null) {
            for (Token token : tokens.getTokens()) {
                if (token.getType() == VisualBasic6Lexer.COMMENT || token.getType() == VisualBasic6Lexer.REMCOMMENT) {
                    int[] r = factory.range(token);
                    SourceSpan span = factory.span(r);
                    TriviaNode trivia = factory.register(new TriviaNode(factory.id("trivia", span), span,
                            factory.text(r), TriviaNode.Kind.COMMENT, 1), r);
                    out.add(new Pending(trivia, previousCodeTokenOnLine(token)));
                }
            }
        }
        int lines = source.lineCount();
        int line = 0;
        while (line < lines) {
            if (!isBlank(line)) {
                line++;
                continue;
            }
            int first = line;
            while (line < lines && isBlank(line)) {
                line++;
            }
            int[] r = {source.lineStart(first), source.lineContentEnd(line - 1)};
            SourceSpan span = factory.span(r);
            TriviaNode trivia = factory.register(new TriviaNode(factory.id("trivia", span), span, factory.text(r),
                    TriviaNode.Kind.BLANK_LINES, line - first), r);
            out.add(new Pending(trivia, null));
        }
        out.sort(Comparator.comparingInt(p -> p.trivia.getSpan().getStartOffset()));
        return out;
    }

    // the empty remainder after a final line terminator is not a line of its own
    private boolean isBlank(int line) {
        if (line == source.lineCount() - 1 && source.lineStart(line) == source.length()) {
            return false;
        }
        return source.isBlankLine(line);
    }

    private Token previousCodeTokenOnLine(Token comment) {
        for (int i = comment.getTokenIndex() - 1; i >= 0; i--) {
            Token t = tokens.get(i);
            if (t.getLine() != comment.getLine() || t.getType() == VisualBasic6Lexer.NEWLINE) {
                return null;
            }
            if (t.getChannel() == Token.DEFAULT_CHANNEL) {
                return t;
            }
        }
        return null;
    }

    private static IrNode innermostContaining(IrNode module, SourceSpan span) {
        IrNode current = module;
        boolean descended = true;
        while (descended) {
            descended = false;
            for (IrNode child : current.getChildren()) {
                if (isAnchor(child) && child.getSpan().contains(span)) {
                    current = child;
                    descended = true;
                    break;
                }
            }
        }
        return current;
    }

    private static IrNode nextAnchorChild(IrNode container, SourceSpan span) {
        for (IrNode child : container.getChildren()) {
            if (isAnchor(child) && child.getSpan().getStartOffset() >= span.getEndOffset()) {
                return child;
            }
        }
        return null;
    }

    private static boolean isAnchor(IrNode node) {
        NodeKind kind = node.getKind();
        return kind == NodeKind.DECLARATION || kind == NodeKind.PROCEDURE || kind == NodeKind.STATEMENT
                || kind == NodeKind.CONTROL_ELEMENT || kind == NodeKind.ERROR;
    }

    private static final class Pending {
        private final TriviaNode trivia;
        private final Token lastCodeToken;

        private Pending(TriviaNode trivia, Token lastCodeToken) {
            this.trivia = trivia;
            this.lastCodeToken = lastCodeToken;
        }
    }
}
