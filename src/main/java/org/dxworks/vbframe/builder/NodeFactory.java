package org.dxworks.vbframe.builder;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.dxworks.vbframe.ingest.SourceText;
import org.dxworks.vbframe.ingest.generated.VisualBasic6Parser;
import org.dxworks.vbframe.ir.ControlElementNode;
import org.dxworks.vbframe.ir.DeclarationNode;
import org.dxworks.vbframe.ir.EventBindingNode;
import org.dxworks.vbframe.ir.ExpressionNode;
import org.dxworks.vbframe.ir.IrNode;
import org.dxworks.vbframe.ir.ProcedureNode;
import org.dxworks.vbframe.ir.SourceSpan;
import org.dxworks.vbframe.ir.StatementNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared state of one IR build: maps parse-tree positions to spans and text, allocates ids and
 * creates nodes. Every node created here remembers its char range so that parents can be widened to
 * cover children and trivia can be placed afterwards.
 */
class NodeFactory {

    static final String STRAY_TOKENS = "unexpectedTokens";

    private final SourceText source;
    private final CommonTokenStream tokens;
    private final IdAllocator ids = new IdAllocator();
    private final Map<IrNode, int[]> ranges = new IdentityHashMap<>();

    NodeFactory(SourceText source, CommonTokenStream tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    SourceText getSource() {
        return source;
    }

    CommonTokenStream getTokens() {
        return tokens;
    }

    // ---- positions ----

    int[] range(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        int s = charStart(start);
        if (stop == null || stop.getTokenIndex() < start.getTokenIndex()) {
            return new int[]{s, s};
        }
        return new int[]{s, Math.max(s, charEnd(stop))};
    }

    int[] range(Token token) {
        return range(token, token);
    }

    int[] range(Token first, Token last) {
        int s = charStart(first);
        return new int[]{s, Math.max(s, charEnd(last))};
    }

    int[] rangeOf(IrNode node) {
        int[] r = ranges.get(node);
        if (r == null) {
            throw new IllegalStateException("Node was not created by this factory: " + node);
        }
        return r;
    }

    SourceSpan span(int[] range) {
        return source.span(range[0], range[1]);
    }

    String text(int[] range) {
        return source.slice(range[0], range[1]);
    }

    String text(ParserRuleContext ctx) {
        return ctx == null ? null : text(range(ctx));
    }

    int charStart(Token token) {
        if (token.getType() == Token.EOF) {
            return source.length();
        }
        return source.charIndex(token.getStartIndex());
    }

    int charEnd(Token token) {
        if (token.getType() == Token.EOF) {
            return source.length();
        }
        return source.charIndex(token.getStopIndex() + 1);
    }

    /**
     * Smallest range covering {@code base} and every child.
     */
    int[] covering(int[] base, List<? extends IrNode> children) {
        int s = base[0];
        int e = base[1];
        for (IrNode child : children) {
            int[] r = rangeOf(child);
            s = Math.min(s, r[0]);
            e = Math.max(e, r[1]);
        }
        return new int[]{s, e};
    }

    // ---- node creation ----

    String id(String prefix, SourceSpan span) {
        return ids.next(prefix, span);
    }

    <T extends IrNode> T register(T node, int[] range) {
        ranges.put(node, range);
        return node;
    }

    StatementNode statement(int[] base, List<IrNode> children, StatementNode.Kind kind, String name, String value) {
        int[] r = covering(base, children);
        SourceSpan span = span(r);
        return register(new StatementNode(id("stmt", span), span, text(r), children, kind, name, value), r);
    }

    ExpressionNode expression(int[] base, List<IrNode> children, ExpressionNode.Kind kind,
                              String operator, String name, String literalType) {
        int[] r = covering(base, children);
        SourceSpan span = span(r);
        return register(new ExpressionNode(id("expr", span), span, text(r), children, kind, operator, name,
                literalType), r);
    }

    DeclarationNode declaration(int[] base, List<IrNode> children, DeclarationNode.Kind kind, String name,
                                String visibility, List<String> modifiers, String declaredType, boolean array,
                                String library, String alias) {
        int[] r = covering(base, children);
        SourceSpan span = span(r);
        return register(new DeclarationNode(id("decl", span), span, text(r), children, kind, name, visibility,
                modifiers, declaredType, array, library, alias), r);
    }

    /**
     * Procedure with an id reserved up front, so that its event binding child can refer to it.
     */
    ProcedureNode procedure(String id, int[] base, List<IrNode> children, ProcedureNode.Kind kind, String name,
                            String visibility, List<String> modifiers, String returnType) {
        int[] r = covering(base, children);
        return register(new ProcedureNode(id, span(r), text(r), children, kind, name, visibility, modifiers,
                returnType), r);
    }

    ControlElementNode control(int[] base, List<IrNode> children, String controlType, String name, Integer index) {
        int[] r = covering(base, children);
        SourceSpan span = span(r);
        return register(new ControlElementNode(id("control", span), span, text(r), children, controlType, name,
                index), r);
    }

    EventBindingNode binding(int[] r, String procedureId, String sourceName, String eventName) {
        SourceSpan span = span(r);
        return register(new EventBindingNode(id("binding", span), span, text(r), procedureId, sourceName,
                eventName), r);
    }

    org.dxworks.vbframe.ir.ErrorNode error(int[] r, String construct) {
        SourceSpan span = span(r);
        return register(new org.dxworks.vbframe.ir.ErrorNode(id("error", span), span, text(r), construct), r);
    }

    // ---- recovery ----

    /**
     * IR error node for a rule the parser could not derive. The range reaches up to the token the
     * parser stumbled on, so the syntax diagnostic reported there overlaps it.
     */
    org.dxworks.vbframe.ir.ErrorNode error(ParserRuleContext ctx) {
        int[] r = range(ctx);
        Token stop = ctx.getStop();
        int stopIndex = stop == null ? ctx.getStart().getTokenIndex() - 1 : stop.getTokenIndex();
        Token offending = ctx.exception != null ? ctx.exception.getOffendingToken() : null;
        if (offending != null && offending.getTokenIndex() > stopIndex) {
            r = new int[]{r[0], Math.max(r[1], charStart(offending))};
        } else if (offending == null && hasConjuredToken(ctx)) {
            Token next = nextDefaultToken(stopIndex);
            r = new int[]{r[0], Math.max(r[1], next == null ? source.length() : charStart(next))};
        }
        return error(r, VisualBasic6Parser.ruleNames[ctx.getRuleIndex()]);
    }

    /**
     * True when the rule failed, holds tokens the parser made up, or (unless {@code strayAllowed})
     * holds tokens it skipped. Leaf-like sub-rules that the builder reads as text are checked too.
     */
    boolean isBroken(ParserRuleContext ctx, boolean strayAllowed) {
        if (ctx.exception != null) {
            return true;
        }
        if (ctx.children == null) {
            return false;
        }
        for (ParseTree child : ctx.children) {
            if (child instanceof ErrorNode) {
                Token token = ((ErrorNode) child).getSymbol();
                if (token.getTokenIndex() < 0 || !strayAllowed) {
                    return true;
                }
            } else if (child instanceof ParserRuleContext) {
                ParserRuleContext rule = (ParserRuleContext) child;
                if (isTextual(rule) ? hasErrorDeep(rule) : isWrapper(rule) && hasErrorShallow(rule)) {
                    return true;
                }
            }
        }
        return false;
    }

    boolean isBroken(ParserRuleContext ctx) {
        return isBroken(ctx, false);
    }

    /**
     * Error leaves for runs of tokens the parser skipped directly inside {@code ctx}, merged with
     * {@code children} in source order.
     */
    List<IrNode> withStrayTokens(ParserRuleContext ctx, List<IrNode> children) {
        if (ctx.children == null) {
            return children;
        }
        List<IrNode> merged = new ArrayList<>(children);
        Token runStart = null;
        Token runEnd = null;
        for (ParseTree child : ctx.children) {
            boolean stray = child instanceof ErrorNode && ((TerminalNode) child).getSymbol().getTokenIndex() >= 0;
            if (stray) {
                Token token = ((TerminalNode) child).getSymbol();
                if (runStart == null) {
                    runStart = token;
                }
                runEnd = token;
            } else if (runStart != null) {
                merged.add(error(range(runStart, runEnd), STRAY_TOKENS));
                runStart = null;
            }
        }
        if (runStart != null) {
            merged.add(error(range(runStart, runEnd), STRAY_TOKENS));
        }
        if (merged.size() != children.size()) {
            merged.sort(Comparator.comparingInt((IrNode n) -> rangeOf(n)[0]));
        }
        return merged;
    }

    private boolean hasConjuredToken(ParserRuleContext ctx) {
        if (ctx.children == null) {
            return false;
        }
        for (ParseTree child : ctx.children) {
            if (child instanceof ErrorNode && ((ErrorNode) child).getSymbol().getTokenIndex() < 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTextual(ParserRuleContext ctx) {
        return ctx instanceof VisualBasic6Parser.VisibilityContext
                || ctx instanceof VisualBasic6Parser.TypeNameContext
                || ctx instanceof VisualBasic6Parser.AmbiguousIdentifierContext
                || ctx instanceof VisualBasic6Parser.AnyIdentifierContext
                || ctx instanceof VisualBasic6Parser.LabelReferenceContext
                || ctx instanceof VisualBasic6Parser.LiteralContext
                || ctx instanceof VisualBasic6Parser.PropertyValueContext
                || ctx instanceof VisualBasic6Parser.AttributeValueContext;
    }

    // wrappers whose own tokens belong to the enclosing construct; their inner rules are built separately
    private static boolean isWrapper(ParserRuleContext ctx) {
        return ctx instanceof VisualBasic6Parser.ArgListContext
                || ctx instanceof VisualBasic6Parser.AsTypeClauseContext
                || ctx instanceof VisualBasic6Parser.SubscriptsContext
                || ctx instanceof VisualBasic6Parser.SubscriptContext
                || ctx instanceof VisualBasic6Parser.ArgumentListContext
                || ctx instanceof VisualBasic6Parser.InlineBodyContext;
    }

    private static boolean hasErrorShallow(ParserRuleContext ctx) {
        if (ctx.exception != null) {
            return true;
        }
        if (ctx.children == null) {
            return false;
        }
        for (ParseTree child : ctx.children) {
            if (child instanceof ErrorNode) {
                return true;
            }
            if (child instanceof ParserRuleContext && isTextual((ParserRuleContext) child)
                    && hasErrorDeep((ParserRuleContext) child)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasErrorDeep(ParserRuleContext ctx) {
        if (ctx.exception != null) {
            return true;
        }
        if (ctx.children == null) {
            return false;
        }
        for (ParseTree child : ctx.children) {
            if (child instanceof ErrorNode) {
                return true;
            }
            if (child instanceof ParserRuleContext && hasErrorDeep((ParserRuleContext) child)) {
                return true;
            }
        }
        return false;
    }

    private Token nextDefaultToken(int afterIndex) {
        for (int i = afterIndex + 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.getChannel() == Token.DEFAULT_CHANNEL) {
                return t;
            }
        }
        return null;
    }
}
