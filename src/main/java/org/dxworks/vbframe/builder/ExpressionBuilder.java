package org.dxworks.vbframe.builder;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.dxworks.vbframe.ingest.generated.VisualBasic6Lexer;
import org.dxworks.vbframe.ingest.generated.VisualBasic6Parser;
import org.dxworks.vbframe.ingest.generated.VisualBasic6ParserBaseVisitor;
import org.dxworks.vbframe.ir.ExpressionNode;
import org.dxworks.vbframe.ir.IrNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds expression nodes. Operators, names and literals keep the exact source spelling.
 */
class ExpressionBuilder extends VisualBasic6ParserBaseVisitor<IrNode> {

    private final NodeFactory factory;

    ExpressionBuilder(NodeFactory factory) {
        this.factory = factory;
    }

    /**
     * Expression node for {@code ctx} tagged with {@code role}, an error node when the parser could not
     * derive it, or null for a missing optional part.
     */
    IrNode build(ParserRuleContext ctx, String role) {
        if (ctx == null) {
            return null;
        }
        IrNode node = factory.isBroken(ctx) ? factory.error(ctx) : ctx.accept(this);
        return node == null ? null : node.withRole(role);
    }

    void add(List<IrNode> children, ParserRuleContext ctx, String role) {
        IrNode node = build(ctx, role);
        if (node != null) {
            children.add(node);
        }
    }

    List<IrNode> arguments(VisualBasic6Parser.ArgumentListContext ctx) {
        List<IrNode> out = new ArrayList<>();
        if (ctx != null) {
            for (VisualBasic6Parser.ArgumentContext argument : ctx.argument()) {
                add(out, argument, "argument");
            }
        }
        return out;
    }

    IrNode identifier(ParserRuleContext nameCtx, String role) {
        if (nameCtx == null) {
            return null;
        }
        if (factory.isBroken(nameCtx)) {
            return factory.error(nameCtx).withRole(role);
        }
        return factory.expression(factory.range(nameCtx), List.of(), ExpressionNode.Kind.IDENTIFIER,
                null, nameCtx.getText(), null).withRole(role);
    }

    // ---- expression ----

    @Override
    public IrNode visitLiteralExpression(VisualBasic6Parser.LiteralExpressionContext ctx) {
        return ctx.literal().accept(this);
    }

    @Override
    public IrNode visitLiteral(VisualBasic6Parser.LiteralContext ctx) {
        return factory.expression(factory.range(ctx), List.of(), ExpressionNode.Kind.LITERAL, null, null,
                literalType(ctx.getStart()));
    }

    @Override
    public IrNode visitParenthesizedExpression(VisualBasic6Parser.ParenthesizedExpressionContext ctx) {
        List<IrNode> children = new ArrayList<>();
        add(children, ctx.inner, "operand");
        return factory.expression(factory.range(ctx), children, ExpressionNode.Kind.PARENTHESIZED, null, null, null);
    }

    @Override
    public IrNode visitNewExpression(VisualBasic6Parser.NewExpressionContext ctx) {
        return factory.expression(factory.range(ctx), List.of(), ExpressionNode.Kind.NEW, null,
                factory.text(ctx.typeName()), null);
    }

    @Override
    public IrNode visitTypeOfExpression(VisualBasic6Parser.TypeOfExpressionContext ctx) {
        List<IrNode> children = new ArrayList<>();
        add(children, ctx.operand, "operand");
        return factory.expression(factory.range(ctx), children, ExpressionNode.Kind.TYPE_OF, null,
                factory.text(ctx.typeName()), null);
    }

    @Override
    public IrNode visitReferenceExpression(VisualBasic6Parser.ReferenceExpressionContext ctx) {
        return build(ctx.lExpression(), null);
    }

    /**
     * Left-nested operator chains such as {@code a & b & c & ...} are walked down their left spine in a
     * loop, so thousands of terms do not exhaust the stack.
     */
    @Override
    public IrNode visitBinaryExpression(VisualBasic6Parser.BinaryExpressionContext ctx) {
        Deque<VisualBasic6Parser.BinaryExpressionContext> spine = new ArrayDeque<>();
        VisualBasic6Parser.BinaryExpressionContext current = ctx;
        spine.push(current);
        while (current.left instanceof VisualBasic6Parser.BinaryExpressionContext
                && !factory.isBroken(current.left)) {
            current = (VisualBasic6Parser.BinaryExpressionContext) current.left;
            spine.push(current);
        }
        IrNode left = build(current.left, "left");
        IrNode result = null;
        while (!spine.isEmpty()) {
            VisualBasic6Parser.BinaryExpressionContext binary = spine.pop();
            List<IrNode> children = new ArrayList<>();
            if (left != null) {
                children.add(left.withRole("left"));
            }
            add(children, binary.right, "right");
            result = factory.expression(factory.range(binary), children, ExpressionNode.Kind.BINARY,
                    binary.op.getText(), null, null);
            left = result;
        }
        return result;
    }

    @Override
    public IrNode visitUnaryExpression(VisualBasic6Parser.UnaryExpressionContext ctx) {
        List<IrNode> children = new ArrayList<>();
        add(children, ctx.operand, "operand");
        return factory.expression(factory.range(ctx), children, ExpressionNode.Kind.UNARY, ctx.op.getText(),
                null, null);
    }

    // ---- lExpression ----

    @Override
    public IrNode visitMemberAccess(VisualBasic6Parser.MemberAccessContext ctx) {
        List<IrNode> children = new ArrayList<>();
        add(children, ctx.target, "target");
        return factory.expression(factory.range(ctx), children, ExpressionNode.Kind.MEMBER_ACCESS, null,
                ctx.member.getText(), null);
    }

    @Override
    public IrNode visitDictionaryAccess(VisualBasic6Parser.DictionaryAccessContext ctx) {
        List<IrNode> children = new ArrayList<>();
        add(children, ctx.target, "target");
        return factory.expression(factory.range(ctx), children, ExpressionNode.Kind.DICTIONARY_ACCESS, null,
                ctx.member.getText(), null);
    }

    @Override
    public IrNode visitIndexOrCall(VisualBasic6Parser.IndexOrCallContext ctx) {
        List<IrNode> children = new ArrayList<>();
        add(children, ctx.target, "target");
        children.addAll(arguments(ctx.argumentList()));
        return factory.expression(factory.range(ctx), children, ExpressionNode.Kind.INDEX_OR_CALL, null, null, null);
    }

    @Override
    public IrNode visitWithMemberAccess(VisualBasic6Parser.WithMemberAccessContext ctx) {
        return factory.expression(factory.range(ctx), List.of(), ExpressionNode.Kind.WITH_MEMBER_ACCESS, null,
                ctx.member.getText(), null);
    }

    @Override
    public IrNode visitWithDictionaryAccess(VisualBasic6Parser.WithDictionaryAccessContext ctx) {
        return factory.expression(factory.range(ctx), List.of(), ExpressionNode.Kind.WITH_DICTIONARY_ACCESS, null,
                ctx.member.getText(), null);
    }

    @Override
    public IrNode visitMeReference(VisualBasic6Parser.MeReferenceContext ctx) {
        return factory.expression(factory.range(ctx), List.of(), ExpressionNode.Kind.ME, null,
                ctx.getText(), null);
    }

    @Override
    public IrNode visitSimpleName(VisualBasic6Parser.SimpleNameContext ctx) {
        return factory.expression(factory.range(ctx), List.of(), ExpressionNode.Kind.IDENTIFIER, null,
                ctx.getText(), null);
    }

    // ---- arguments and case conditions ----

    @Override
    public IrNode visitNamedArgument(VisualBasic6Parser.NamedArgumentContext ctx) {
        List<IrNode> children = new ArrayList<>();
        add(children, ctx.value, "value");
        return factory.expression(factory.range(ctx), children, ExpressionNode.Kind.NAMED_ARGUMENT, null,
                ctx.argName.getText(), null);
    }

    @Override
    public IrNode visitPositionalArgument(VisualBasic6Parser.PositionalArgumentContext ctx) {
        return build(ctx.value, null);
    }

    @Override
    public IrNode visitCaseIsCondition(VisualBasic6Parser.CaseIsConditionContext ctx) {
        List<IrNode> children = new ArrayList<>();
        add(children, ctx.value, "operand");
        return factory.expression(factory.range(ctx), children, ExpressionNode.Kind.UNARY,
                ctx.comparison.getText(), "is", null);
    }

    @Override
    public IrNode visitCaseRangeCondition(VisualBasic6Parser.CaseRangeConditionContext ctx) {
        List<IrNode> children = new ArrayList<>();
        add(children, ctx.lower, "lower");
        add(children, ctx.upper, "upper");
        return factory.expression(factory.range(ctx), children, ExpressionNode.Kind.RANGE, null, null, null);
    }

    @Override
    public IrNode visitCaseValueCondition(VisualBasic6Parser.CaseValueConditionContext ctx) {
        return build(ctx.value, null);
    }

    @Override
    public IrNode visitAttributeValue(VisualBasic6Parser.AttributeValueContext ctx) {
        String literalType = literalType(ctx.literal().getStart());
        return factory.expression(factory.range(ctx), List.of(), ExpressionNode.Kind.LITERAL, null, null,
                literalType);
    }

    static String literalType(Token token) {
        switch (token.getType()) {
            case VisualBasic6Lexer.INTEGERLITERAL:
                return "integer";
            case VisualBasic6Lexer.HEXLITERAL:
                return "hex";
            case VisualBasic6Lexer.OCTLITERAL:
                return "octal";
            case VisualBasic6Lexer.DOUBLELITERAL:
                return "double";
            case VisualBasic6Lexer.STRINGLITERAL:
                return "string";
            case VisualBasic6Lexer.DATELITERAL:
                return "date";
            case VisualBasic6Lexer.TRUE:
            case VisualBasic6Lexer.FALSE:
                return "boolean";
            case VisualBasic6Lexer.NOTHING:
                return "nothing";
            default:
                return "unknown";
        }
    }
}
