package org.dxworks.vbframe.builder;

import org.antlr.v4.runtime.ParserRuleContext;
import org.dxworks.vbframe.ingest.generated.VisualBasic6Parser;
import org.dxworks.vbframe.ingest.generated.VisualBasic6ParserBaseVisitor;
import org.dxworks.vbframe.ir.IrNode;
import org.dxworks.vbframe.ir.StatementNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds statement nodes for procedure bodies. Compound statements list their condition or header
 * expressions first and then their nested statements, each child tagged with its role.
 */
class StatementBuilder extends VisualBasic6ParserBaseVisitor<IrNode> {

    private final NodeFactory factory;
    private final ExpressionBuilder expressions;
    private final DeclarationBuilder declarations;

    StatementBuilder(NodeFactory factory, ExpressionBuilder expressions, DeclarationBuilder declarations) {
        this.factory = factory;
        this.expressions = expressions;
        this.declarations = declarations;
    }

    /**
     * Statements of a block in source order, with skipped tokens turned into error leaves.
     */
    List<IrNode> block(VisualBasic6Parser.BlockContext ctx, String role) {
        List<IrNode> out = new ArrayList<>();
        if (ctx == null) {
            return out;
        }
        for (VisualBasic6Parser.BlockStmtContext stmt : ctx.blockStmt()) {
            out.add(statement(stmt).withRole(role));
        }
        return factory.withStrayTokens(ctx, out);
    }

    IrNode statement(VisualBasic6Parser.BlockStmtContext ctx) {
        if (factory.isBroken(ctx) || ctx.getChildCount() == 0) {
            return factory.error(ctx);
        }
        return build((ParserRuleContext) ctx.getChild(0));
    }

    private IrNode build(ParserRuleContext ctx) {
        if (factory.isBroken(ctx, isCompound(ctx))) {
            return factory.error(ctx);
        }
        return ctx.accept(this);
    }

    private static boolean isCompound(ParserRuleContext ctx) {
        return ctx instanceof VisualBasic6Parser.BlockIfStmtContext
                || ctx instanceof VisualBasic6Parser.ElseIfClauseContext
                || ctx instanceof VisualBasic6Parser.ElseClauseContext
                || ctx instanceof VisualBasic6Parser.SelectCaseStmtContext
                || ctx instanceof VisualBasic6Parser.CaseClauseContext
                || ctx instanceof VisualBasic6Parser.ForNextStmtContext
                || ctx instanceof VisualBasic6Parser.ForEachStmtContext
                || ctx instanceof VisualBasic6Parser.DoLoopStmtContext
                || ctx instanceof VisualBasic6Parser.WhileWendStmtContext
                || ctx instanceof VisualBasic6Parser.WithStmtContext;
    }

    private StatementNode statement(ParserRuleContext ctx, List<IrNode> children, StatementNode.Kind kind,
                                    String name, String value) {
        return factory.statement(factory.range(ctx), children, kind, name, value);
    }

    private StatementNode compound(ParserRuleContext ctx, List<IrNode> children, StatementNode.Kind kind,
                                   String name, String value) {
        return statement(ctx, factory.withStrayTokens(ctx, children), kind, name, value);
    }

    // ---- simple statements ----

    @Override
    public IrNode visitInvalidLine(VisualBasic6Parser.InvalidLineContext ctx) {
        return factory.error(factory.range(ctx), "invalidLine");
    }

    @Override
    public IrNode visitLineLabel(VisualBasic6Parser.LineLabelContext ctx) {
        return statement(ctx, List.of(), StatementNode.Kind.LABEL, ctx.name.getText(), null);
    }

    @Override
    public IrNode visitAttributeStmt(VisualBasic6Parser.AttributeStmtContext ctx) {
        List<IrNode> values = new ArrayList<>();
        for (VisualBasic6Parser.AttributeValueContext value : ctx.attributeValue()) {
            expressions.add(values, value, "value");
        }
        return statement(ctx, values, StatementNode.Kind.ATTRIBUTE, ctx.attributeName.getText(), null);
    }

    @Override
    public IrNode visitVariableStmt(VisualBasic6Parser.VariableStmtContext ctx) {
        return declarations.variables(ctx);
    }

    @Override
    public IrNode visitConstStmt(VisualBasic6Parser.ConstStmtContext ctx) {
        return declarations.constants(ctx);
    }

    @Override
    public IrNode visitExitStmt(VisualBasic6Parser.ExitStmtContext ctx) {
        return statement(ctx, List.of(), StatementNode.Kind.EXIT, Literals.lower(ctx.target.getText()), null);
    }

    @Override
    public IrNode visitGotoStmt(VisualBasic6Parser.GotoStmtContext ctx) {
        return statement(ctx, List.of(), StatementNode.Kind.GOTO, ctx.label.getText(), null);
    }

    @Override
    public IrNode visitGosubStmt(VisualBasic6Parser.GosubStmtContext ctx) {
        return statement(ctx, List.of(), StatementNode.Kind.GOSUB, ctx.label.getText(), null);
    }

    @Override
    public IrNode visitReturnStmt(VisualBasic6Parser.ReturnStmtContext ctx) {
        return statement(ctx, List.of(), StatementNode.Kind.RETURN, null, null);
    }

    @Override
    public IrNode visitOnErrorGoto(VisualBasic6Parser.OnErrorGotoContext ctx) {
        String target = (ctx.MINUS() != null ? "-" : "") + ctx.label.getText();
        return statement(ctx, List.of(), StatementNode.Kind.ON_ERROR, "goto", target);
    }

    @Override
    public IrNode visitOnErrorResumeNext(VisualBasic6Parser.OnErrorResumeNextContext ctx) {
        return statement(ctx, List.of(), StatementNode.Kind.ON_ERROR, "resumeNext", null);
    }

    @Override
    public IrNode visitResumeStmt(VisualBasic6Parser.ResumeStmtContext ctx) {
        String target = null;
        if (ctx.NEXT() != null) {
            target = "next";
        } else if (ctx.labelReference() != null) {
            target = ctx.labelReference().getText();
        }
        return statement(ctx, List.of(), StatementNode.Kind.RESUME, null, target);
    }

    @Override
    public IrNode visitRedimStmt(VisualBasic6Parser.RedimStmtContext ctx) {
        List<IrNode> targets = new ArrayList<>();
        for (VisualBasic6Parser.RedimDeclContext decl : ctx.redimDecl()) {
            targets.add(declarations.redimTarget(decl));
        }
        return statement(ctx, targets, StatementNode.Kind.REDIM, null, ctx.PRESERVE() != null ? "preserve" : null);
    }

    @Override
    public IrNode visitRaiseEventStmt(VisualBasic6Parser.RaiseEventStmtContext ctx) {
        return statement(ctx, expressions.arguments(ctx.argumentList()), StatementNode.Kind.RAISE_EVENT,
                ctx.name.getText(), null);
    }

    @Override
    public IrNode visitSetStmt(VisualBasic6Parser.SetStmtContext ctx) {
        return assignment(ctx, ctx.target, ctx.value, "set");
    }

    @Override
    public IrNode visitLetStmt(VisualBasic6Parser.LetStmtContext ctx) {
        return assignment(ctx, ctx.target, ctx.value, "let");
    }

    private IrNode assignment(ParserRuleContext ctx, ParserRuleContext target, ParserRuleContext value, String form) {
        List<IrNode> children = new ArrayList<>();
        expressions.add(children, target, "target");
        expressions.add(children, value, "value");
        return statement(ctx, children, StatementNode.Kind.ASSIGNMENT, form, null);
    }

    @Override
    public IrNode visitCallStmt(VisualBasic6Parser.CallStmtContext ctx) {
        List<IrNode> children = new ArrayList<>();
        expressions.add(children, ctx.callee, "callee");
        return statement(ctx, children, StatementNode.Kind.CALL, "explicit", null);
    }

    @Override
    public IrNode visitImplicitCallStmt(VisualBasic6Parser.ImplicitCallStmtContext ctx) {
        List<IrNode> children = new ArrayList<>();
        expressions.add(children, ctx.callee, "callee");
        for (VisualBasic6Parser.ArgumentContext argument : ctx.argument()) {
            expressions.add(children, argument, "argument");
        }
        return statement(ctx, children, StatementNode.Kind.CALL, "implicit", null);
    }

    @Override
    public IrNode visitEndStmt(VisualBasic6Parser.EndStmtContext ctx) {
        return statement(ctx, List.of(), StatementNode.Kind.END, null, null);
    }

    @Override
    public IrNode visitStopStmt(VisualBasic6Parser.StopStmtContext ctx) {
        return statement(ctx, List.of(), StatementNode.Kind.STOP, null, null);
    }

    // ---- conditionals ----

    @Override
    public IrNode visitBlockIfStmt(VisualBasic6Parser.BlockIfStmtContext ctx) {
        List<IrNode> children = new ArrayList<>();
        expressions.add(children, ctx.condition, "condition");
        children.addAll(block(ctx.block(), "then"));
        for (VisualBasic6Parser.ElseIfClauseContext clause : ctx.elseIfClause()) {
            children.add(build(clause).withRole("elseIf"));
        }
        if (ctx.elseClause() != null) {
            children.add(build(ctx.elseClause()).withRole("else"));
        }
        return compound(ctx, children, StatementNode.Kind.IF, "block", null);
    }

    @Override
    public IrNode visitElseIfClause(VisualBasic6Parser.ElseIfClauseContext ctx) {
        List<IrNode> children = new ArrayList<>();
        expressions.add(children, ctx.condition, "condition");
        children.addAll(block(ctx.block(), "then"));
        return compound(ctx, children, StatementNode.Kind.ELSE_IF, null, null);
    }

    @Override
    public IrNode visitElseClause(VisualBasic6Parser.ElseClauseContext ctx) {
        return compound(ctx, block(ctx.block(), "body"), StatementNode.Kind.ELSE, null, null);
    }

    @Override
    public IrNode visitInlineIfStmt(VisualBasic6Parser.InlineIfStmtContext ctx) {
        List<IrNode> children = new ArrayList<>();
        expressions.add(children, ctx.condition, "condition");
        inline(children, ctx.thenBody, "then");
        inline(children, ctx.elseBody, "else");
        return statement(ctx, children, StatementNode.Kind.IF, "inline", null);
    }

    private void inline(List<IrNode> children, VisualBasic6Parser.InlineBodyContext body, String role) {
        if (body == null) {
            return;
        }
        for (VisualBasic6Parser.BlockStmtContext stmt : body.blockStmt()) {
            children.add(statement(stmt).withRole(role));
        }
    }

    @Override
    public IrNode visitSelectCaseStmt(VisualBasic6Parser.SelectCaseStmtContext ctx) {
        List<IrNode> children = new ArrayList<>();
        expressions.add(children, ctx.selector, "selector");
        for (VisualBasic6Parser.CaseClauseContext clause : ctx.caseClause()) {
            children.add(build(clause).withRole("case"));
        }
        return compound(ctx, children, StatementNode.Kind.SELECT_CASE, null, null);
    }

    @Override
    public IrNode visitCaseClause(VisualBasic6Parser.CaseClauseContext ctx) {
        List<IrNode> children = new ArrayList<>();
        for (VisualBasic6Parser.CaseConditionContext condition : ctx.caseCondition()) {
            expressions.add(children, condition, "condition");
        }
        children.addAll(block(ctx.block(), "body"));
        return compound(ctx, children, StatementNode.Kind.CASE, ctx.ELSE() != null ? "else" : null, null);
    }

    // ---- loops ----

    @Override
    public IrNode visitForNextStmt(VisualBasic6Parser.ForNextStmtContext ctx) {
        List<IrNode> children = new ArrayList<>();
        children.add(expressions.identifier(ctx.counter, "counter"));
        expressions.add(children, ctx.initial, "start");
        expressions.add(children, ctx.limit, "end");
        expressions.add(children, ctx.increment, "step");
        children.addAll(block(ctx.block(), "body"));
        return compound(ctx, children, StatementNode.Kind.FOR, ctx.counter.getText(), null);
    }

    @Override
    public IrNode visitForEachStmt(VisualBasic6Parser.ForEachStmtContext ctx) {
        List<IrNode> children = new ArrayList<>();
        children.add(expressions.identifier(ctx.element, "element"));
        expressions.add(children, ctx.collection, "collection");
        children.addAll(block(ctx.block(), "body"));
        return compound(ctx, children, StatementNode.Kind.FOR_EACH, ctx.element.getText(), null);
    }

    @Override
    public IrNode visitDoPreConditionLoop(VisualBasic6Parser.DoPreConditionLoopContext ctx) {
        List<IrNode> children = new ArrayList<>();
        expressions.add(children, ctx.condition, "condition");
        children.addAll(block(ctx.block(), "body"));
        return compound(ctx, children, StatementNode.Kind.DO_LOOP, Literals.lower(ctx.loopKind.getText()), "pre");
    }

    @Override
    public IrNode visitDoPostConditionLoop(VisualBasic6Parser.DoPostConditionLoopContext ctx) {
        List<IrNode> children = new ArrayList<>(block(ctx.block(), "body"));
        expressions.add(children, ctx.condition, "condition");
        return compound(ctx, children, StatementNode.Kind.DO_LOOP, Literals.lower(ctx.loopKind.getText()), "post");
    }

    @Override
    public IrNode visitDoInfiniteLoop(VisualBasic6Parser.DoInfiniteLoopContext ctx) {
        return compound(ctx, block(ctx.block(), "body"), StatementNode.Kind.DO_LOOP, null, null);
    }

    @Override
    public IrNode visitWhileWendStmt(VisualBasic6Parser.WhileWendStmtContext ctx) {
        List<IrNode> children = new ArrayList<>();
        expressions.add(children, ctx.condition, "condition");
        children.addAll(block(ctx.block(), "body"));
        return compound(ctx, children, StatementNode.Kind.WHILE_WEND, null, null);
    }

    @Override
    public IrNode visitWithStmt(VisualBasic6Parser.WithStmtContext ctx) {
        List<IrNode> children = new ArrayList<>();
        expressions.add(children, ctx.target, "target");
        children.addAll(block(ctx.block(), "body"));
        return compound(ctx, children, StatementNode.Kind.WITH, null, null);
    }
}
