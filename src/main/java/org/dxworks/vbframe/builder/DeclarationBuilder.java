package org.dxworks.vbframe.builder;

import org.dxworks.vbframe.ingest.generated.VisualBasic6Parser;
import org.dxworks.vbframe.ir.DeclarationNode;
import org.dxworks.vbframe.ir.IrNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds declaration nodes for module-level and procedure-level declarations and for parameters.
 */
class DeclarationBuilder {

    private final NodeFactory factory;
    private final ExpressionBuilder expressions;

    DeclarationBuilder(NodeFactory factory, ExpressionBuilder expressions) {
        this.factory = factory;
        this.expressions = expressions;
    }

    IrNode variables(VisualBasic6Parser.VariableStmtContext ctx) {
        if (factory.isBroken(ctx)) {
            return factory.error(ctx);
        }
        String visibility = ctx.visibility() != null ? Literals.lower(ctx.visibility().getText()) : null;
        List<String> modifiers = ctx.STATIC() != null ? List.of("static") : List.of();
        List<IrNode> children = new ArrayList<>();
        for (VisualBasic6Parser.VariableDeclContext decl : ctx.variableDecl()) {
            children.add(variable(decl, visibility, modifiers));
        }
        return factory.declaration(factory.range(ctx), children, DeclarationNode.Kind.VARIABLE_LIST, null,
                visibility, modifiers, null, false, null, null);
    }

    private IrNode variable(VisualBasic6Parser.VariableDeclContext ctx, String visibility, List<String> inherited) {
        if (factory.isBroken(ctx)) {
            return factory.error(ctx).withRole("declarator");
        }
        List<String> modifiers = new ArrayList<>(inherited);
        if (ctx.WITHEVENTS() != null) {
            modifiers.add("withEvents");
        }
        VisualBasic6Parser.AsTypeClauseContext asType = ctx.asTypeClause();
        if (asType != null && asType.NEW() != null) {
            modifiers.add("new");
        }
        List<IrNode> children = new ArrayList<>();
        addBounds(children, ctx.subscripts());
        addLength(children, asType);
        return factory.declaration(factory.range(ctx), children, DeclarationNode.Kind.VARIABLE,
                ctx.name.getText(), visibility, modifiers, typeName(asType), ctx.LPAREN() != null, null, null)
                .withRole("declarator");
    }

    IrNode constants(VisualBasic6Parser.ConstStmtContext ctx) {
        if (factory.isBroken(ctx)) {
            return factory.error(ctx);
        }
        String visibility = ctx.visibility() != null ? Literals.lower(ctx.visibility().getText()) : null;
        List<IrNode> children = new ArrayList<>();
        for (VisualBasic6Parser.ConstDeclContext decl : ctx.constDecl()) {
            if (factory.isBroken(decl)) {
                children.add(factory.error(decl).withRole("declarator"));
                continue;
            }
            List<IrNode> declChildren = new ArrayList<>();
            addLength(declChildren, decl.asTypeClause());
            expressions.add(declChildren, decl.value, "value");
            children.add(factory.declaration(factory.range(decl), declChildren, DeclarationNode.Kind.CONSTANT,
                    decl.name.getText(), visibility, List.of(), typeName(decl.asTypeClause()), false, null, null)
                    .withRole("declarator"));
        }
        return factory.declaration(factory.range(ctx), children, DeclarationNode.Kind.CONSTANT_LIST, null,
                visibility, List.of(), null, false, null, null);
    }

    IrNode userType(VisualBasic6Parser.TypeStmtContext ctx) {
        if (factory.isBroken(ctx, true)) {
            return factory.error(ctx);
        }
        List<IrNode> members = new ArrayList<>();
        for (VisualBasic6Parser.TypeMemberContext member : ctx.typeMember()) {
            if (factory.isBroken(member)) {
                members.add(factory.error(member));
                continue;
            }
            List<IrNode> memberChildren = new ArrayList<>();
            addBounds(memberChildren, member.subscripts());
            addLength(memberChildren, member.asTypeClause());
            members.add(factory.declaration(factory.range(member), memberChildren, DeclarationNode.Kind.TYPE_MEMBER,
                    member.name.getText(), null, List.of(), typeName(member.asTypeClause()),
                    member.LPAREN() != null, null, null).withRole("member"));
        }
        return factory.declaration(factory.range(ctx), factory.withStrayTokens(ctx, members),
                DeclarationNode.Kind.TYPE, ctx.name.getText(), visibility(ctx.visibility()), List.of(), null, false,
                null, null);
    }

    IrNode enumeration(VisualBasic6Parser.EnumStmtContext ctx) {
        if (factory.isBroken(ctx, true)) {
            return factory.error(ctx);
        }
        List<IrNode> members = new ArrayList<>();
        for (VisualBasic6Parser.EnumMemberContext member : ctx.enumMember()) {
            if (factory.isBroken(member)) {
                members.add(factory.error(member));
                continue;
            }
            List<IrNode> memberChildren = new ArrayList<>();
            expressions.add(memberChildren, member.value, "value");
            members.add(factory.declaration(factory.range(member), memberChildren, DeclarationNode.Kind.ENUM_MEMBER,
                    member.name.getText(), null, List.of(), null, false, null, null).withRole("member"));
        }
        return factory.declaration(factory.range(ctx), factory.withStrayTokens(ctx, members),
                DeclarationNode.Kind.ENUM, ctx.name.getText(), visibility(ctx.visibility()), List.of(), null, false,
                null, null);
    }

    IrNode external(VisualBasic6Parser.DeclareStmtContext ctx) {
        if (factory.isBroken(ctx)) {
            return factory.error(ctx);
        }
        String alias = ctx.alias != null ? Literals.unquote(ctx.alias.getText()) : null;
        return factory.declaration(factory.range(ctx), parameters(ctx.argList()),
                DeclarationNode.Kind.EXTERNAL_PROCEDURE, ctx.name.getText(), visibility(ctx.visibility()),
                List.of(Literals.lower(ctx.kind.getText())), typeName(ctx.asTypeClause()), false,
                Literals.unquote(ctx.library.getText()), alias);
    }

    IrNode event(VisualBasic6Parser.EventStmtContext ctx) {
        if (factory.isBroken(ctx)) {
            return factory.error(ctx);
        }
        return factory.declaration(factory.range(ctx), parameters(ctx.argList()), DeclarationNode.Kind.EVENT,
                ctx.name.getText(), visibility(ctx.visibility()), List.of(), null, false, null, null);
    }

    IrNode implementsClause(VisualBasic6Parser.ImplementsStmtContext ctx) {
        if (factory.isBroken(ctx)) {
            return factory.error(ctx);
        }
        String type = ctx.typeName().getText();
        return factory.declaration(factory.range(ctx), List.of(), DeclarationNode.Kind.IMPLEMENTS, type, null,
                List.of(), type, false, null, null);
    }

    /**
     * Target of one {@code ReDim} clause, recorded as an array variable with its new bounds.
     */
    IrNode redimTarget(VisualBasic6Parser.RedimDeclContext ctx) {
        if (factory.isBroken(ctx)) {
            return factory.error(ctx).withRole("target");
        }
        List<IrNode> children = new ArrayList<>();
        addBounds(children, ctx.subscripts());
        addLength(children, ctx.asTypeClause());
        return factory.declaration(factory.range(ctx), children, DeclarationNode.Kind.VARIABLE, ctx.name.getText(),
                null, List.of(), typeName(ctx.asTypeClause()), true, null, null).withRole("target");
    }

    List<IrNode> parameters(VisualBasic6Parser.ArgListContext ctx) {
        List<IrNode> out = new ArrayList<>();
        if (ctx == null) {
            return out;
        }
        for (VisualBasic6Parser.ArgContext arg : ctx.arg()) {
            if (factory.isBroken(arg)) {
                out.add(factory.error(arg).withRole("parameter"));
                continue;
            }
            List<String> modifiers = new ArrayList<>();
            if (arg.OPTIONAL() != null) {
                modifiers.add("optional");
            }
            if (arg.passing != null) {
                modifiers.add(Literals.lower(arg.passing.getText()));
            }
            if (arg.PARAMARRAY() != null) {
                modifiers.add("paramArray");
            }
            List<IrNode> children = new ArrayList<>();
            addLength(children, arg.asTypeClause());
            expressions.add(children, arg.defaultValue, "defaultValue");
            out.add(factory.declaration(factory.range(arg), children, DeclarationNode.Kind.PARAMETER,
                    arg.name.getText(), null, modifiers, typeName(arg.asTypeClause()), arg.LPAREN() != null,
                    null, null).withRole("parameter"));
        }
        return out;
    }

    static String typeName(VisualBasic6Parser.AsTypeClauseContext ctx) {
        return ctx == null ? null : ctx.typeName().getText();
    }

    static String visibility(VisualBasic6Parser.VisibilityContext ctx) {
        return ctx == null ? null : Literals.lower(ctx.getText());
    }

    private void addBounds(List<IrNode> children, VisualBasic6Parser.SubscriptsContext ctx) {
        if (ctx == null) {
            return;
        }
        for (VisualBasic6Parser.SubscriptContext subscript : ctx.subscript()) {
            expressions.add(children, subscript.lower, "lowerBound");
            expressions.add(children, subscript.upper, "upperBound");
        }
    }

    private void addLength(List<IrNode> children, VisualBasic6Parser.AsTypeClauseContext ctx) {
        if (ctx != null) {
            expressions.add(children, ctx.length, "length");
        }
    }
}
