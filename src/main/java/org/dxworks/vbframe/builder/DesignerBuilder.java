package org.dxworks.vbframe.builder;

import org.dxworks.vbframe.ingest.generated.VisualBasic6Parser;
import org.dxworks.vbframe.ir.IrNode;
import org.dxworks.vbframe.ir.StatementNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the header section of form and class files: {@code VERSION}, {@code Object} references and
 * the {@code Begin ... End} designer blocks with their properties.
 */
class DesignerBuilder {

    private final NodeFactory factory;

    DesignerBuilder(NodeFactory factory) {
        this.factory = factory;
    }

    IrNode version(VisualBasic6Parser.VersionStmtContext ctx) {
        if (factory.isBroken(ctx)) {
            return factory.error(ctx);
        }
        return factory.statement(factory.range(ctx), List.of(), StatementNode.Kind.VERSION,
                ctx.CLASS() != null ? "class" : null, ctx.version.getText());
    }

    IrNode objectReference(VisualBasic6Parser.ObjectStmtContext ctx) {
        if (factory.isBroken(ctx)) {
            return factory.error(ctx);
        }
        String file = ctx.file != null ? Literals.unquote(ctx.file.getText()) : null;
        return factory.statement(factory.range(ctx), List.of(), StatementNode.Kind.OBJECT_REFERENCE,
                Literals.unquote(ctx.reference.getText()), file);
    }

    /**
     * A typed block ({@code Begin VB.Form Form1}) becomes a control element; the untyped block of a
     * class header becomes a {@code classHeader} statement.
     */
    IrNode block(VisualBasic6Parser.DesignerBlockContext ctx) {
        if (factory.isBroken(ctx, true)) {
            return factory.error(ctx);
        }
        List<IrNode> members = factory.withStrayTokens(ctx, members(ctx.designerMember()));
        if (ctx.controlType == null) {
            return factory.statement(factory.range(ctx), members, StatementNode.Kind.CLASS_HEADER, null, null);
        }
        return factory.control(factory.range(ctx), members, ctx.controlType.getText(), ctx.controlName.getText(),
                index(ctx.designerMember()));
    }

    private List<IrNode> members(List<VisualBasic6Parser.DesignerMemberContext> members) {
        List<IrNode> out = new ArrayList<>();
        for (VisualBasic6Parser.DesignerMemberContext member : members) {
            if (member.NEWLINE() != null) {
                continue;
            }
            if (factory.isBroken(member)) {
                out.add(factory.error(member));
            } else if (member.designerBlock() != null) {
                out.add(block(member.designerBlock()).withRole("control"));
            } else if (member.propertyGroup() != null) {
                out.add(group(member.propertyGroup()));
            } else if (member.designerProperty() != null) {
                out.add(property(member.designerProperty()));
            }
        }
        return out;
    }

    private IrNode group(VisualBasic6Parser.PropertyGroupContext ctx) {
        if (factory.isBroken(ctx, true)) {
            return factory.error(ctx);
        }
        List<IrNode> members = factory.withStrayTokens(ctx, members(ctx.designerMember()));
        String guid = ctx.GUID() != null ? ctx.GUID().getText() : null;
        return factory.statement(factory.range(ctx), members, StatementNode.Kind.PROPERTY_GROUP,
                ctx.groupName.getText(), guid).withRole("property");
    }

    private IrNode property(VisualBasic6Parser.DesignerPropertyContext ctx) {
        if (factory.isBroken(ctx)) {
            return factory.error(ctx);
        }
        return factory.statement(factory.range(ctx), List.of(), StatementNode.Kind.PROPERTY, propertyName(ctx),
                factory.text(ctx.propertyValue())).withRole("property");
    }

    private static String propertyName(VisualBasic6Parser.DesignerPropertyContext ctx) {
        String name = ctx.propertyName.getText();
        return ctx.propertyIndex != null ? name + "(" + ctx.propertyIndex.getText() + ")" : name;
    }

    // control array members carry an Index property
    private static Integer index(List<VisualBasic6Parser.DesignerMemberContext> members) {
        for (VisualBasic6Parser.DesignerMemberContext member : members) {
            VisualBasic6Parser.DesignerPropertyContext property = member.designerProperty();
            if (property == null || property.propertyIndex != null || property.propertyValue() == null
                    || !"Index".equalsIgnoreCase(property.propertyName.getText())) {
                continue;
            }
            try {
                return Integer.valueOf(property.propertyValue().getText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
