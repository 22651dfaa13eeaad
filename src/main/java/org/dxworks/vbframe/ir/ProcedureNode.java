package org.dxworks.vbframe.ir;

import java.util.List;

/**
 * Sub, Function or Property procedure. Children: an optional event binding candidate (the name),
 * parameters ({@code role = "parameter"}) and body statements ({@code role = "body"}).
 */
public final class ProcedureNode extends IrNode {

    public enum Kind {
        SUB("sub"),
        FUNCTION("function"),
        PROPERTY_GET("propertyGet"),
        PROPERTY_LET("propertyLet"),
        PROPERTY_SET("propertySet");

        private final String name;

        Kind(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    private final Kind procedureKind;
    private final String name;
    private final String visibility;
    private final List<String> modifiers;
    private final String returnType;

    public ProcedureNode(String id, SourceSpan span, String text, List<? extends IrNode> children,
                         Kind procedureKind, String name, String visibility, List<String> modifiers,
                         String returnType) {
        super(id, span, text, children);
        this.procedureKind = procedureKind;
        this.name = name;
        this.visibility = visibility;
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        this.returnType = returnType;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PROCEDURE;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitProcedure(this);
    }

    public Kind getProcedureKind() {
        return procedureKind;
    }

    public String getName() {
        return name;
    }

    public String getVisibility() {
        return visibility;
    }

    public List<String> getModifiers() {
        return modifiers;
    }

    public String getReturnType() {
        return returnType;
    }
}
