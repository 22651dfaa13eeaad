package org.dxworks.vbframe.ir;

import java.util.List;

/**
 * A {@code Begin <Type> <Name> ... End} block of a form's designer section. Children are the
 * control's properties, property groups and nested controls in declaration order.
 */
public final class ControlElementNode extends IrNode {

    private final String controlType;
    private final String name;
    private final Integer index;

    public ControlElementNode(String id, SourceSpan span, String text, List<? extends IrNode> children,
                              String controlType, String name, Integer index) {
        super(id, span, text, children);
        this.controlType = controlType;
        this.name = name;
        this.index = index;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONTROL_ELEMENT;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitControlElement(this);
    }

    /**
     * Qualified type as written, e.g. {@code VB.CommandButton} or {@code MSComctlLib.ListView}.
     */
    public String getControlType() {
        return controlType;
    }

    public String getName() {
        return name;
    }

    /**
     * Control array index from the {@code Index} property, or null for a plain control.
     */
    public Integer getIndex() {
        return index;
    }
}
