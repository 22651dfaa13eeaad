package org.dxworks.vbframe.ir;

/**
 * Discriminator of the IR node variants, written first in every serialized node.
 */
public enum NodeKind {
    MODULE("Module"),
    DECLARATION("Declaration"),
    PROCEDURE("Procedure"),
    STATEMENT("Statement"),
    EXPRESSION("Expression"),
    CONTROL_ELEMENT("ControlElement"),
    EVENT_BINDING("EventBinding"),
    TRIVIA("Trivia"),
    ERROR("Error");

    private final String name;

    NodeKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
