package org.dxworks.vbframe.ir;

/**
 * Candidate event handler binding derived from a {@code <Source>_<Event>} procedure name. The span is the
 * procedure name. Resolution against controls and {@code WithEvents} variables happens during enrichment
 * and is stored as ids in {@link SemanticInfo}.
 */
public final class EventBindingNode extends IrNode {

    private final String procedureId;
    private final String sourceName;
    private final String eventName;

    public EventBindingNode(String id, SourceSpan span, String text, String procedureId,
                            String sourceName, String eventName) {
        super(id, span, text, null);
        this.procedureId = procedureId;
        this.sourceName = sourceName;
        this.eventName = eventName;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EVENT_BINDING;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitEventBinding(this);
    }

    public String getProcedureId() {
        return procedureId;
    }

    /**
     * Control, variable, {@code Form} or {@code Class} part of the handler name.
     */
    public String getSourceName() {
        return sourceName;
    }

    public String getEventName() {
        return eventName;
    }
}
