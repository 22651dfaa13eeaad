package org.dxworks.vbframe.ir;

/**
 * Recovery node for source the parser could not derive. It keeps the raw text and span and the name of
 * the construct that was being parsed; it never guesses the intended structure. Every error node is
 * paired with at least one diagnostic intersecting its span.
 */
public final class ErrorNode extends IrNode {

    private final String construct;

    public ErrorNode(String id, SourceSpan span, String text, String construct) {
        super(id, span, text, null);
        this.construct = construct;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ERROR;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitError(this);
    }

    /**
     * Grammar construct under recovery, e.g. {@code typeStmt}, or {@code unexpectedTokens}.
     */
    public String getConstruct() {
        return construct;
    }
}
