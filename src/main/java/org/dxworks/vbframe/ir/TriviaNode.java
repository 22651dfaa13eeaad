package org.dxworks.vbframe.ir;

/**
 * Comment or run of blank lines. Trivia hangs off structural nodes as leading or trailing trivia and is
 * never part of a node's children.
 */
public final class TriviaNode extends IrNode {

    public enum Kind {
        COMMENT("comment"),
        BLANK_LINES("blankLines");

        private final String name;

        Kind(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    private final Kind triviaKind;
    private final int lineCount;

    public TriviaNode(String id, SourceSpan span, String text, Kind triviaKind, int lineCount) {
        super(id, span, text, null);
        this.triviaKind = triviaKind;
        this.lineCount = lineCount;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRIVIA;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitTrivia(this);
    }

    public Kind getTriviaKind() {
        return triviaKind;
    }

    public int getLineCount() {
        return lineCount;
    }
}
