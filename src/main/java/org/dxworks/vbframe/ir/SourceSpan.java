package org.dxworks.vbframe.ir;

import java.util.Objects;

/**
 * Immutable source region. Lines and columns are 1-based; the end position is exclusive.
 * Offsets are byte offsets into the raw file (after any byte-order mark).
 */
public final class SourceSpan implements Comparable<SourceSpan> {

    public static final SourceSpan EMPTY = new SourceSpan(1, 1, 1, 1, 0, 0);

    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;
    private final int startOffset;
    private final int endOffset;

    public SourceSpan(int startLine, int startColumn, int endLine, int endColumn, int startOffset, int endOffset) {
        if (endOffset < startOffset) {
            throw new IllegalArgumentException("Span ends before it starts: " + startOffset + ".." + endOffset);
        }
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public boolean isEmpty() {
        return startOffset == endOffset;
    }

    public boolean contains(SourceSpan other) {
        return startOffset <= other.startOffset && other.endOffset <= endOffset;
    }

    /**
     * Closed-interval overlap test, so a zero-width span sitting on either boundary still counts.
     */
    public boolean intersects(SourceSpan other) {
        return startOffset <= other.endOffset && other.startOffset <= endOffset;
    }

    /**
     * True when this span ends at or before the start of {@code other}.
     */
    public boolean precedes(SourceSpan other) {
        return endOffset <= other.startOffset;
    }

    /**
     * Smallest span covering both this span and {@code other}.
     */
    public SourceSpan union(SourceSpan other) {
        SourceSpan first = startOffset <= other.startOffset ? this : other;
        SourceSpan last = endOffset >= other.endOffset ? this : other;
        return new SourceSpan(first.startLine, first.startColumn, last.endLine, last.endColumn,
                first.startOffset, last.endOffset);
    }

    @Override
    public int compareTo(SourceSpan o) {
        int c = Integer.compare(startOffset, o.startOffset);
        if (c != 0) {
            return c;
        }
        return Integer.compare(endOffset, o.endOffset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan that = (SourceSpan) o;
        return startLine == that.startLine
                && startColumn == that.startColumn
                && endLine == that.endLine
                && endColumn == that.endColumn
                && startOffset == that.startOffset
                && endOffset == that.endOffset;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, startColumn, endLine, endColumn, startOffset, endOffset);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
