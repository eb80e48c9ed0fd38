package org.dxworks.texframe.ast;

import java.util.Objects;

/**
 * Source span of one token folded into a merged text node. Columns are 1-based,
 * the end column is exclusive.
 */
public final class SourceRange {

    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    public SourceRange(int startLine, int startColumn, int endLine, int endColumn) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
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

    public int length() {
        return endColumn - startColumn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceRange)) return false;
        SourceRange that = (SourceRange) o;
        return startLine == that.startLine && startColumn == that.startColumn
                && endLine == that.endLine && endColumn == that.endColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, startColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        return "(" + startLine + ", " + startColumn + ", " + endLine + ", " + endColumn + ")";
    }
}
