package org.calista.kinda.transform.node;

import org.calista.kinda.transform.SourcePosition;

/**
 * A classified fuzzy marker. Columns are 0-based offsets into the original line;
 * {@link #line} is the 0-based line index.
 */
public abstract class FuzzyNode {

    public final NodeKind kind;
    public final int line;
    /** Column of the '~'. */
    public final int markerStart;
    /** Column just after the marker keyword (or after "~=" for reassignments). */
    public final int markerEnd;

    protected FuzzyNode(NodeKind kind, int line, int markerStart, int markerEnd) {
        if (line < 0 || markerStart < 0 || markerEnd <= markerStart) {
            throw new IllegalArgumentException("bad marker span " + line + ":" + markerStart + ".." + markerEnd);
        }
        this.kind = kind;
        this.line = line;
        this.markerStart = markerStart;
        this.markerEnd = markerEnd;
    }

    /** True when the '~' at this column belongs to this node. */
    public boolean covers(int column) {
        return column == markerStart;
    }

    public SourcePosition position(String file) {
        return new SourcePosition(file, line + 1, markerStart + 1);
    }

    @Override
    public String toString() {
        return kind + "@" + (line + 1) + ":" + (markerStart + 1);
    }
}
