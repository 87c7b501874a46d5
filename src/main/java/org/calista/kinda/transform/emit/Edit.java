package org.calista.kinda.transform.emit;

/**
 * Replace {@code [start, end)} of one original line with {@link #text}. {@code start == end} is an insert.
 */
public final class Edit {

    public final int line;
    public final int start;
    public final int end;
    public final String text;
    /** Creation order; inserts at one position render in this order. */
    final long seq;

    Edit(int line, int start, int end, String text, long seq) {
        if (start < 0 || end < start) throw new IllegalArgumentException("bad edit span " + start + ".." + end);
        this.line = line;
        this.start = start;
        this.end = end;
        this.text = text;
        this.seq = seq;
    }

    public boolean isInsert() {
        return start == end;
    }

    boolean overlaps(Edit o) {
        if (isInsert() && o.isInsert()) return false;
        if (isInsert()) return o.start < start && start < o.end;
        if (o.isInsert()) return start < o.start && o.start < end;
        return start < o.end && o.start < end;
    }

    @Override
    public String toString() {
        return "Edit{" + (line + 1) + ":" + start + ".." + end + " -> '" + text + "'}";
    }
}
