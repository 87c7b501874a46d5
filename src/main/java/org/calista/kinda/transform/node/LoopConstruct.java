package org.calista.kinda.transform.node;

/**
 * One of the four loop headers.
 *
 * <p>The header rewrite replaces {@code [markerStart, prefixEnd)} and, when {@link #suffixStart} is
 * non-negative, {@code [suffixStart, suffixEnd)}. {@code maybe_for} carries its block in {@link #perItem}.</p>
 */
public final class LoopConstruct extends FuzzyNode {

    public final LoopKind loopKind;
    public final int prefixEnd;
    public final int suffixStart;
    public final int suffixEnd;
    /** Condition, count or iteration header text, without outer parentheses. */
    public final int condStart;
    public final int condEnd;
    /** Null unless {@link LoopKind#MAYBE_FOR}. */
    public final PerItem perItem;

    public LoopConstruct(int line, int markerStart, int markerEnd, LoopKind loopKind,
                         int prefixEnd, int suffixStart, int suffixEnd,
                         int condStart, int condEnd, PerItem perItem) {
        super(NodeKind.LOOP_CONSTRUCT, line, markerStart, markerEnd);
        if ((loopKind == LoopKind.MAYBE_FOR) != (perItem != null)) {
            throw new IllegalArgumentException("perItem is required for maybe_for only");
        }
        this.loopKind = loopKind;
        this.prefixEnd = prefixEnd;
        this.suffixStart = suffixStart;
        this.suffixEnd = suffixEnd;
        this.condStart = condStart;
        this.condEnd = condEnd;
        this.perItem = perItem;
    }

    /** Block layout of a {@code maybe_for}. */
    public static final class PerItem {
        /** {@code x in xs} instead of {@code (T x : xs)}. */
        public final boolean inForm;
        public final int varStart;
        public final int varEnd;
        public final int iterStart;
        public final int iterEnd;
        public final int braceCol;
        public final int closeLine;
        public final int closeCol;

        public PerItem(boolean inForm, int varStart, int varEnd, int iterStart, int iterEnd,
                       int braceCol, int closeLine, int closeCol) {
            this.inForm = inForm;
            this.varStart = varStart;
            this.varEnd = varEnd;
            this.iterStart = iterStart;
            this.iterEnd = iterEnd;
            this.braceCol = braceCol;
            this.closeLine = closeLine;
            this.closeCol = closeCol;
        }
    }
}
