package org.calista.kinda.transform.node;

/**
 * {@code ~sometimes (c)} and the other three tiers; the condition parentheses are optional
 * when the block starts right after the keyword.
 */
public final class ConditionalGate extends FuzzyNode {

    /** sometimes, maybe, probably or rarely. */
    public final String gate;
    /** -1 when written without parentheses. */
    public final int openParen;
    public final int closeParen;
    public final boolean afterElse;

    public ConditionalGate(int line, int markerStart, int markerEnd, String gate,
                           int openParen, int closeParen, boolean afterElse) {
        super(NodeKind.CONDITIONAL_GATE, line, markerStart, markerEnd);
        this.gate = gate;
        this.openParen = openParen;
        this.closeParen = closeParen;
        this.afterElse = afterElse;
    }

    public boolean hasCondition() {
        return openParen >= 0 && closeParen > openParen + 1;
    }

    public boolean parenthesised() {
        return openParen >= 0;
    }
}
