package org.calista.kinda.transform.node;

public final class SortaPrint extends FuzzyNode {

    public final int openParen;
    public final int closeParen;

    public SortaPrint(int line, int markerStart, int markerEnd, int openParen, int closeParen) {
        super(NodeKind.SORTA_PRINT, line, markerStart, markerEnd);
        this.openParen = openParen;
        this.closeParen = closeParen;
    }
}
