package org.calista.kinda.transform.node;

/**
 * {@code x ~= e;}. The marker is the "~=" operator.
 */
public final class FuzzyReassignment extends FuzzyNode {

    public final String name;
    public final int identStart;
    public final int identEnd;
    public final int exprStart;
    public final int exprEnd;

    public FuzzyReassignment(int line, int tilde, String name, int identStart, int identEnd,
                             int exprStart, int exprEnd) {
        super(NodeKind.FUZZY_REASSIGNMENT, line, tilde, tilde + 2);
        this.name = name;
        this.identStart = identStart;
        this.identEnd = identEnd;
        this.exprStart = exprStart;
        this.exprEnd = exprEnd;
    }
}
