package org.calista.kinda.transform.node;

/**
 * Binary {@code a ~ish b}; subclasses fix the role.
 */
public abstract class ToleranceOperation extends FuzzyNode {

    public final int lhsStart;
    public final int lhsEnd;
    public final int rhsStart;
    public final int rhsEnd;
    public final RoleCue cue;

    protected ToleranceOperation(NodeKind kind, int line, int tilde,
                                 int lhsStart, int lhsEnd, int rhsStart, int rhsEnd, RoleCue cue) {
        super(kind, line, tilde, tilde + 4);
        if (lhsStart >= lhsEnd || rhsStart >= rhsEnd || lhsEnd > tilde || rhsStart < tilde + 4) {
            throw new IllegalArgumentException("bad operand spans");
        }
        this.lhsStart = lhsStart;
        this.lhsEnd = lhsEnd;
        this.rhsStart = rhsStart;
        this.rhsEnd = rhsEnd;
        this.cue = cue;
    }

    public abstract ToleranceRole role();
}
