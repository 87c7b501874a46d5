package org.calista.kinda.transform.node;

public final class ToleranceComparison extends ToleranceOperation {

    public ToleranceComparison(int line, int tilde, int lhsStart, int lhsEnd, int rhsStart, int rhsEnd, RoleCue cue) {
        super(NodeKind.TOLERANCE_COMPARISON, line, tilde, lhsStart, lhsEnd, rhsStart, rhsEnd, cue);
    }

    @Override
    public ToleranceRole role() {
        return ToleranceRole.COMPARISON;
    }
}
