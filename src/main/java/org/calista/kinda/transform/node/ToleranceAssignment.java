package org.calista.kinda.transform.node;

/**
 * {@code x ~ish t;}: x drifts toward t.
 */
public final class ToleranceAssignment extends ToleranceOperation {

    public final String name;

    public ToleranceAssignment(int line, int tilde, String name, int lhsStart, int lhsEnd, int rhsStart, int rhsEnd) {
        super(NodeKind.TOLERANCE_ASSIGNMENT, line, tilde, lhsStart, lhsEnd, rhsStart, rhsEnd, RoleCue.BARE_ASSIGNMENT);
        this.name = name;
    }

    @Override
    public ToleranceRole role() {
        return ToleranceRole.ASSIGNMENT;
    }
}
