package org.calista.kinda.transform.node;

/**
 * {@code x~drift}: a read of a drifting variable.
 */
public final class DriftAccess extends FuzzyNode {

    public final String name;
    public final int nameStart;

    public DriftAccess(int line, int tilde, int nameStart, String name) {
        super(NodeKind.DRIFT_ACCESS, line, tilde, tilde + 6);
        if (nameStart >= tilde) throw new IllegalArgumentException("variable must precede '~drift'");
        this.nameStart = nameStart;
        this.name = name;
    }
}
