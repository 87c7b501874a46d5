package org.calista.kinda.transform.node;

/**
 * {@code 42~ish}: a value nudged by personality variance.
 */
public final class ToleranceValue extends FuzzyNode {

    public final int primaryStart;

    public ToleranceValue(int line, int tilde, int primaryStart) {
        super(NodeKind.TOLERANCE_VALUE, line, tilde, tilde + 4);
        if (primaryStart >= tilde) throw new IllegalArgumentException("primary must precede '~ish'");
        this.primaryStart = primaryStart;
    }
}
