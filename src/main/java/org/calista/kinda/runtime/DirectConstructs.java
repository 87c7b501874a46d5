package org.calista.kinda.runtime;

import org.calista.kinda.personality.ConstructKind;

import java.util.Objects;

/**
 * Direct (non-composed) implementations. The composition engine falls back to these,
 * and they are what runs when composition is disabled.
 *
 * <p>The tolerance comparison draws the same quantities in the same order as the composed
 * tolerance pattern, so both paths share one outcome distribution.</p>
 */
public final class DirectConstructs {

    private final Primitives p;

    public DirectConstructs(Primitives primitives) {
        this.p = Objects.requireNonNull(primitives, "primitives");
    }

    /**
     * {@code |left - right| <= tolerance}, with both sides drifted and the answer passed
     * through the {@code probably} gate. Unreadable operands give {@code false}.
     *
     * @param tolerance explicit tolerance or null for the personality's ish tolerance
     */
    public boolean ishComparison(Object left, Object right, Double tolerance) {
        double l;
        double r;
        try {
            l = Numbers.toDouble(left);
            r = Numbers.toDouble(right);
        } catch (IllegalArgumentException e) {
            p.conversionFailed("ish", left + " ~ish " + right, e);
            return false;
        }
        double tol = tolerance != null ? Math.abs(tolerance) : p.ishTolerance();
        double fuzzyTol = p.kindaFloat(tol);
        double fuzzyDiff = p.kindaFloat(Math.abs(l - r));
        return p.probably(fuzzyDiff <= fuzzyTol);
    }

    /**
     * Noisy value, drifting toward {@code target} when one is given.
     * Stays integral when both inputs are integral.
     */
    public Number ishAssign(Object current, Object target) {
        double cur;
        try {
            cur = Numbers.toDouble(current);
        } catch (IllegalArgumentException e) {
            p.conversionFailed("ish", current, e);
            return current instanceof Number n ? n : 0;
        }
        boolean integral = Numbers.isIntegral(current) && (target == null || Numbers.isIntegral(target));

        double out;
        if (target == null) {
            out = cur + p.noise(p.ishVariance());
        } else {
            double tgt;
            try {
                tgt = Numbers.toDouble(target);
            } catch (IllegalArgumentException e) {
                p.conversionFailed("ish", target, e);
                tgt = cur;
            }
            out = cur + (tgt - cur) * 0.5 + p.noise(p.ishVariance() * 0.5);
        }
        return integral ? (Number) Numbers.toInt(out) : (Number) out;
    }

    /** Plain personality draw for sorta print. */
    public boolean sortaFires() {
        return p.random().chance(p.personality().probabilityFor(ConstructKind.SORTA_PRINT));
    }
}
