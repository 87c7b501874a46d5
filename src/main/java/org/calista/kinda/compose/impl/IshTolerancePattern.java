package org.calista.kinda.compose.impl;

import org.calista.kinda.compose.CompositionPattern;
import org.calista.kinda.compose.CompositionResult;
import org.calista.kinda.compose.FailureReason;
import org.calista.kinda.compose.PatternMode;
import org.calista.kinda.runtime.Numbers;
import org.calista.kinda.runtime.Primitives;

/**
 * Tolerance ("ish") built from kindaFloat, probably and sometimes.
 *
 * <p>Comparison: drift the tolerance, drift the distance, compare, then gate through
 * {@code probably}. Assignment: without a target add variance noise; with a target,
 * when {@code sometimes} fires, move a fuzzy half-step toward it, else add noise.</p>
 */
public final class IshTolerancePattern extends CompositionPattern {

    public IshTolerancePattern(String name, PatternMode mode) {
        super(name, mode);
        if (mode == PatternMode.GATE) {
            throw new IllegalArgumentException("ish pattern supports comparison and assignment modes only");
        }
    }

    @Override
    public CompositionResult<Boolean> compare(Primitives p, Object left, Object right, Double tolerance) {
        if (mode() != PatternMode.COMPARISON) return unsupported(PatternMode.COMPARISON);
        return guard(() -> {
            double l;
            double r;
            try {
                l = Numbers.toDouble(left);
                r = Numbers.toDouble(right);
            } catch (IllegalArgumentException e) {
                p.conversionFailed(name(), left + " ~ish " + right, e);
                return p.probably(false);
            }
            double tol = tolerance != null ? Math.abs(tolerance) : p.ishTolerance();
            double fuzzyTol = p.kindaFloat(tol);
            double fuzzyDiff = p.kindaFloat(Math.abs(l - r));
            return p.probably(fuzzyDiff <= fuzzyTol);
        });
    }

    @Override
    public CompositionResult<Number> assign(Primitives p, Object current, Object target) {
        if (mode() != PatternMode.ASSIGNMENT) return unsupported(PatternMode.ASSIGNMENT);
        double cur;
        Double tgt;
        try {
            cur = Numbers.toDouble(current);
            tgt = target == null ? null : Numbers.toDouble(target);
        } catch (IllegalArgumentException e) {
            return CompositionResult.failure(FailureReason.CONVERSION, e.toString(), e);
        }
        return guard(() -> {
            boolean integral = Numbers.isIntegral(current) && (target == null || Numbers.isIntegral(target));

            double out;
            if (tgt != null && p.sometimes(true)) {
                out = cur + p.kindaFloat(tgt - cur) * p.kindaFloat(0.5);
            } else {
                out = cur + p.noise(p.ishVariance());
            }
            return integral ? (Number) Numbers.toInt(out) : (Number) out;
        });
    }
}
