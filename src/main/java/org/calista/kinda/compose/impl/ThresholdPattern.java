package org.calista.kinda.compose.impl;

import org.calista.kinda.compose.CompositionPattern;
import org.calista.kinda.compose.CompositionResult;
import org.calista.kinda.compose.PatternMode;
import org.calista.kinda.personality.ConstructKind;
import org.calista.kinda.runtime.Primitives;

import java.util.List;
import java.util.Objects;

/**
 * Consensus: every member gate is drawn once; true when the share that fired reaches the threshold.
 */
public final class ThresholdPattern extends CompositionPattern {

    private final List<ConstructKind> gates;
    private final double threshold;

    public ThresholdPattern(String name, List<ConstructKind> gates, double threshold) {
        super(name, PatternMode.GATE);
        this.gates = List.copyOf(Objects.requireNonNull(gates, "gates"));
        if (this.gates.isEmpty()) throw new IllegalArgumentException("threshold pattern needs at least one gate");
        if (!(threshold > 0.0 && threshold <= 1.0)) throw new IllegalArgumentException("threshold must be in (0,1]: " + threshold);
        this.threshold = threshold;
    }

    public static ThresholdPattern consensus(String name) {
        return new ThresholdPattern(name,
                List.of(ConstructKind.SOMETIMES, ConstructKind.MAYBE, ConstructKind.PROBABLY), 0.5);
    }

    @Override
    public CompositionResult<Boolean> evaluate(Primitives p, boolean condition) {
        return guard(() -> {
            if (!condition) return false;
            int fired = 0;
            for (ConstructKind k : gates) {
                if (p.gate(k, true)) fired++;
            }
            return (double) fired / gates.size() >= threshold;
        });
    }

    public double threshold() {
        return threshold;
    }
}
