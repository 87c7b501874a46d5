package org.calista.kinda.loop;

import org.calista.kinda.personality.ConstructKind;
import org.calista.kinda.runtime.Primitives;

import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * kinda_repeat: one draw per invocation fixes the count; the iterations themselves are plain.
 */
public final class FuzzyRepeat {

    private final Primitives p;

    public FuzzyRepeat(Primitives primitives) {
        this.p = Objects.requireNonNull(primitives, "primitives");
    }

    /**
     * Gaussian around n with sigma n*v/2, clamped to the integers inside [n(1-v), n(1+v)], never negative.
     */
    public int count(int n) {
        if (n <= 0) return 0;
        double v = p.personality().varianceFor(ConstructKind.KINDA_REPEAT);
        if (v <= 0.0) return n;

        double lo = n * (1.0 - v);
        double hi = n * (1.0 + v);
        double draw = p.random().gaussian(n, n * v / 2.0);
        long rounded = Math.round(Math.max(lo, Math.min(hi, draw)));

        long min = (long) Math.ceil(lo);
        long max = (long) Math.floor(hi);
        if (rounded < min) rounded = min;
        if (rounded > max) rounded = max;
        if (rounded > Integer.MAX_VALUE) rounded = Integer.MAX_VALUE;
        return (int) Math.max(0L, rounded);
    }

    /**
     * @return iterations actually run
     */
    public int repeat(int n, IntConsumer body) {
        Objects.requireNonNull(body, "body");
        int count = count(n);
        for (int i = 0; i < count; i++) body.accept(i);
        return count;
    }
}
