package org.calista.kinda.compose;

import java.util.Locale;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-pattern counters.
 */
public final class PatternStats {
    private final LongAdder executions = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder fallbacks = new LongAdder();
    private final LongAdder nanos = new LongAdder();

    void executed(long elapsedNanos) {
        executions.increment();
        nanos.add(elapsedNanos);
    }

    void failed() {
        failures.increment();
    }

    void fellBack() {
        fallbacks.increment();
    }

    public long executions() {
        return executions.sum();
    }

    public long failures() {
        return failures.sum();
    }

    public long fallbacks() {
        return fallbacks.sum();
    }

    public double averageNanos() {
        long n = executions.sum();
        return n == 0 ? 0.0 : (double) nanos.sum() / n;
    }

    @Override
    public String toString() {
        return "PatternStats{executions=" + executions() + ", failures=" + failures()
                + ", fallbacks=" + fallbacks() + ", avgNs=" + String.format(Locale.ROOT, "%.1f", averageNanos()) + "}";
    }
}
