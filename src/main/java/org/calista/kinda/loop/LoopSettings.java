package org.calista.kinda.loop;

/**
 * Safety caps and statistics knobs for the loop runtime. Data only, validated on construction.
 */
public final class LoopSettings {

    /** Hard cap on sometimes_while condition evaluations. */
    public final int sometimesWhileMaxCycles;

    /** eventually_until window size (most recent outcomes kept). */
    public final int bufferSize;

    /** eventually_until samples needed before the bound is consulted. */
    public final int minSamples;

    /** eventually_until hard cap; reaching it ends the loop with a timeout event. */
    public final int maxEvaluations;

    /** One-sided z for the Wilson lower bound (1.645 ~ 95%). */
    public final double confidenceZ;

    public LoopSettings(int sometimesWhileMaxCycles, int bufferSize, int minSamples, int maxEvaluations, double confidenceZ) {
        if (sometimesWhileMaxCycles < 1) throw new IllegalArgumentException("sometimesWhileMaxCycles must be >= 1");
        if (bufferSize < 1) throw new IllegalArgumentException("bufferSize must be >= 1");
        if (minSamples < 1 || minSamples > bufferSize) {
            throw new IllegalArgumentException("minSamples must be in [1, bufferSize], got " + minSamples);
        }
        if (maxEvaluations < minSamples) throw new IllegalArgumentException("maxEvaluations must be >= minSamples");
        if (!(confidenceZ > 0.0) || Double.isInfinite(confidenceZ)) {
            throw new IllegalArgumentException("confidenceZ must be a positive number, got " + confidenceZ);
        }
        this.sometimesWhileMaxCycles = sometimesWhileMaxCycles;
        this.bufferSize = bufferSize;
        this.minSamples = minSamples;
        this.maxEvaluations = maxEvaluations;
        this.confidenceZ = confidenceZ;
    }

    public static LoopSettings defaults() {
        return new LoopSettings(10_000, 100, 5, 1_000, 1.645);
    }

    @Override
    public String toString() {
        return "LoopSettings{maxCycles=" + sometimesWhileMaxCycles + ", buffer=" + bufferSize
                + ", minSamples=" + minSamples + ", maxEvaluations=" + maxEvaluations + ", z=" + confidenceZ + "}";
    }
}
