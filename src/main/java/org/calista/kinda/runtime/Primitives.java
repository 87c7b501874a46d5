package org.calista.kinda.runtime;

import org.calista.kinda.events.ChaosReporter;
import org.calista.kinda.events.EventType;
import org.calista.kinda.personality.ConstructKind;
import org.calista.kinda.personality.PersonalityResolver;

import java.util.Objects;

/**
 * Primitive fuzzy operations. Composition patterns, loops and the facade are built from these.
 *
 * <p>Every draw goes through the shared {@link RandomSource}; every parameter comes from the
 * {@link PersonalityResolver} at call time, so scoped overrides take effect immediately.</p>
 */
public final class Primitives {

    private final PersonalityResolver personality;
    private final RandomSource random;
    private final ChaosReporter reporter;

    public Primitives(PersonalityResolver personality, RandomSource random, ChaosReporter reporter) {
        this.personality = Objects.requireNonNull(personality, "personality");
        this.random = Objects.requireNonNull(random, "random");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public PersonalityResolver personality() {
        return personality;
    }

    public RandomSource random() {
        return random;
    }

    public ChaosReporter reporter() {
        return reporter;
    }

    // ---------------------------------------------------------------------
    // Gates
    // ---------------------------------------------------------------------

    /**
     * True when the condition holds and a draw succeeds against the tier's probability.
     * A false condition never consumes a draw.
     */
    public boolean gate(ConstructKind tier, boolean condition) {
        if (!condition) return false;
        return random.chance(personality.probabilityFor(tier));
    }

    public boolean sometimes(boolean condition) {
        return gate(ConstructKind.SOMETIMES, condition);
    }

    public boolean maybe(boolean condition) {
        return gate(ConstructKind.MAYBE, condition);
    }

    public boolean probably(boolean condition) {
        return gate(ConstructKind.PROBABLY, condition);
    }

    public boolean rarely(boolean condition) {
        return gate(ConstructKind.RARELY, condition);
    }

    // ---------------------------------------------------------------------
    // Values
    // ---------------------------------------------------------------------

    /** v + uniform(-drift, drift). */
    public double kindaFloat(double v) {
        double drift = personality.varianceFor(ConstructKind.FLOAT_DRIFT);
        return v + random.uniform(-drift, drift);
    }

    /** (int) v + randInt(-fuzz, fuzz). */
    public int kindaInt(double v) {
        int fuzz = (int) Math.floor(personality.varianceFor(ConstructKind.INT_FUZZ));
        return (int) v + random.randInt(-fuzz, fuzz);
    }

    /** v + randInt(-fuzz, fuzz), without narrowing to int. */
    public long kindaLong(long v) {
        int fuzz = (int) Math.floor(personality.varianceFor(ConstructKind.INT_FUZZ));
        return v + random.randInt(-fuzz, fuzz);
    }

    /** Flips the value with the bool-uncertainty probability. */
    public boolean kindaBool(boolean v) {
        return random.chance(personality.probabilityFor(ConstructKind.BOOL_UNCERTAINTY)) != v;
    }

    /** 1, -1 or 0. */
    public int kindaBinary() {
        double[] p = personality.binaryProbabilities();
        double r = random.nextDouble();
        if (r < p[0]) return 1;
        if (r < p[0] + p[1]) return -1;
        return 0;
    }

    /** uniform(-magnitude, magnitude). */
    public double noise(double magnitude) {
        double m = Math.abs(magnitude);
        return random.uniform(-m, m);
    }

    public double ishVariance() {
        return personality.varianceFor(ConstructKind.ISH_VARIANCE);
    }

    public double ishTolerance() {
        return personality.varianceFor(ConstructKind.ISH_TOLERANCE);
    }

    public double ishValue(double v) {
        return v + noise(ishVariance());
    }

    public int ishValue(int v) {
        return Numbers.toInt(v + noise(ishVariance()));
    }

    public long ishValue(long v) {
        return Math.round(v + noise(ishVariance()));
    }

    // ---------------------------------------------------------------------
    // Soft failures
    // ---------------------------------------------------------------------

    public void conversionFailed(String construct, Object value, RuntimeException cause) {
        reporter.report(EventType.CONVERSION_FAILURE, construct,
                "cannot use " + describe(value) + ": " + cause.getMessage());
    }

    static String describe(Object value) {
        if (value == null) return "null";
        if (value instanceof CharSequence s) return "'" + s + "'";
        return value.getClass().getSimpleName() + "(" + value + ")";
    }
}
