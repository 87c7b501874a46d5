package org.calista.kinda.personality;

/**
 * Lookup key for personality-resolved parameters.
 *
 * <p>Probability kinds resolve through {@link PersonalityResolver#probabilityFor(ConstructKind)},
 * variance kinds through {@link PersonalityResolver#varianceFor(ConstructKind)}. The scaling
 * decides how the chaos factor is applied on top of the profile value.</p>
 */
public enum ConstructKind {

    // conditional gates
    SOMETIMES(Category.PROBABILITY, Scaling.GATE),
    MAYBE(Category.PROBABILITY, Scaling.GATE),
    PROBABLY(Category.PROBABILITY, Scaling.GATE),
    RARELY(Category.PROBABILITY, Scaling.GATE),
    SORTA_PRINT(Category.PROBABILITY, Scaling.GATE),

    // loops
    SOMETIMES_WHILE(Category.PROBABILITY, Scaling.GATE),
    MAYBE_FOR(Category.PROBABILITY, Scaling.GATE),
    EVENTUALLY_UNTIL(Category.PROBABILITY, Scaling.CONFIDENCE),
    KINDA_REPEAT(Category.VARIANCE, Scaling.UNIT_VARIANCE),

    // values
    BOOL_UNCERTAINTY(Category.PROBABILITY, Scaling.HALF_CAPPED),
    BINARY_POSITIVE(Category.PROBABILITY, Scaling.GATE),
    BINARY_NEGATIVE(Category.PROBABILITY, Scaling.GATE),
    ISH_TOLERANCE(Category.VARIANCE, Scaling.VARIANCE),
    ISH_VARIANCE(Category.VARIANCE, Scaling.VARIANCE),
    INT_FUZZ(Category.VARIANCE, Scaling.VARIANCE),
    FLOAT_DRIFT(Category.VARIANCE, Scaling.VARIANCE),

    // time drift and welp
    TIME_DRIFT(Category.VARIANCE, Scaling.VARIANCE),
    ERROR_SNARK(Category.PROBABILITY, Scaling.FIXED);

    public enum Category { PROBABILITY, VARIANCE }

    public enum Scaling {
        /** Pulled toward 0.5 (c &gt; 1) or away from it (c &lt; 1). */
        GATE,
        /** Confidence threshold, kept in [0.5, 0.99]. */
        CONFIDENCE,
        /** Linear, kept in [0, 0.5]. */
        HALF_CAPPED,
        /** Linear, non-negative. */
        VARIANCE,
        /** Linear, kept in [0, 1]. */
        UNIT_VARIANCE,
        /** Profile value as is. */
        FIXED
    }

    private final Category category;
    private final Scaling scaling;

    ConstructKind(Category category, Scaling scaling) {
        this.category = category;
        this.scaling = scaling;
    }

    public Category category() {
        return category;
    }

    public Scaling scaling() {
        return scaling;
    }

    public boolean isProbability() {
        return category == Category.PROBABILITY;
    }
}
