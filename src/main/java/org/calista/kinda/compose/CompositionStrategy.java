package org.calista.kinda.compose;

/**
 * How several gates combine into one verdict. See {@link CompositionEngine#combine}.
 */
public enum CompositionStrategy {
    /** Any gate true. Evaluates every gate. */
    UNION,
    /** All gates true. Evaluates every gate. */
    INTERSECTION,
    /** Gates in order, stopping at the first false; result of the last evaluated gate. */
    SEQUENTIAL,
    /** Weighted share of true gates above 0.5. */
    WEIGHTED,
    /** First gate picks the second (true) or the third (false). */
    CONDITIONAL
}
