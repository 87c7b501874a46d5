package org.calista.kinda.personality;

/**
 * Register of the messages printed when a construct recovers from a failure.
 */
public enum ErrorStyle {
    PROFESSIONAL,
    FRIENDLY,
    SNARKY,
    CHAOTIC;

    /** Below 0.3 professional, below 0.6 friendly, below 0.8 snarky, else chaotic. */
    public static ErrorStyle forSnark(double snark) {
        if (snark < 0.3) return PROFESSIONAL;
        if (snark < 0.6) return FRIENDLY;
        if (snark < 0.8) return SNARKY;
        return CHAOTIC;
    }
}
