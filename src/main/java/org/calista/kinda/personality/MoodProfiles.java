package org.calista.kinda.personality;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import static org.calista.kinda.personality.ConstructKind.*;

/**
 * Mood -&gt; profile table. {@link #defaults()} carries the stock personalities;
 * {@link #with(MoodProfile)} returns a copy with one profile replaced.
 */
public final class MoodProfiles {

    private static final MoodProfiles DEFAULTS = new MoodProfiles(buildDefaults());

    private final EnumMap<Mood, MoodProfile> table;

    private MoodProfiles(EnumMap<Mood, MoodProfile> table) {
        for (Mood m : Mood.values()) {
            if (!table.containsKey(m)) throw new IllegalStateException("missing profile for " + m);
        }
        this.table = table;
    }

    public static MoodProfiles defaults() {
        return DEFAULTS;
    }

    public MoodProfile get(Mood mood) {
        return table.get(Objects.requireNonNull(mood, "mood"));
    }

    public MoodProfiles with(MoodProfile profile) {
        Objects.requireNonNull(profile, "profile");
        EnumMap<Mood, MoodProfile> copy = new EnumMap<>(table);
        copy.put(profile.mood(), profile);
        return new MoodProfiles(copy);
    }

    private static EnumMap<Mood, MoodProfile> buildDefaults() {
        EnumMap<Mood, MoodProfile> m = new EnumMap<>(Mood.class);
        //                 some  maybe prob  rare  sorta swhl  mfor  rep   until iFuzz fDrft ishV  ishT  bool  b+   b-   drift snark amp
        put(m, Mood.RELIABLE,     .95, .95, .95, .85, .95, .90, .95, .10, .95, 0, 0.0, 0.5, 1.0, .02, .8, .1, .00, .1, 0.2);
        put(m, Mood.PROFESSIONAL, .85, .80, .90, .10, .90, .80, .85, .15, .85, 1, 0.1, 1.0, 1.5, .05, .6, .2, .01, .2, 0.5);
        put(m, Mood.CAUTIOUS,     .70, .75, .80, .25, .85, .75, .85, .20, .90, 1, 0.2, 1.5, 1.5, .05, .5, .3, .01, .3, 0.6);
        put(m, Mood.FRIENDLY,     .75, .70, .80, .20, .85, .70, .80, .25, .75, 1, 0.3, 1.5, 2.0, .08, .5, .3, .03, .4, 0.8);
        put(m, Mood.PLAYFUL,      .50, .60, .70, .15, .80, .60, .70, .30, .80, 2, 0.5, 2.5, 2.0, .10, .4, .4, .05, .6, 1.0);
        put(m, Mood.SNARKY,       .60, .65, .75, .10, .70, .65, .70, .35, .75, 2, 0.8, 3.0, 3.0, .15, .3, .5, .07, .7, 1.2);
        put(m, Mood.CHAOTIC,      .30, .40, .50, .05, .60, .40, .50, .40, .70, 5, 2.0, 5.0, 4.0, .25, .2, .6, .10, .9, 1.8);
        return m;
    }

    private static void put(Map<Mood, MoodProfile> m, Mood mood,
                            double sometimes, double maybe, double probably, double rarely, double sorta,
                            double sometimesWhile, double maybeFor, double repeatVariance, double untilConfidence,
                            int intFuzz, double floatDrift, double ishVariance, double ishTolerance,
                            double boolUncertainty, double binaryPositive, double binaryNegative,
                            double timeDrift, double errorSnark, double amplifier) {
        m.put(mood, MoodProfile.builder(mood)
                .set(SOMETIMES, sometimes)
                .set(MAYBE, maybe)
                .set(PROBABLY, probably)
                .set(RARELY, rarely)
                .set(SORTA_PRINT, sorta)
                .set(SOMETIMES_WHILE, sometimesWhile)
                .set(MAYBE_FOR, maybeFor)
                .set(KINDA_REPEAT, repeatVariance)
                .set(EVENTUALLY_UNTIL, untilConfidence)
                .set(INT_FUZZ, intFuzz)
                .set(FLOAT_DRIFT, floatDrift)
                .set(ISH_VARIANCE, ishVariance)
                .set(ISH_TOLERANCE, ishTolerance)
                .set(BOOL_UNCERTAINTY, boolUncertainty)
                .set(BINARY_POSITIVE, binaryPositive)
                .set(BINARY_NEGATIVE, binaryNegative)
                .set(TIME_DRIFT, timeDrift)
                .set(ERROR_SNARK, errorSnark)
                .chaosAmplifier(amplifier)
                .build());
    }
}
