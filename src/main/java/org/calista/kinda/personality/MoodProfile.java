package org.calista.kinda.personality;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable table of base values for one mood: one entry per {@link ConstructKind}
 * plus the chaos amplifier the mood applies on top of the chaos level.
 */
public final class MoodProfile {

    private final Mood mood;
    private final EnumMap<ConstructKind, Double> base;
    private final double chaosAmplifier;

    private MoodProfile(Builder b) {
        this.mood = Objects.requireNonNull(b.mood, "mood");
        this.base = new EnumMap<>(b.values);
        this.chaosAmplifier = b.chaosAmplifier;

        for (ConstructKind kind : ConstructKind.values()) {
            Double v = base.get(kind);
            if (v == null) {
                throw new InvalidConfigurationException("profile " + mood.id() + " has no value for " + kind);
            }
            checkValue(mood, kind, v);
        }
        if (!(chaosAmplifier > 0.0) || Double.isInfinite(chaosAmplifier)) {
            throw new InvalidConfigurationException("profile " + mood.id() + " has invalid chaos amplifier " + chaosAmplifier);
        }
    }

    public Mood mood() {
        return mood;
    }

    public double base(ConstructKind kind) {
        return base.get(Objects.requireNonNull(kind, "kind"));
    }

    public double chaosAmplifier() {
        return chaosAmplifier;
    }

    public Map<ConstructKind, Double> values() {
        return Collections.unmodifiableMap(base);
    }

    public Builder toBuilder() {
        Builder b = new Builder(mood);
        b.values.putAll(base);
        b.chaosAmplifier = chaosAmplifier;
        return b;
    }

    static void checkValue(Mood mood, ConstructKind kind, double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new InvalidConfigurationException(where(mood) + kind + " is not finite: " + v);
        }
        if (kind.isProbability() && (v < 0.0 || v > 1.0)) {
            throw new InvalidConfigurationException(where(mood) + kind + " must be a probability in [0,1], got " + v);
        }
        if (!kind.isProbability() && v < 0.0) {
            throw new InvalidConfigurationException(where(mood) + kind + " must be a non-negative variance, got " + v);
        }
    }

    private static String where(Mood mood) {
        return mood == null ? "" : "profile " + mood.id() + ": ";
    }

    public static Builder builder(Mood mood) {
        return new Builder(mood);
    }

    public static final class Builder {
        private final Mood mood;
        private final EnumMap<ConstructKind, Double> values = new EnumMap<>(ConstructKind.class);
        private double chaosAmplifier = 1.0;

        private Builder(Mood mood) {
            this.mood = Objects.requireNonNull(mood, "mood");
        }

        public Builder set(ConstructKind kind, double value) {
            values.put(Objects.requireNonNull(kind, "kind"), value);
            return this;
        }

        public Builder chaosAmplifier(double v) {
            this.chaosAmplifier = v;
            return this;
        }

        public MoodProfile build() {
            return new MoodProfile(this);
        }
    }

    @Override
    public String toString() {
        return "MoodProfile{" + mood.id() + ", amp=" + chaosAmplifier + "}";
    }
}
