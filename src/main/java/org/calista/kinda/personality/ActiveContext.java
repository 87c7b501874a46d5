package org.calista.kinda.personality;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Effective (mood, chaos level) pair plus optional per-kind overrides.
 * Immutable; equality is by value so a restored context compares equal to the one it replaced.
 */
public final class ActiveContext {

    public static final ActiveContext DEFAULT = of(Mood.DEFAULT, ChaosLevel.DEFAULT_LEVEL);

    private final Mood mood;
    private final ChaosLevel chaos;
    private final EnumMap<ConstructKind, Double> overrides;

    private ActiveContext(Mood mood, ChaosLevel chaos, EnumMap<ConstructKind, Double> overrides) {
        this.mood = Objects.requireNonNull(mood, "mood");
        this.chaos = Objects.requireNonNull(chaos, "chaos");
        this.overrides = overrides;
    }

    public static ActiveContext of(Mood mood, int chaosLevel) {
        if (mood == null) throw new InvalidConfigurationException("mood must not be null");
        return new ActiveContext(mood, ChaosLevel.of(chaosLevel), new EnumMap<>(ConstructKind.class));
    }

    public static ActiveContext of(String mood, int chaosLevel) {
        return of(Mood.parse(mood), chaosLevel);
    }

    /**
     * Pins the resolved value of one kind, bypassing profile and chaos scaling.
     */
    public ActiveContext withOverride(ConstructKind kind, double value) {
        Objects.requireNonNull(kind, "kind");
        MoodProfile.checkValue(null, kind, value);
        EnumMap<ConstructKind, Double> copy = new EnumMap<>(ConstructKind.class);
        copy.putAll(overrides);
        copy.put(kind, value);
        return new ActiveContext(mood, chaos, copy);
    }

    public Mood mood() {
        return mood;
    }

    public ChaosLevel chaos() {
        return chaos;
    }

    public int chaosLevel() {
        return chaos.level();
    }

    public Double override(ConstructKind kind) {
        return overrides.get(kind);
    }

    public Map<ConstructKind, Double> overrides() {
        return Collections.unmodifiableMap(overrides);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActiveContext other)) return false;
        return mood == other.mood && chaos.equals(other.chaos) && overrides.equals(other.overrides);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mood, chaos, overrides);
    }

    @Override
    public String toString() {
        return overrides.isEmpty()
                ? mood.id() + "@" + chaos
                : mood.id() + "@" + chaos + overrides;
    }
}
