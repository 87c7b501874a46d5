package org.calista.kinda.personality;

/**
 * Bounded chaos level (1..10) and its piecewise multiplier.
 * Level 5 is the baseline; the multiplier grows faster through the middle band.
 */
public final class ChaosLevel {

    public static final int MIN = 1;
    public static final int MAX = 10;
    public static final int DEFAULT_LEVEL = 5;

    private final int level;

    private ChaosLevel(int level) {
        this.level = level;
    }

    /**
     * @throws InvalidConfigurationException outside [{@value #MIN}, {@value #MAX}]
     */
    public static ChaosLevel of(int level) {
        if (level < MIN || level > MAX) {
            throw new InvalidConfigurationException("chaos level must be in [" + MIN + "," + MAX + "], got " + level);
        }
        return new ChaosLevel(level);
    }

    public int level() {
        return level;
    }

    public double multiplier() {
        int l = level;
        if (l <= 2) return 0.2 + (l - 1) * 0.2;
        if (l <= 4) return 0.4 + (l - 2) * 0.2;
        if (l <= 6) return 0.8 + (l - 4) * 0.3;
        if (l <= 8) return 1.4 + (l - 6) * 0.2;
        return 1.8 + (l - 8) * 0.2;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ChaosLevel other && other.level == level;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(level);
    }

    @Override
    public String toString() {
        return Integer.toString(level);
    }
}
