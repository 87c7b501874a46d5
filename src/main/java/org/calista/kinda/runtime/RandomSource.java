package org.calista.kinda.runtime;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Single source of randomness for every fuzzy construct.
 *
 * <p>Seeded instances are reproducible: the same seed, context and call sequence give the
 * same draws. The seed is mixed before use so nearby seeds do not give correlated streams.</p>
 */
public final class RandomSource {

    private final Random rnd;
    private final Long seed;

    private RandomSource(Random rnd, Long seed) {
        this.rnd = rnd;
        this.seed = seed;
    }

    public static RandomSource seeded(long seed) {
        return new RandomSource(new Random(mix64(seed, 0x9E3779B97F4A7C15L)), seed);
    }

    public static RandomSource unseeded() {
        return new RandomSource(new Random(), null);
    }

    /** null seed means unseeded. */
    public static RandomSource of(Long seed) {
        return seed == null ? unseeded() : seeded(seed);
    }

    public Long seed() {
        return seed;
    }

    /** Uniform in [0, 1). */
    public double nextDouble() {
        return rnd.nextDouble();
    }

    public boolean chance(double p) {
        return rnd.nextDouble() < p;
    }

    /** Uniform in [lo, hi]; lo == hi gives lo. */
    public double uniform(double lo, double hi) {
        if (hi < lo) throw new IllegalArgumentException("uniform: hi < lo (" + lo + ", " + hi + ")");
        if (hi == lo) return lo;
        return lo + (hi - lo) * rnd.nextDouble();
    }

    /** Uniform integer in [lo, hi], both inclusive. */
    public int randInt(int lo, int hi) {
        if (hi < lo) throw new IllegalArgumentException("randInt: hi < lo (" + lo + ", " + hi + ")");
        if (hi == lo) return lo;
        return lo + rnd.nextInt(hi - lo + 1);
    }

    public double gaussian(double mean, double sigma) {
        if (sigma <= 0.0) return mean;
        return mean + sigma * rnd.nextGaussian();
    }

    public <T> T choice(List<T> items) {
        Objects.requireNonNull(items, "items");
        if (items.isEmpty()) throw new IllegalArgumentException("choice from empty list");
        return items.get(rnd.nextInt(items.size()));
    }

    private static long mix64(long a, long b) {
        long x = a ^ b;
        x ^= (x >>> 33);
        x *= 0xff51afd7ed558ccdL;
        x ^= (x >>> 33);
        x *= 0xc4ceb9fe1a85ec53L;
        x ^= (x >>> 33);
        return x;
    }
}
