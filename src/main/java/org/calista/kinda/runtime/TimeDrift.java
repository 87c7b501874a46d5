package org.calista.kinda.runtime;

import org.calista.kinda.personality.ConstructKind;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Variables declared with {@code ~time drift}: creation time, last access and access count per name.
 *
 * <p>Every read through {@link #offset} counts as an access. The offset grows with age (full effect
 * after 1000 s), with use (full effect after 100 reads) and with recent activity, scaled by the
 * personality's drift rate and by the magnitude of the value. A zero drift rate never moves a value.
 * Names that were never declared read back unchanged.</p>
 */
public final class TimeDrift {

    static final double MAX_AGE_SECONDS = 1000.0;
    static final double MAX_ACCESSES = 100.0;
    static final double INITIAL_FLOAT_DRIFT = 0.01;
    static final double MIN_SPREAD = 0.01;
    private static final List<Integer> INITIAL_INT_FUZZ = List.of(-1, 0, 0, 0, 1);

    private final Primitives p;
    private final LongSupplier nanoClock;
    private final ConcurrentHashMap<String, Tracked> tracked = new ConcurrentHashMap<>();

    public TimeDrift(Primitives p, LongSupplier nanoClock) {
        this.p = Objects.requireNonNull(p, "primitives");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    private static final class Tracked {
        long createdNanos;
        long lastAccessNanos;
        int accesses;
        double accumulated;

        Tracked(long now) {
            reset(now);
        }

        void reset(long now) {
            createdNanos = now;
            lastAccessNanos = now;
            accesses = 0;
            accumulated = 0.0;
        }
    }

    // ---------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------

    /** Registers the name and returns v nudged by at most 0.01. */
    public double declareFloat(String name, double v) {
        register(name);
        return v + p.random().uniform(-INITIAL_FLOAT_DRIFT, INITIAL_FLOAT_DRIFT);
    }

    /** Registers the name and returns v, off by one in two draws out of five. */
    public int declareInt(String name, int v) {
        register(name);
        return v + p.random().choice(INITIAL_INT_FUZZ);
    }

    private void register(String name) {
        Objects.requireNonNull(name, "name");
        long now = nanoClock.getAsLong();
        tracked.put(name, new Tracked(now));
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    public double drift(String name, double v) {
        return v + offset(name, v);
    }

    public long drift(String name, long v) {
        return Math.round(v + offset(name, v));
    }

    public int drift(String name, int v) {
        return Numbers.toInt(v + offset(name, v));
    }

    /** Drift to add to {@code current} on this read; 0 for unknown names. */
    public double offset(String name, double current) {
        Tracked t = tracked.get(Objects.requireNonNull(name, "name"));
        if (t == null) return 0.0;

        long now = nanoClock.getAsLong();
        double age;
        double idle;
        int accesses;
        synchronized (t) {
            age = seconds(now - t.createdNanos);
            idle = seconds(now - t.lastAccessNanos);
            accesses = ++t.accesses;
            t.lastAccessNanos = now;
        }

        double rate = p.personality().varianceFor(ConstructKind.TIME_DRIFT);
        if (rate <= 0.0) return 0.0;

        double ageFactor = Math.min(1.0, age / MAX_AGE_SECONDS);
        double useFactor = Math.min(1.0, accesses / MAX_ACCESSES);
        double recentFactor = Math.max(0.1, Math.min(1.0, 10.0 / (idle + 1.0)));
        double magnitude = rate * (ageFactor + useFactor + recentFactor) / 3.0;

        double spread = Math.max(MIN_SPREAD, magnitude * Math.max(1.0, Math.abs(current)) * 0.1);
        double d = p.random().uniform(-spread, spread);
        synchronized (t) {
            t.accumulated += Math.abs(d);
        }
        return d;
    }

    // ---------------------------------------------------------------------
    // Stats
    // ---------------------------------------------------------------------

    public boolean isTracked(String name) {
        return tracked.containsKey(name);
    }

    public int accesses(String name) {
        Tracked t = tracked.get(name);
        if (t == null) return 0;
        synchronized (t) {
            return t.accesses;
        }
    }

    /** Sum of absolute offsets handed out since declaration or the last reset. */
    public double accumulated(String name) {
        Tracked t = tracked.get(name);
        if (t == null) return 0.0;
        synchronized (t) {
            return t.accumulated;
        }
    }

    public double ageSeconds(String name) {
        Tracked t = tracked.get(name);
        if (t == null) return 0.0;
        synchronized (t) {
            return seconds(nanoClock.getAsLong() - t.createdNanos);
        }
    }

    /** Starts the variable over as if freshly declared. */
    public void reset(String name) {
        Tracked t = tracked.get(name);
        if (t == null) return;
        synchronized (t) {
            t.reset(nanoClock.getAsLong());
        }
    }

    private static double seconds(long nanos) {
        return Math.max(0L, nanos) / 1e9;
    }
}
