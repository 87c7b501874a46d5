package org.calista.kinda.personality;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Objects;

/**
 * Holds the active personality and answers per-construct lookups.
 *
 * <p>State model:</p>
 * <ul>
 *   <li>a base context shared by every thread ({@link #setContext}),</li>
 *   <li>a per-thread override stack ({@link #push}); the top entry wins over the base.</li>
 * </ul>
 *
 * <p>{@link #probabilityFor} and {@link #varianceFor} are pure reads: no randomness,
 * no mutation. Callers inject the randomness.</p>
 */
public final class PersonalityResolver {

    private static final Logger log = LoggerFactory.getLogger(PersonalityResolver.class);

    private final MoodProfiles profiles;
    private volatile ActiveContext base;
    private final ThreadLocal<ArrayDeque<ActiveContext>> overrides = ThreadLocal.withInitial(ArrayDeque::new);

    public PersonalityResolver() {
        this(MoodProfiles.defaults(), ActiveContext.DEFAULT);
    }

    public PersonalityResolver(MoodProfiles profiles, ActiveContext initial) {
        this.profiles = Objects.requireNonNull(profiles, "profiles");
        this.base = Objects.requireNonNull(initial, "initial");
    }

    // ---------------------------------------------------------------------
    // Context
    // ---------------------------------------------------------------------

    public void setContext(String mood, int chaosLevel) {
        setContext(ActiveContext.of(mood, chaosLevel));
    }

    public void setContext(Mood mood, int chaosLevel) {
        setContext(ActiveContext.of(mood, chaosLevel));
    }

    public void setContext(ActiveContext ctx) {
        if (ctx == null) throw new InvalidConfigurationException("context must not be null");
        ActiveContext prev = this.base;
        this.base = ctx;
        if (!prev.equals(ctx)) log.info("Personality context set: {} -> {}", prev, ctx);
    }

    public ActiveContext current() {
        ActiveContext top = overrides.get().peek();
        return top != null ? top : base;
    }

    public ActiveContext baseContext() {
        return base;
    }

    public Scope push(Mood mood, int chaosLevel) {
        return push(ActiveContext.of(mood, chaosLevel));
    }

    /**
     * Temporarily overrides the context for the calling thread.
     * Use with try-with-resources; closing restores exactly the previous context.
     */
    public Scope push(ActiveContext ctx) {
        if (ctx == null) throw new InvalidConfigurationException("context must not be null");
        ArrayDeque<ActiveContext> stack = overrides.get();
        int depth = stack.size();
        stack.push(ctx);
        log.debug("Personality override pushed: {} (depth={})", ctx, depth + 1);
        return new Scope(stack, depth, Thread.currentThread());
    }

    /** Depth of the calling thread's override stack. */
    public int overrideDepth() {
        return overrides.get().size();
    }

    public MoodProfile profile() {
        return profiles.get(current().mood());
    }

    // ---------------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------------

    /** amplifier(mood) x multiplier(chaos level). */
    public double chaosFactor() {
        ActiveContext ctx = current();
        return profiles.get(ctx.mood()).chaosAmplifier() * ctx.chaos().multiplier();
    }

    public double probabilityFor(ConstructKind kind) {
        Objects.requireNonNull(kind, "kind");
        if (!kind.isProbability()) {
            throw new IllegalArgumentException(kind + " is a variance kind; use varianceFor");
        }
        return resolve(kind);
    }

    public double varianceFor(ConstructKind kind) {
        Objects.requireNonNull(kind, "kind");
        if (kind.isProbability()) {
            throw new IllegalArgumentException(kind + " is a probability kind; use probabilityFor");
        }
        return resolve(kind);
    }

    /** Message register for recovered failures, from the profile's snark level. */
    public ErrorStyle errorStyle() {
        return ErrorStyle.forSnark(resolve(ConstructKind.ERROR_SNARK));
    }

    /**
     * Positive / negative / neutral probabilities for three-state values, normalised to sum 1.
     *
     * <p>Neutral is what the profile leaves over. A combined factor above 1 scales both
     * signed outcomes by {@code 1 + (c-1)/2} and neutral by {@code 1 - (c-1)/2}; below 1 the
     * signed outcomes move {@code 0.3 (1-c)} of the way toward neutral. Pinned overrides are
     * used as given.</p>
     */
    public double[] binaryProbabilities() {
        ActiveContext ctx = current();
        MoodProfile p = profiles.get(ctx.mood());
        Double pinnedPos = ctx.override(ConstructKind.BINARY_POSITIVE);
        Double pinnedNeg = ctx.override(ConstructKind.BINARY_NEGATIVE);
        double pos = pinnedPos != null ? pinnedPos : p.base(ConstructKind.BINARY_POSITIVE);
        double neg = pinnedNeg != null ? pinnedNeg : p.base(ConstructKind.BINARY_NEGATIVE);
        double neutral = Math.max(0.0, 1.0 - pos - neg);

        if (pinnedPos == null && pinnedNeg == null) {
            double c = p.chaosAmplifier() * ctx.chaos().multiplier();
            if (c > 1.0) {
                double f = (c - 1.0) * 0.5;
                pos *= 1.0 + f;
                neg *= 1.0 + f;
                neutral = Math.max(0.0, neutral * (1.0 - f));
            } else if (c < 1.0) {
                double f = (1.0 - c) * 0.3;
                pos += (neutral - pos) * f;
                neg += (neutral - neg) * f;
            }
        }

        double total = pos + neg + neutral;
        if (total <= 0.0) return new double[]{1.0 / 3, 1.0 / 3, 1.0 / 3};
        return new double[]{pos / total, neg / total, neutral / total};
    }

    private double resolve(ConstructKind kind) {
        ActiveContext ctx = current();
        Double pinned = ctx.override(kind);
        if (pinned != null) return pinned;

        MoodProfile p = profiles.get(ctx.mood());
        double c = p.chaosAmplifier() * ctx.chaos().multiplier();
        return scale(kind.scaling(), p.base(kind), c);
    }

    static double scale(ConstructKind.Scaling scaling, double base, double c) {
        return switch (scaling) {
            case GATE -> clamp(gate(base, c), 0.0, 1.0);
            case CONFIDENCE -> clamp(c > 1.0 ? base - Math.min(0.3, (c - 1.0) * 0.2) : base + (1.0 - c) * 0.1, 0.5, 0.99);
            case HALF_CAPPED -> clamp(base * c, 0.0, 0.5);
            case UNIT_VARIANCE -> clamp(base * c, 0.0, 1.0);
            case VARIANCE -> Math.max(0.0, base * c);
            case FIXED -> base;
        };
    }

    // c < 1 pushes away from 0.5, c > 1 pulls toward it
    private static double gate(double base, double c) {
        if (c < 1.0) {
            return base >= 0.5 ? base + (1.0 - base) * (1.0 - c) : base * c;
        }
        return base > 0.5 ? base - (base - 0.5) * (c - 1.0) : base + (0.5 - base) * (c - 1.0);
    }

    private static double clamp(double v, double lo, double hi) {
        return v < lo ? lo : (v > hi ? hi : v);
    }

    // ---------------------------------------------------------------------
    // Scope
    // ---------------------------------------------------------------------

    /**
     * Handle returned by {@link #push}. Closing truncates the owning thread's stack back to
     * the depth it had before the push, so a leaked inner scope is dropped as well.
     */
    public static final class Scope implements AutoCloseable {
        private final ArrayDeque<ActiveContext> stack;
        private final int depth;
        private final Thread owner;
        private boolean closed;

        private Scope(ArrayDeque<ActiveContext> stack, int depth, Thread owner) {
            this.stack = stack;
            this.depth = depth;
            this.owner = owner;
        }

        @Override
        public void close() {
            if (closed) return;
            if (Thread.currentThread() != owner) {
                throw new IllegalStateException("personality scope must be closed by the thread that opened it");
            }
            while (stack.size() > depth) stack.pop();
            closed = true;
        }
    }
}
