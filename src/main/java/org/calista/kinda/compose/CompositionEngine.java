package org.calista.kinda.compose;

import org.calista.kinda.events.EventType;
import org.calista.kinda.runtime.DirectConstructs;
import org.calista.kinda.runtime.Primitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Evaluates composition patterns and recovers from their failures.
 *
 * <p>A failed {@link CompositionResult} is recorded as a {@link EventType#COMPOSITION_FALLBACK}
 * event and answered by {@link DirectConstructs}; no exception reaches the program.
 * When composition is disabled every call goes straight to the direct path.</p>
 */
public final class CompositionEngine {

    private static final Logger log = LoggerFactory.getLogger(CompositionEngine.class);

    private final PatternRegistry registry;
    private final Primitives primitives;
    private final DirectConstructs direct;
    private final boolean enabled;
    private final ConcurrentHashMap<String, PatternStats> stats = new ConcurrentHashMap<>();

    public CompositionEngine(PatternRegistry registry, Primitives primitives, DirectConstructs direct, boolean enabled) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.primitives = Objects.requireNonNull(primitives, "primitives");
        this.direct = Objects.requireNonNull(direct, "direct");
        this.enabled = enabled;
    }

    public PatternRegistry registry() {
        return registry;
    }

    public DirectConstructs direct() {
        return direct;
    }

    public boolean isEnabled() {
        return enabled;
    }

    // ---------------------------------------------------------------------
    // Entry points
    // ---------------------------------------------------------------------

    public boolean composeComparison(CompositionPattern pattern, Object left, Object right, Double tolerance) {
        requireMode(pattern, PatternMode.COMPARISON);
        if (!enabled) return direct.ishComparison(left, right, tolerance);

        CompositionResult<Boolean> r = run(pattern, () -> pattern.compare(primitives, left, right, tolerance));
        if (r.isSuccess()) return r.value();
        fallback(pattern, r);
        return direct.ishComparison(left, right, tolerance);
    }

    public Number composeAssignment(CompositionPattern pattern, Object current, Object target) {
        requireMode(pattern, PatternMode.ASSIGNMENT);
        if (!enabled) return direct.ishAssign(current, target);

        CompositionResult<Number> r = run(pattern, () -> pattern.assign(primitives, current, target));
        if (r.isSuccess()) return r.value();
        fallback(pattern, r);
        return direct.ishAssign(current, target);
    }

    public boolean composeGate(CompositionPattern pattern, boolean condition, BooleanSupplier directPath) {
        requireMode(pattern, PatternMode.GATE);
        Objects.requireNonNull(directPath, "directPath");
        if (!enabled) return directPath.getAsBoolean();

        CompositionResult<Boolean> r = run(pattern, () -> pattern.evaluate(primitives, condition));
        if (r.isSuccess()) return r.value();
        fallback(pattern, r);
        return directPath.getAsBoolean();
    }

    // ---------------------------------------------------------------------
    // Strategies
    // ---------------------------------------------------------------------

    /**
     * Combines gates by strategy.
     *
     * @param weights required for WEIGHTED (same length as gates, non-negative, positive sum); ignored otherwise
     */
    public static boolean combine(CompositionStrategy strategy, List<BooleanSupplier> gates, double[] weights) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(gates, "gates");
        if (gates.isEmpty()) throw new IllegalArgumentException("no gates to combine");

        switch (strategy) {
            case UNION -> {
                boolean any = false;
                for (BooleanSupplier g : gates) any |= g.getAsBoolean();
                return any;
            }
            case INTERSECTION -> {
                boolean all = true;
                for (BooleanSupplier g : gates) all &= g.getAsBoolean();
                return all;
            }
            case SEQUENTIAL -> {
                boolean last = false;
                for (BooleanSupplier g : gates) {
                    last = g.getAsBoolean();
                    if (!last) break;
                }
                return last;
            }
            case WEIGHTED -> {
                if (weights == null || weights.length != gates.size()) {
                    throw new IllegalArgumentException("WEIGHTED needs one weight per gate");
                }
                double total = 0.0;
                double hit = 0.0;
                for (int i = 0; i < gates.size(); i++) {
                    double w = weights[i];
                    if (w < 0.0 || Double.isNaN(w)) throw new IllegalArgumentException("negative weight at " + i);
                    total += w;
                    if (gates.get(i).getAsBoolean()) hit += w;
                }
                if (total <= 0.0) throw new IllegalArgumentException("weights sum to zero");
                return hit / total > 0.5;
            }
            case CONDITIONAL -> {
                if (gates.size() != 3) throw new IllegalArgumentException("CONDITIONAL needs exactly 3 gates");
                return gates.get(0).getAsBoolean() ? gates.get(1).getAsBoolean() : gates.get(2).getAsBoolean();
            }
        }
        throw new IllegalArgumentException("unknown strategy " + strategy);
    }

    public PatternStats stats(CompositionPattern pattern) {
        return stats.computeIfAbsent(pattern.key(), k -> new PatternStats());
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private interface Evaluation<T> {
        CompositionResult<T> get();
    }

    private <T> CompositionResult<T> run(CompositionPattern pattern, Evaluation<T> eval) {
        PatternStats s = stats(pattern);
        long t0 = System.nanoTime();
        CompositionResult<T> r;
        try {
            r = eval.get();
        } catch (RuntimeException e) {
            // pattern did not guard its own body
            r = CompositionResult.failure(FailureReason.UNEXPECTED, e.toString(), e);
        }
        s.executed(System.nanoTime() - t0);
        if (!r.isSuccess()) s.failed();
        return r;
    }

    private void fallback(CompositionPattern pattern, CompositionResult<?> failure) {
        stats(pattern).fellBack();
        primitives.reporter().report(EventType.COMPOSITION_FALLBACK, pattern.name(),
                failure.reason() + ": " + failure.detail());
        if (failure.cause() != null) {
            log.debug("Pattern {} failed, using direct path", pattern.key(), failure.cause());
        } else {
            log.debug("Pattern {} failed ({}), using direct path", pattern.key(), failure.detail());
        }
    }

    private static void requireMode(CompositionPattern pattern, PatternMode mode) {
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.mode() != mode) {
            throw new IllegalArgumentException(pattern.key() + " is not a " + mode.name().toLowerCase(Locale.ROOT) + " pattern");
        }
    }
}
