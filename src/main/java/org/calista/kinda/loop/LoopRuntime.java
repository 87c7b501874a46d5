package org.calista.kinda.loop;

import org.calista.kinda.events.EventType;
import org.calista.kinda.personality.ConstructKind;
import org.calista.kinda.runtime.Primitives;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Entry point for the four loop semantics.
 *
 * <p>Transformed code uses the predicate forms ({@link #sometimesWhile(int, boolean)},
 * {@link #maybeFor()}, {@link #kindaRepeat(int)}, {@link #eventuallyUntil()} + {@link ConfidenceLoop#step}).
 * Library callers can use the callable forms, which run the body themselves and report counts.</p>
 */
public final class LoopRuntime {

    private final Primitives p;
    private final LoopSettings settings;
    private final PerItemLoop perItem;
    private final FuzzyRepeat repeat;

    public LoopRuntime(Primitives primitives, LoopSettings settings) {
        this.p = Objects.requireNonNull(primitives, "primitives");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.perItem = new PerItemLoop(primitives);
        this.repeat = new FuzzyRepeat(primitives);
    }

    public LoopSettings settings() {
        return settings;
    }

    // ---------------------------------------------------------------------
    // sometimes_while
    // ---------------------------------------------------------------------

    /**
     * Stateless continuation check.
     *
     * @param cycle evaluations already made by this loop instance (0 on the first check)
     */
    public boolean sometimesWhile(int cycle, boolean condition) {
        if (!condition) return false;
        if (cycle >= settings.sometimesWhileMaxCycles) {
            p.reporter().report(EventType.LOOP_CAP_EXCEEDED, "sometimes_while",
                    "stopped after " + settings.sometimesWhileMaxCycles + " cycles");
            return false;
        }
        return p.random().chance(p.personality().probabilityFor(ConstructKind.SOMETIMES_WHILE));
    }

    public ContinuationLoop continuation() {
        return new ContinuationLoop(p, settings.sometimesWhileMaxCycles);
    }

    /**
     * @return condition evaluations made, including the final one
     */
    public int runWhile(BooleanSupplier condition, Runnable body) {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(body, "body");
        ContinuationLoop loop = continuation();
        while (loop.step(condition.getAsBoolean())) body.run();
        return loop.cycles();
    }

    // ---------------------------------------------------------------------
    // maybe_for
    // ---------------------------------------------------------------------

    public boolean maybeFor() {
        return perItem.admit();
    }

    public <T> int forEach(Iterable<T> items, Consumer<? super T> body) {
        return perItem.forEach(items, body);
    }

    // ---------------------------------------------------------------------
    // kinda_repeat
    // ---------------------------------------------------------------------

    public int kindaRepeat(int n) {
        return repeat.count(n);
    }

    public int repeat(int n, IntConsumer body) {
        return repeat.repeat(n, body);
    }

    // ---------------------------------------------------------------------
    // eventually_until
    // ---------------------------------------------------------------------

    /** Starts one loop instance; the threshold is fixed from the context active now. */
    public ConfidenceLoop eventuallyUntil() {
        double threshold = p.personality().probabilityFor(ConstructKind.EVENTUALLY_UNTIL);
        return new ConfidenceLoop(threshold, settings, p.reporter());
    }

    public ConfidenceLoop.Outcome runUntil(BooleanSupplier condition, Runnable body) {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(body, "body");
        ConfidenceLoop loop = eventuallyUntil();
        while (loop.step(condition.getAsBoolean())) body.run();
        return loop.outcome();
    }
}
