package org.calista.kinda.runtime;

import org.calista.kinda.personality.ConstructKind;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Call surface for transformed sources. Plain values in, plain values out.
 *
 * <p>Delegates to the installed {@link KindaRuntime}; without one, a default runtime
 * (playful, chaos 5, unseeded) is created on first use.</p>
 */
public final class Kinda {

    private static final AtomicReference<KindaRuntime> RUNTIME = new AtomicReference<>();

    private Kinda() {
    }

    /**
     * @return the runtime that was installed before, or null
     */
    public static KindaRuntime install(KindaRuntime runtime) {
        return RUNTIME.getAndSet(Objects.requireNonNull(runtime, "runtime"));
    }

    /** Removes {@code runtime} if it is still the installed one. */
    public static boolean uninstall(KindaRuntime runtime) {
        return RUNTIME.compareAndSet(runtime, null);
    }

    public static KindaRuntime runtime() {
        KindaRuntime rt = RUNTIME.get();
        if (rt != null) return rt;
        RUNTIME.compareAndSet(null, KindaRuntime.builder().build());
        return RUNTIME.get();
    }

    // ---------------------------------------------------------------------
    // Conditional gates
    // ---------------------------------------------------------------------

    public static boolean sometimes() { return sometimes(true); }
    public static boolean sometimes(boolean condition) { return runtime().gate(ConstructKind.SOMETIMES, condition); }

    public static boolean maybe() { return maybe(true); }
    public static boolean maybe(boolean condition) { return runtime().gate(ConstructKind.MAYBE, condition); }

    public static boolean probably() { return probably(true); }
    public static boolean probably(boolean condition) { return runtime().gate(ConstructKind.PROBABLY, condition); }

    public static boolean rarely() { return rarely(true); }
    public static boolean rarely(boolean condition) { return runtime().gate(ConstructKind.RARELY, condition); }

    // ---------------------------------------------------------------------
    // Loops
    // ---------------------------------------------------------------------

    /** Continuation check; {@code cycle} counts previous checks of this loop. */
    public static boolean sometimesWhile(int cycle, boolean condition) {
        return runtime().sometimesWhile(cycle, condition);
    }

    /** Per-item gate. */
    public static boolean maybeFor() {
        return runtime().maybeFor();
    }

    /** Fuzzy count. */
    public static int kindaRepeat(int n) { return runtime().kindaRepeat(n); }
    public static int kindaRepeat(double n) { return runtime().kindaRepeat(n); }
    public static int kindaRepeat(Object n) { return runtime().kindaRepeat(n); }

    /** Opaque handle for one eventually_until loop. */
    public static Object eventuallyUntilBegin() {
        return runtime().eventuallyUntilBegin();
    }

    /** Confidence-loop step: true while the loop should keep running. */
    public static boolean eventuallyUntil(Object handle, boolean condition) {
        return runtime().eventuallyUntil(handle, condition);
    }

    // ---------------------------------------------------------------------
    // Tolerance
    // ---------------------------------------------------------------------

    public static boolean ishCompare(Object left, Object right) {
        return runtime().ishCompare(left, right, null);
    }

    public static boolean ishCompare(Object left, Object right, double tolerance) {
        return runtime().ishCompare(left, right, tolerance);
    }

    public static int ishAssign(int current, int target) {
        return runtime().ishAssign(current, target).intValue();
    }

    /** Fractional target on an int variable; the result stays an int. */
    public static int ishAssign(int current, double target) {
        return Numbers.toInt(runtime().ishAssign(current, target).doubleValue());
    }

    public static long ishAssign(long current, double target) {
        return Math.round(runtime().ishAssign(current, target).doubleValue());
    }

    public static float ishAssign(float current, double target) {
        return (float) runtime().ishAssign((double) current, target).doubleValue();
    }

    public static double ishAssign(double current, double target) {
        return runtime().ishAssign(current, target).doubleValue();
    }

    public static int ishValue(int v) {
        return runtime().primitives().ishValue(v);
    }

    public static long ishValue(long v) {
        return runtime().primitives().ishValue(v);
    }

    public static float ishValue(float v) {
        return (float) runtime().primitives().ishValue((double) v);
    }

    public static double ishValue(double v) {
        return runtime().primitives().ishValue(v);
    }

    // ---------------------------------------------------------------------
    // Fuzzy values
    // ---------------------------------------------------------------------

    public static int kindaInt(int v) { return runtime().primitives().kindaInt(v); }
    public static int kindaInt(double v) { return runtime().primitives().kindaInt(v); }
    public static int kindaInt(Object v) { return runtime().kindaInt(v); }

    public static double kindaFloat(double v) { return runtime().primitives().kindaFloat(v); }
    public static double kindaFloat(Object v) { return runtime().kindaFloat(v); }

    public static boolean kindaBool(boolean v) { return runtime().primitives().kindaBool(v); }
    public static boolean kindaBool(Object v) { return runtime().kindaBool(v); }

    public static int kindaBinary() {
        return runtime().primitives().kindaBinary();
    }

    /** Numeric noise for {@code x ~= e}; the result has the type of {@code e}. */
    public static int fuzzyAssign(int v) { return runtime().primitives().kindaInt(v); }
    public static long fuzzyAssign(long v) { return runtime().primitives().kindaLong(v); }
    public static float fuzzyAssign(float v) { return (float) runtime().primitives().kindaFloat(v); }
    public static double fuzzyAssign(double v) { return runtime().primitives().kindaFloat(v); }

    public static void sortaPrint(Object... args) {
        runtime().sortaPrint(args);
    }

    // ---------------------------------------------------------------------
    // Time drift
    // ---------------------------------------------------------------------

    public static double timeDriftFloat(String name, double v) { return runtime().timeDrift().declareFloat(name, v); }
    public static double timeDriftFloat(String name, Object v) { return runtime().timeDriftFloat(name, v); }

    public static int timeDriftInt(String name, int v) { return runtime().timeDrift().declareInt(name, v); }
    public static int timeDriftInt(String name, double v) { return runtime().timeDrift().declareInt(name, (int) v); }
    public static int timeDriftInt(String name, Object v) { return runtime().timeDriftInt(name, v); }

    /** Read of a drifting variable; the result has the variable's type. */
    public static int drift(String name, int v) { return runtime().timeDrift().drift(name, v); }
    public static long drift(String name, long v) { return runtime().timeDrift().drift(name, v); }
    public static float drift(String name, float v) { return (float) runtime().timeDrift().drift(name, (double) v); }
    public static double drift(String name, double v) { return runtime().timeDrift().drift(name, v); }

    // ---------------------------------------------------------------------
    // Fallback
    // ---------------------------------------------------------------------

    /** {@code primary ~welp fallback}. */
    public static <T> T welp(Attempt<? extends T> primary, T fallback) {
        return runtime().welp(primary, fallback);
    }
}
