package org.calista.kinda.runtime;

import org.calista.kinda.compose.CompositionEngine;
import org.calista.kinda.compose.CompositionPattern;
import org.calista.kinda.compose.PatternMode;
import org.calista.kinda.compose.PatternRegistry;
import org.calista.kinda.events.ChaosReporter;
import org.calista.kinda.events.EventStore;
import org.calista.kinda.events.EventType;
import org.calista.kinda.loop.ConfidenceLoop;
import org.calista.kinda.loop.LoopRuntime;
import org.calista.kinda.loop.LoopSettings;
import org.calista.kinda.personality.ConstructKind;
import org.calista.kinda.personality.ErrorStyle;
import org.calista.kinda.personality.PersonalityResolver;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.LongSupplier;

/**
 * Instance-owned runtime behind the {@link Kinda} facade: personality, randomness, telemetry,
 * composition and loops wired together once.
 */
public final class KindaRuntime {

    static final List<String> SHRUGS = List.of(
            "[shrug] Meh...",
            "[shrug] Not feeling it right now",
            "[shrug] Maybe later?",
            "[shrug] *waves hand dismissively*",
            "[shrug] Kinda busy");

    private final PersonalityResolver personality;
    private final RandomSource random;
    private final EventStore events;
    private final Primitives primitives;
    private final DirectConstructs direct;
    private final CompositionEngine composition;
    private final LoopRuntime loops;
    private final TimeDrift timeDrift;
    private final PrintStream out;

    private final CompositionPattern ishComparison;
    private final CompositionPattern ishAssignment;
    private final CompositionPattern sorta;

    private KindaRuntime(Builder b) {
        this.personality = b.personality != null ? b.personality : new PersonalityResolver();
        this.random = b.random != null ? b.random : RandomSource.unseeded();
        this.events = b.events != null ? b.events : new EventStore(1024);
        this.out = b.out != null ? b.out : System.out;

        ChaosReporter reporter = new ChaosReporter(events, personality);
        this.primitives = new Primitives(personality, random, reporter);
        this.direct = new DirectConstructs(primitives);
        PatternRegistry registry = b.registry != null ? b.registry : new PatternRegistry();
        this.composition = new CompositionEngine(registry, primitives, direct, b.compositionEnabled);
        this.loops = new LoopRuntime(primitives, b.loopSettings != null ? b.loopSettings : LoopSettings.defaults());
        this.timeDrift = new TimeDrift(primitives, b.nanoClock != null ? b.nanoClock : System::nanoTime);

        this.ishComparison = registry.register(PatternRegistry.ISH, PatternMode.COMPARISON);
        this.ishAssignment = registry.register(PatternRegistry.ISH, PatternMode.ASSIGNMENT);
        this.sorta = registry.register(PatternRegistry.SORTA, PatternMode.GATE);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PersonalityResolver personality;
        private RandomSource random;
        private EventStore events;
        private PatternRegistry registry;
        private LoopSettings loopSettings;
        private boolean compositionEnabled = true;
        private PrintStream out;
        private LongSupplier nanoClock;

        public Builder personality(PersonalityResolver v) {
            this.personality = Objects.requireNonNull(v, "personality");
            return this;
        }

        public Builder random(RandomSource v) {
            this.random = Objects.requireNonNull(v, "random");
            return this;
        }

        public Builder seed(long seed) {
            this.random = RandomSource.seeded(seed);
            return this;
        }

        public Builder events(EventStore v) {
            this.events = Objects.requireNonNull(v, "events");
            return this;
        }

        public Builder registry(PatternRegistry v) {
            this.registry = Objects.requireNonNull(v, "registry");
            return this;
        }

        public Builder loopSettings(LoopSettings v) {
            this.loopSettings = Objects.requireNonNull(v, "loopSettings");
            return this;
        }

        public Builder compositionEnabled(boolean v) {
            this.compositionEnabled = v;
            return this;
        }

        public Builder out(PrintStream v) {
            this.out = Objects.requireNonNull(v, "out");
            return this;
        }

        /** Time source for drift ages; {@code System::nanoTime} by default. */
        public Builder nanoClock(LongSupplier v) {
            this.nanoClock = Objects.requireNonNull(v, "nanoClock");
            return this;
        }

        public KindaRuntime build() {
            return new KindaRuntime(this);
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public PersonalityResolver personality() { return personality; }
    public RandomSource random() { return random; }
    public EventStore events() { return events; }
    public Primitives primitives() { return primitives; }
    public DirectConstructs direct() { return direct; }
    public CompositionEngine composition() { return composition; }
    public LoopRuntime loops() { return loops; }
    public TimeDrift timeDrift() { return timeDrift; }

    // ---------------------------------------------------------------------
    // Constructs
    // ---------------------------------------------------------------------

    public boolean gate(ConstructKind tier, boolean condition) {
        return primitives.gate(tier, condition);
    }

    public boolean sometimesWhile(int cycle, boolean condition) {
        return loops.sometimesWhile(cycle, condition);
    }

    public boolean maybeFor() {
        return loops.maybeFor();
    }

    public int kindaRepeat(Object n) {
        int count;
        try {
            double d = Numbers.toDouble(n);
            count = d >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) d;
        } catch (IllegalArgumentException e) {
            primitives.conversionFailed("kinda_repeat", n, e);
            count = 1;
        }
        return loops.kindaRepeat(count);
    }

    public ConfidenceLoop eventuallyUntilBegin() {
        return loops.eventuallyUntil();
    }

    public boolean eventuallyUntil(Object handle, boolean condition) {
        if (!(handle instanceof ConfidenceLoop loop)) {
            throw new IllegalArgumentException("not an eventually_until handle: " + handle);
        }
        return loop.step(condition);
    }

    public boolean ishCompare(Object left, Object right, Double tolerance) {
        return composition.composeComparison(ishComparison, left, right, tolerance);
    }

    public Number ishAssign(Object current, Object target) {
        return composition.composeAssignment(ishAssignment, current, target);
    }

    public int kindaInt(Object v) {
        try {
            return primitives.kindaInt(Numbers.toDouble(v));
        } catch (IllegalArgumentException e) {
            primitives.conversionFailed("kinda_int", v, e);
            return random.randInt(0, 10);
        }
    }

    public double kindaFloat(Object v) {
        try {
            return primitives.kindaFloat(Numbers.toDouble(v));
        } catch (IllegalArgumentException e) {
            primitives.conversionFailed("kinda_float", v, e);
            return random.uniform(0.0, 10.0);
        }
    }

    public boolean kindaBool(Object v) {
        try {
            return primitives.kindaBool(Numbers.toBoolean(v));
        } catch (IllegalArgumentException e) {
            primitives.conversionFailed("kinda_bool", v, e);
            return random.chance(0.5);
        }
    }

    /** Unreadable initial values are replaced by a draw in [0, 10] and still registered. */
    public double timeDriftFloat(String name, Object v) {
        double value;
        try {
            value = Numbers.toDouble(v);
        } catch (IllegalArgumentException e) {
            primitives.conversionFailed("time_drift_float", v, e);
            value = random.uniform(0.0, 10.0);
        }
        return timeDrift.declareFloat(name, value);
    }

    /** Fractions are truncated; unreadable initial values are replaced by a draw in [0, 10]. */
    public int timeDriftInt(String name, Object v) {
        int value;
        try {
            value = (int) Numbers.toDouble(v);
        } catch (IllegalArgumentException e) {
            primitives.conversionFailed("time_drift_int", v, e);
            value = random.randInt(0, 10);
        }
        return timeDrift.declareInt(name, value);
    }

    /**
     * Value of {@code primary}, or {@code fallback} when it throws or gives null. A fallback
     * prints one line in the mood's error style and records a {@link EventType#WELP_FALLBACK}.
     */
    public <T> T welp(Attempt<? extends T> primary, T fallback) {
        Objects.requireNonNull(primary, "primary");
        T result;
        try {
            result = primary.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fellBack(fallback, e);
        } catch (Exception e) {
            return fellBack(fallback, e);
        }
        return result != null ? result : fellBack(fallback, null);
    }

    private <T> T fellBack(T fallback, Exception cause) {
        out.println(welpMessage(personality.errorStyle(), fallback, cause));
        primitives.reporter().report(EventType.WELP_FALLBACK, "welp",
                cause == null ? "primary gave null" : cause.toString());
        return fallback;
    }

    static String welpMessage(ErrorStyle style, Object fallback, Exception cause) {
        String value = fallback instanceof CharSequence ? "'" + fallback + "'" : String.valueOf(fallback);
        if (cause == null) {
            return switch (style) {
                case PROFESSIONAL -> "[welp] Expression returned null, using fallback: " + value;
                case FRIENDLY -> "[welp] Got nothing there, trying fallback: " + value;
                case SNARKY -> "[welp] Well that was useless, falling back to: " + value;
                case CHAOTIC -> "[welp] *shrugs* That didn't work, whatever: " + value;
            };
        }
        String type = cause.getClass().getSimpleName();
        return switch (style) {
            case PROFESSIONAL -> "[welp] Operation failed (" + type + ": " + cause.getMessage() + "), using fallback: " + value;
            case FRIENDLY -> "[welp] Oops, that didn't work (" + cause.getMessage() + "), trying: " + value;
            case SNARKY -> "[welp] Predictably failed with " + type + ", fine: " + value;
            case CHAOTIC -> "[welp] BOOM! " + cause.getMessage() + " *CRASH* Whatever, here's: " + value;
        };
    }

    public void sortaPrint(Object... args) {
        if (args == null || args.length == 0) {
            if (random.chance(personality.probabilityFor(ConstructKind.SORTA_PRINT))) {
                out.println("[shrug] Nothing to print, I guess?");
            }
            return;
        }
        StringJoiner text = new StringJoiner(" ");
        for (Object a : args) text.add(String.valueOf(a));

        boolean fires = composition.composeGate(sorta, true, direct::sortaFires);
        if (fires) {
            out.println("[print] " + text);
        } else {
            out.println(random.choice(SHRUGS) + " " + text);
        }
    }
}
