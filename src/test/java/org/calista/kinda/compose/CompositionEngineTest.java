package org.calista.kinda.compose;

import org.calista.kinda.compose.impl.IshTolerancePattern;
import org.calista.kinda.compose.impl.ThresholdPattern;
import org.calista.kinda.events.ChaosReporter;
import org.calista.kinda.events.EventStore;
import org.calista.kinda.events.EventType;
import org.calista.kinda.personality.ActiveContext;
import org.calista.kinda.personality.ConstructKind;
import org.calista.kinda.personality.PersonalityResolver;
import org.calista.kinda.runtime.DirectConstructs;
import org.calista.kinda.runtime.KindaRuntime;
import org.calista.kinda.runtime.Primitives;
import org.calista.kinda.runtime.RandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class CompositionEngineTest {

    private static final class Fixture {
        final PersonalityResolver personality = new PersonalityResolver();
        final EventStore events = new EventStore(128);
        final Primitives primitives;
        final DirectConstructs direct;
        final PatternRegistry registry = new PatternRegistry();
        final CompositionEngine engine;

        Fixture(long seed, boolean enabled) {
            primitives = new Primitives(personality, RandomSource.seeded(seed), new ChaosReporter(events, personality));
            direct = new DirectConstructs(primitives);
            engine = new CompositionEngine(registry, primitives, direct, enabled);
        }
    }

    /** Comparison pattern that fails the way a broken recipe would. */
    private static final class FailingPattern extends CompositionPattern {
        private final RuntimeException toThrow;
        private final boolean guarded;

        FailingPattern(String name, RuntimeException toThrow, boolean guarded) {
            super(name, PatternMode.COMPARISON);
            this.toThrow = toThrow;
            this.guarded = guarded;
        }

        @Override
        public CompositionResult<Boolean> compare(Primitives p, Object left, Object right, Double tolerance) {
            if (!guarded) throw toThrow;
            return guard(() -> {
                throw toThrow;
            });
        }
    }

    // ── registry ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("registry")
    class Registry {

        @Test
        @DisplayName("register is create-or-fetch per name and mode")
        void idempotent() {
            PatternRegistry r = new PatternRegistry();
            CompositionPattern a = r.register(PatternRegistry.ISH, PatternMode.COMPARISON);
            CompositionPattern b = r.register(PatternRegistry.ISH, PatternMode.COMPARISON);
            CompositionPattern c = r.register(PatternRegistry.ISH, PatternMode.ASSIGNMENT);
            assertSame(a, b);
            assertNotSame(a, c);
            assertEquals(2, r.size());
            assertSame(c, r.register(PatternRegistry.ISH, PatternMode.ASSIGNMENT));
            r.clear();
            assertEquals(0, r.size());
        }

        @Test
        @DisplayName("unknown names and unsupported modes are rejected")
        void rejects() {
            PatternRegistry r = new PatternRegistry();
            assertThrows(IllegalArgumentException.class, () -> r.register("nope", PatternMode.GATE));
            assertThrows(IllegalArgumentException.class, () -> r.register(PatternRegistry.SORTA, PatternMode.COMPARISON));
            assertThrows(IllegalArgumentException.class, () -> r.register(PatternRegistry.ISH, PatternMode.GATE));
            assertEquals(0, r.size());
        }

        @Test
        @DisplayName("factory must produce the requested key")
        void factoryMismatch() {
            PatternRegistry r = new PatternRegistry();
            assertThrows(IllegalStateException.class,
                    () -> r.register("x", PatternMode.ASSIGNMENT, (n, m) -> new IshTolerancePattern(n, PatternMode.COMPARISON)));
        }
    }

    // ── tolerance ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("tolerance")
    class Tolerance {

        @Test
        @DisplayName("composed and direct comparisons give identical answers for the same seed")
        void equivalence() {
            Fixture composed = new Fixture(99L, true);
            Fixture direct = new Fixture(99L, false);
            CompositionPattern pc = composed.registry.register(PatternRegistry.ISH, PatternMode.COMPARISON);
            CompositionPattern pd = direct.registry.register(PatternRegistry.ISH, PatternMode.COMPARISON);
            for (int i = 0; i < 500; i++) {
                double l = i % 17;
                double r = (i * 7) % 13;
                assertEquals(direct.engine.composeComparison(pd, l, r, null),
                        composed.engine.composeComparison(pc, l, r, null), "pair " + i);
            }
            assertEquals(0, composed.events.count(EventType.COMPOSITION_FALLBACK));
        }

        @Test
        @DisplayName("close values usually match, distant values never do")
        void closeAndFar() {
            Fixture f = new Fixture(5L, true);
            CompositionPattern p = f.registry.register(PatternRegistry.ISH, PatternMode.COMPARISON);
            int close = 0;
            for (int i = 0; i < 1000; i++) {
                if (f.engine.composeComparison(p, 20.0, 20.5, null)) close++;
                assertFalse(f.engine.composeComparison(p, 0, 1000, null));
            }
            assertTrue(close > 500, "close=" + close);
        }

        @Test
        @DisplayName("unreadable operand compares false and records a conversion failure")
        void conversionFailure() {
            Fixture f = new Fixture(1L, true);
            CompositionPattern p = f.registry.register(PatternRegistry.ISH, PatternMode.COMPARISON);
            assertFalse(f.engine.composeComparison(p, "warm", 20, null));
            assertEquals(1, f.events.count(EventType.CONVERSION_FAILURE));
        }

        @Test
        @DisplayName("assignment keeps integer operands integral")
        void integralAssignment() {
            Fixture f = new Fixture(3L, true);
            CompositionPattern p = f.registry.register(PatternRegistry.ISH, PatternMode.ASSIGNMENT);
            for (int i = 0; i < 100; i++) {
                assertTrue(f.engine.composeAssignment(p, 10, 20) instanceof Integer);
            }
            assertTrue(f.engine.composeAssignment(p, 10.0, 20) instanceof Double);
        }

        @Test
        @DisplayName("without drift the assignment moves exactly halfway")
        void assignmentMovesTowardTarget() {
            Fixture f = new Fixture(8L, true);
            f.personality.setContext(ActiveContext.DEFAULT
                    .withOverride(ConstructKind.FLOAT_DRIFT, 0.0)
                    .withOverride(ConstructKind.ISH_VARIANCE, 0.0)
                    .withOverride(ConstructKind.SOMETIMES, 1.0));
            CompositionPattern p = f.registry.register(PatternRegistry.ISH, PatternMode.ASSIGNMENT);
            assertEquals(15.0, f.engine.composeAssignment(p, 10.0, 20.0).doubleValue(), 1e-12);
        }
    }

    // ── failures ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("failure recovery")
    class Failures {

        @Test
        @DisplayName("guarded failure falls back to the direct path with an event")
        void guardedFallback() {
            Fixture f = new Fixture(4L, true);
            CompositionPattern p = f.registry.register("broken", PatternMode.COMPARISON,
                    (n, m) -> new FailingPattern(n, new ClassCastException("bad operand"), true));
            f.engine.composeComparison(p, 1, 1, null);
            assertEquals(1, f.events.count(EventType.COMPOSITION_FALLBACK));
            assertTrue(f.events.recent().get(0).detail.startsWith("CONVERSION"));
            PatternStats s = f.engine.stats(p);
            assertEquals(1, s.executions());
            assertEquals(1, s.failures());
            assertEquals(1, s.fallbacks());
        }

        @Test
        @DisplayName("unguarded runtime exception is also recovered")
        void unguardedFallback() {
            Fixture f = new Fixture(4L, true);
            CompositionPattern p = f.registry.register("raw", PatternMode.COMPARISON,
                    (n, m) -> new FailingPattern(n, new IllegalArgumentException("raw"), false));
            assertDoesNotThrow(() -> f.engine.composeComparison(p, 1, 1, null));
            assertTrue(f.events.recent().get(0).detail.startsWith("UNEXPECTED"));
        }

        @Test
        @DisplayName("unreadable assignment operand is a conversion failure, recovered by the direct path")
        void assignmentConversion() {
            Fixture f = new Fixture(6L, true);
            CompositionPattern p = f.registry.register(PatternRegistry.ISH, PatternMode.ASSIGNMENT);

            CompositionResult<Number> r = p.assign(f.primitives, "lukewarm", 20);
            assertFalse(r.isSuccess());
            assertEquals(FailureReason.CONVERSION, r.reason());
            assertEquals(FailureReason.CONVERSION, p.assign(f.primitives, 10, "hot").reason());

            assertEquals(0, f.engine.composeAssignment(p, "lukewarm", 20).intValue());
            assertTrue(f.events.recent().stream().anyMatch(e -> e.detail.startsWith("CONVERSION")));
            assertEquals(1, f.events.count(EventType.CONVERSION_FAILURE));
        }

        @Test
        @DisplayName("errors are not swallowed")
        void errorsPropagate() {
            Fixture f = new Fixture(4L, true);
            CompositionPattern p = f.registry.register("fatal", PatternMode.COMPARISON, (n, m) -> new CompositionPattern(n, m) {
                @Override
                public CompositionResult<Boolean> compare(Primitives pr, Object l, Object r, Double t) {
                    throw new AssertionError("fatal");
                }
            });
            assertThrows(AssertionError.class, () -> f.engine.composeComparison(p, 1, 1, null));
        }

        @Test
        @DisplayName("pattern used in the wrong mode is a programming error")
        void wrongMode() {
            Fixture f = new Fixture(4L, true);
            CompositionPattern gate = f.registry.register(PatternRegistry.SORTA, PatternMode.GATE);
            assertThrows(IllegalArgumentException.class, () -> f.engine.composeComparison(gate, 1, 2, null));
        }

        @Test
        @DisplayName("failed result refuses to give a value")
        void failedResult() {
            CompositionResult<Boolean> r = CompositionResult.failure(FailureReason.INTERNAL_STATE, "x", null);
            assertFalse(r.isSuccess());
            assertThrows(IllegalStateException.class, r::value);
        }
    }

    // ── gates and strategies ─────────────────────────────────────────────

    @Nested
    @DisplayName("gates and strategies")
    class Strategies {

        private final BooleanSupplier yes = () -> true;
        private final BooleanSupplier no = () -> false;

        private boolean unexpected(String what) {
            throw new AssertionError(what);
        }

        @Test
        @DisplayName("sorta never fires on a false condition")
        void sortaFalse() {
            Fixture f = new Fixture(2L, true);
            CompositionPattern sorta = f.registry.register(PatternRegistry.SORTA, PatternMode.GATE);
            for (int i = 0; i < 50; i++) {
                assertFalse(f.engine.composeGate(sorta, false, () -> unexpected("direct path used")));
            }
        }

        @Test
        @DisplayName("consensus needs half of its gates")
        void consensus() {
            Fixture f = new Fixture(2L, true);
            f.personality.setContext(ActiveContext.DEFAULT
                    .withOverride(ConstructKind.SOMETIMES, 1.0)
                    .withOverride(ConstructKind.MAYBE, 1.0)
                    .withOverride(ConstructKind.PROBABLY, 0.0));
            CompositionPattern c = f.registry.register(PatternRegistry.CONSENSUS, PatternMode.GATE);
            assertTrue(c instanceof ThresholdPattern);
            assertTrue(f.engine.composeGate(c, true, () -> false));
        }

        @Test
        @DisplayName("disabled engine always takes the direct path")
        void disabled() {
            Fixture f = new Fixture(2L, false);
            CompositionPattern sorta = f.registry.register(PatternRegistry.SORTA, PatternMode.GATE);
            assertTrue(f.engine.composeGate(sorta, false, () -> true));
        }

        @Test
        @DisplayName("strategy semantics")
        void combine() {
            assertTrue(CompositionEngine.combine(CompositionStrategy.UNION, List.of(no, yes), null));
            assertFalse(CompositionEngine.combine(CompositionStrategy.INTERSECTION, List.of(yes, no), null));
            assertTrue(CompositionEngine.combine(CompositionStrategy.SEQUENTIAL, List.of(yes, yes), null));
            assertFalse(CompositionEngine.combine(CompositionStrategy.SEQUENTIAL,
                    List.of(no, () -> unexpected("evaluated after a false gate")), null));
            assertTrue(CompositionEngine.combine(CompositionStrategy.WEIGHTED, List.of(yes, no), new double[]{3, 1}));
            assertFalse(CompositionEngine.combine(CompositionStrategy.WEIGHTED, List.of(yes, no), new double[]{1, 1}));
            assertFalse(CompositionEngine.combine(CompositionStrategy.CONDITIONAL, List.of(yes, no, yes), null));
            assertTrue(CompositionEngine.combine(CompositionStrategy.CONDITIONAL, List.of(no, no, yes), null));
        }

        @Test
        @DisplayName("strategy arguments are validated")
        void combineValidation() {
            assertThrows(IllegalArgumentException.class, () -> CompositionEngine.combine(CompositionStrategy.UNION, List.of(), null));
            assertThrows(IllegalArgumentException.class,
                    () -> CompositionEngine.combine(CompositionStrategy.WEIGHTED, List.of(yes), new double[]{1, 2}));
            assertThrows(IllegalArgumentException.class,
                    () -> CompositionEngine.combine(CompositionStrategy.WEIGHTED, List.of(yes), new double[]{0}));
            assertThrows(IllegalArgumentException.class,
                    () -> CompositionEngine.combine(CompositionStrategy.CONDITIONAL, List.of(yes, no), null));
        }

        @Test
        @DisplayName("runtime with and without composition agrees for one seed")
        void runtimeEquivalence() {
            KindaRuntime on = KindaRuntime.builder().seed(2024L).compositionEnabled(true).build();
            KindaRuntime off = KindaRuntime.builder().seed(2024L).compositionEnabled(false).build();
            for (int i = 0; i < 200; i++) {
                assertEquals(off.ishCompare(i, 100 - i, 3.0), on.ishCompare(i, 100 - i, 3.0), "pair " + i);
            }
        }
    }
}
