package org.calista.kinda.loop;

import org.calista.kinda.events.ChaosReporter;
import org.calista.kinda.events.EventStore;
import org.calista.kinda.events.EventType;
import org.calista.kinda.personality.ActiveContext;
import org.calista.kinda.personality.ConstructKind;
import org.calista.kinda.personality.Mood;
import org.calista.kinda.personality.PersonalityResolver;
import org.calista.kinda.runtime.Primitives;
import org.calista.kinda.runtime.RandomSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LoopRuntimeTest {

    private PersonalityResolver personality;
    private EventStore events;
    private ChaosReporter reporter;
    private Primitives primitives;

    @BeforeEach
    void setUp() {
        personality = new PersonalityResolver();
        events = new EventStore(256);
        reporter = new ChaosReporter(events, personality);
        primitives = new Primitives(personality, RandomSource.seeded(42L), reporter);
    }

    private void pin(ConstructKind kind, double value) {
        personality.setContext(ActiveContext.DEFAULT.withOverride(kind, value));
    }

    // ── sometimes_while ──────────────────────────────────────────────────

    @Nested
    @DisplayName("sometimes_while")
    class SometimesWhile {

        @Test
        @DisplayName("false condition ends immediately")
        void falseCondition() {
            ContinuationLoop loop = new ContinuationLoop(primitives, 100);
            assertFalse(loop.step(false));
            assertEquals(ContinuationLoop.State.TERMINATED, loop.state());
            assertEquals(1, loop.cycles());
            assertFalse(loop.step(true));
        }

        @Test
        @DisplayName("continuation at 0.5 gives about two evaluations per loop")
        void geometricMean() {
            pin(ConstructKind.SOMETIMES_WHILE, 0.5);
            LoopRuntime loops = new LoopRuntime(primitives, LoopSettings.defaults());
            int runs = 20_000;
            long total = 0;
            for (int i = 0; i < runs; i++) total += loops.runWhile(() -> true, () -> { });
            double mean = (double) total / runs;
            assertEquals(2.0, mean, 0.1, "mean=" + mean);
        }

        @Test
        @DisplayName("cap ends the loop with an event instead of an exception")
        void cap() {
            pin(ConstructKind.SOMETIMES_WHILE, 1.0);
            LoopRuntime loops = new LoopRuntime(primitives, new LoopSettings(3, 100, 5, 1_000, 1.645));
            AtomicInteger body = new AtomicInteger();
            int cycles = loops.runWhile(() -> true, body::incrementAndGet);
            assertEquals(3, body.get());
            assertEquals(4, cycles);
            assertEquals(1, events.count(EventType.LOOP_CAP_EXCEEDED));
        }

        @Test
        @DisplayName("stateless check honours the cap and skips the draw on a false condition")
        void stateless() {
            pin(ConstructKind.SOMETIMES_WHILE, 1.0);
            LoopRuntime loops = new LoopRuntime(primitives, new LoopSettings(2, 100, 5, 1_000, 1.645));
            assertTrue(loops.sometimesWhile(0, true));
            assertTrue(loops.sometimesWhile(1, true));
            assertFalse(loops.sometimesWhile(2, true));
            assertFalse(loops.sometimesWhile(0, false));
            assertEquals(1, events.count(EventType.LOOP_CAP_EXCEEDED));
        }
    }

    // ── maybe_for ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("maybe_for")
    class MaybeFor {

        @Test
        @DisplayName("execution rate tracks the probability and order is kept")
        void rateAndOrder() {
            pin(ConstructKind.MAYBE_FOR, 0.95);
            List<Integer> items = new ArrayList<>();
            for (int i = 0; i < 1000; i++) items.add(i);
            List<Integer> seen = new ArrayList<>();

            int executed = new LoopRuntime(primitives, LoopSettings.defaults()).forEach(items, seen::add);

            assertEquals(seen.size(), executed);
            double rate = executed / 1000.0;
            assertTrue(rate >= 0.92 && rate <= 0.98, "rate=" + rate);
            for (int i = 1; i < seen.size(); i++) assertTrue(seen.get(i) > seen.get(i - 1));
        }

        @Test
        @DisplayName("probability 0 skips everything, 1 runs everything")
        void extremes() {
            LoopRuntime loops = new LoopRuntime(primitives, LoopSettings.defaults());
            pin(ConstructKind.MAYBE_FOR, 0.0);
            assertEquals(0, loops.forEach(List.of(1, 2, 3), x -> fail("should not run")));
            pin(ConstructKind.MAYBE_FOR, 1.0);
            assertEquals(3, loops.forEach(List.of(1, 2, 3), x -> { }));
        }
    }

    // ── kinda_repeat ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("kinda_repeat")
    class KindaRepeat {

        @Test
        @DisplayName("counts stay inside n(1 +- v) and centre on n")
        void bounds() {
            LoopRuntime loops = new LoopRuntime(primitives, LoopSettings.defaults());
            double v = personality.varianceFor(ConstructKind.KINDA_REPEAT);
            int n = 10;
            long sum = 0;
            for (int i = 0; i < 2000; i++) {
                int c = loops.kindaRepeat(n);
                assertTrue(c >= Math.ceil(n * (1 - v)) && c <= Math.floor(n * (1 + v)), "count=" + c);
                sum += c;
            }
            assertEquals(n, sum / 2000.0, 0.5);
        }

        @Test
        @DisplayName("zero variance repeats exactly")
        void exact() {
            pin(ConstructKind.KINDA_REPEAT, 0.0);
            AtomicInteger body = new AtomicInteger();
            assertEquals(7, new LoopRuntime(primitives, LoopSettings.defaults()).repeat(7, i -> body.incrementAndGet()));
            assertEquals(7, body.get());
        }

        @Test
        @DisplayName("never negative")
        void neverNegative() {
            personality.setContext(Mood.CHAOTIC, 10);
            FuzzyRepeat repeat = new FuzzyRepeat(primitives);
            assertEquals(0, repeat.count(0));
            assertEquals(0, repeat.count(-5));
            for (int i = 0; i < 500; i++) assertTrue(repeat.count(1) >= 0);
        }
    }

    // ── eventually_until ─────────────────────────────────────────────────

    @Nested
    @DisplayName("eventually_until")
    class EventuallyUntil {

        @Test
        @DisplayName("always-true condition becomes confident once the bound passes the threshold")
        void confident() {
            ConfidenceLoop loop = new ConfidenceLoop(0.8, LoopSettings.defaults(), reporter);
            int runs = 0;
            while (loop.step(true)) runs++;
            // n / (n + z^2) first exceeds 0.8 at n = 11
            assertEquals(11, loop.evaluations());
            assertEquals(10, runs);
            assertEquals(ConfidenceLoop.Outcome.CONFIDENT, loop.outcome());
            assertTrue(loop.lastLowerBound() > 0.8);
            assertFalse(loop.step(true));
        }

        @Test
        @DisplayName("rarely-true condition times out at the evaluation cap")
        void timeout() {
            RandomSource draws = RandomSource.seeded(7L);
            ConfidenceLoop loop = new ConfidenceLoop(0.8, LoopSettings.defaults(), reporter);
            while (loop.step(draws.chance(0.3))) {
                // spin
            }
            assertEquals(ConfidenceLoop.Outcome.TIMED_OUT, loop.outcome());
            assertEquals(1_000, loop.evaluations());
            assertEquals(1, events.count(EventType.CONFIDENCE_TIMEOUT));
        }

        @Test
        @DisplayName("mostly-true condition converges")
        void converges() {
            RandomSource draws = RandomSource.seeded(11L);
            ConfidenceLoop loop = new ConfidenceLoop(0.8, LoopSettings.defaults(), reporter);
            while (loop.step(draws.chance(0.99))) {
                // spin
            }
            assertEquals(ConfidenceLoop.Outcome.CONFIDENT, loop.outcome());
            assertTrue(loop.evaluations() < 100, "evaluations=" + loop.evaluations());
        }

        @Test
        @DisplayName("threshold above the best possible bound falls back to the proportion")
        void unreachableThreshold() {
            LoopSettings small = new LoopSettings(10_000, 10, 5, 1_000, 1.645);
            ConfidenceLoop loop = new ConfidenceLoop(0.99, small, reporter);
            while (loop.step(true)) {
                // spin
            }
            assertEquals(ConfidenceLoop.Outcome.CONFIDENT, loop.outcome());
            assertEquals(10, loop.evaluations());
            assertEquals(1, events.count(EventType.CONFIDENCE_FALLBACK));
        }

        @Test
        @DisplayName("threshold is fixed from the context active at loop start")
        void thresholdFixedAtStart() {
            LoopRuntime loops = new LoopRuntime(primitives, LoopSettings.defaults());
            pin(ConstructKind.EVENTUALLY_UNTIL, 0.6);
            ConfidenceLoop loop = loops.eventuallyUntil();
            pin(ConstructKind.EVENTUALLY_UNTIL, 0.95);
            assertEquals(0.6, loop.threshold(), 1e-12);
        }

        @Test
        @DisplayName("callable form runs the body until confident")
        void runUntil() {
            AtomicInteger body = new AtomicInteger();
            ConfidenceLoop.Outcome out = new LoopRuntime(primitives, LoopSettings.defaults())
                    .runUntil(() -> true, body::incrementAndGet);
            assertEquals(ConfidenceLoop.Outcome.CONFIDENT, out);
            assertTrue(body.get() > 0 && body.get() < 20, "body=" + body.get());
        }
    }

    // ── statistics helpers ───────────────────────────────────────────────

    @Nested
    @DisplayName("window and bound")
    class Statistics {

        @Test
        @DisplayName("ring buffer evicts the oldest outcome")
        void buffer() {
            ConfidenceBuffer b = new ConfidenceBuffer(3);
            b.add(true);
            b.add(true);
            b.add(false);
            assertTrue(b.isFull());
            assertEquals(2, b.trues());
            b.add(false);
            assertEquals(3, b.size());
            assertEquals(1, b.trues());
            assertEquals(1.0 / 3, b.proportion(), 1e-12);
            assertThrows(IllegalArgumentException.class, () -> new ConfidenceBuffer(0));
        }

        @Test
        @DisplayName("Wilson bounds bracket the observed proportion")
        void wilson() {
            double lo = WilsonScore.lowerBound(30, 100, 1.645);
            double hi = WilsonScore.upperBound(30, 100, 1.645);
            assertTrue(lo < 0.3 && 0.3 < hi);
            assertEquals(10.0 / (10.0 + 1.645 * 1.645), WilsonScore.lowerBound(10, 10, 1.645), 1e-12);
            assertTrue(Double.isNaN(WilsonScore.lowerBound(0, 0, 1.645)));
            assertTrue(Double.isNaN(WilsonScore.lowerBound(5, 3, 1.645)));
        }

        @Test
        @DisplayName("settings are validated")
        void settings() {
            assertThrows(IllegalArgumentException.class, () -> new LoopSettings(0, 100, 5, 1000, 1.645));
            assertThrows(IllegalArgumentException.class, () -> new LoopSettings(10, 4, 5, 1000, 1.645));
            assertThrows(IllegalArgumentException.class, () -> new LoopSettings(10, 100, 5, 4, 1.645));
            assertThrows(IllegalArgumentException.class, () -> new LoopSettings(10, 100, 5, 1000, 0.0));
        }
    }
}
