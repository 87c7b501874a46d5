package org.calista.kinda.loop;

import org.calista.kinda.events.EventType;
import org.calista.kinda.personality.ConstructKind;
import org.calista.kinda.runtime.Primitives;

import java.util.Objects;

/**
 * sometimes_while: a false condition always ends the loop; a true one continues only when the
 * continuation draw succeeds. The cycle cap ends the loop with an event, never an exception.
 */
public final class ContinuationLoop {

    public enum State { EVALUATING, CONTINUING, TERMINATED }

    private final Primitives p;
    private final int maxCycles;

    private State state = State.EVALUATING;
    private int cycles;
    private boolean capped;

    public ContinuationLoop(Primitives primitives, int maxCycles) {
        this.p = Objects.requireNonNull(primitives, "primitives");
        if (maxCycles < 1) throw new IllegalArgumentException("maxCycles must be >= 1");
        this.maxCycles = maxCycles;
    }

    /**
     * One condition evaluation.
     *
     * @return true when the body should run once more
     */
    public boolean step(boolean condition) {
        if (state == State.TERMINATED) return false;
        state = State.EVALUATING;
        cycles++;

        if (!condition) {
            state = State.TERMINATED;
            return false;
        }
        if (cycles > maxCycles) {
            capped = true;
            state = State.TERMINATED;
            p.reporter().report(EventType.LOOP_CAP_EXCEEDED, "sometimes_while",
                    "stopped after " + maxCycles + " cycles");
            return false;
        }
        if (p.random().chance(p.personality().probabilityFor(ConstructKind.SOMETIMES_WHILE))) {
            state = State.CONTINUING;
            return true;
        }
        state = State.TERMINATED;
        return false;
    }

    public State state() {
        return state;
    }

    /** Condition evaluations so far, including the one that ended the loop. */
    public int cycles() {
        return cycles;
    }

    public boolean capped() {
        return capped;
    }
}
