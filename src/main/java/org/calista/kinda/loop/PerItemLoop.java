package org.calista.kinda.loop;

import org.calista.kinda.personality.ConstructKind;
import org.calista.kinda.runtime.Primitives;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * maybe_for: every element is visited in order; each one independently gets a draw for whether
 * the body runs. Skipped elements are never retried.
 */
public final class PerItemLoop {

    private final Primitives p;

    public PerItemLoop(Primitives primitives) {
        this.p = Objects.requireNonNull(primitives, "primitives");
    }

    /** Per-item gate. */
    public boolean admit() {
        return p.random().chance(p.personality().probabilityFor(ConstructKind.MAYBE_FOR));
    }

    /**
     * @return number of elements the body ran for
     */
    public <T> int forEach(Iterable<T> items, Consumer<? super T> body) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(body, "body");
        int executed = 0;
        for (T item : items) {
            if (admit()) {
                body.accept(item);
                executed++;
            }
        }
        return executed;
    }
}
