package org.calista.kinda.events;

import org.calista.kinda.personality.ActiveContext;
import org.calista.kinda.personality.PersonalityResolver;

import java.util.Objects;

/**
 * Stamps events with the context that was active when they happened.
 */
public final class ChaosReporter {

    private final EventStore store;
    private final PersonalityResolver personality;

    public ChaosReporter(EventStore store, PersonalityResolver personality) {
        this.store = Objects.requireNonNull(store, "store");
        this.personality = Objects.requireNonNull(personality, "personality");
    }

    public void report(EventType type, String construct, String detail) {
        ActiveContext ctx = personality.current();
        store.record(ChaosEvent.of(type, construct, detail, ctx.mood().id(), ctx.chaosLevel(), System.currentTimeMillis()));
    }

    public EventStore store() {
        return store;
    }
}
