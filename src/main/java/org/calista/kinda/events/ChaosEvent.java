package org.calista.kinda.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class ChaosEvent {
    public EventType type;
    public String construct;   // "ish", "eventually_until", "kinda_int", ...
    public String detail;
    public String mood;
    public int chaosLevel;
    public long tsEpochMs;

    public static ChaosEvent of(EventType type, String construct, String detail,
                                String mood, int chaosLevel, long tsEpochMs) {
        ChaosEvent e = new ChaosEvent();
        e.type = type;
        e.construct = construct;
        e.detail = detail;
        e.mood = mood;
        e.chaosLevel = chaosLevel;
        e.tsEpochMs = tsEpochMs;
        return e;
    }

    @Override
    public String toString() {
        return type + "[" + construct + "] " + detail + " (" + mood + "@" + chaosLevel + ")";
    }
}
