package org.calista.kinda.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.kinda.io.FileIO;
import org.calista.kinda.personality.Mood;
import org.calista.kinda.personality.PersonalityResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventStoreTest {

    private static ChaosEvent event(EventType type, String detail) {
        return ChaosEvent.of(type, "ish", detail, "playful", 5, 1L);
    }

    @Test
    @DisplayName("ring keeps the newest events, counters keep everything")
    void bounded() {
        EventStore store = new EventStore(3);
        for (int i = 0; i < 5; i++) store.record(event(EventType.CONVERSION_FAILURE, "e" + i));
        store.record(event(EventType.LOOP_CAP_EXCEEDED, "cap"));

        List<ChaosEvent> recent = store.recent();
        assertEquals(3, recent.size());
        assertEquals("e3", recent.get(0).detail);
        assertEquals("cap", recent.get(2).detail);
        assertEquals(5, store.count(EventType.CONVERSION_FAILURE));
        assertEquals(1, store.count(EventType.LOOP_CAP_EXCEEDED));
        assertEquals(0, store.count(EventType.CONFIDENCE_TIMEOUT));
        assertEquals(6, store.total());

        store.clear();
        assertTrue(store.recent().isEmpty());
        assertEquals(0, store.total());
    }

    @Test
    @DisplayName("capacity must be positive")
    void capacity() {
        assertThrows(IllegalArgumentException.class, () -> new EventStore(0));
    }

    @Test
    @DisplayName("persisted events are one JSON object per line")
    void jsonl(@TempDir Path dir) throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        FileIO io = new FileIO(dir);
        EventStore store = new EventStore(10, io, mapper, io.resolve("logs/events.jsonl"));

        store.record(event(EventType.COMPOSITION_FALLBACK, "CONVERSION: bad"));
        store.record(event(EventType.CONFIDENCE_FALLBACK, "bound not finite"));

        List<String> lines = store.readAllRawLines();
        assertEquals(2, lines.size());
        ChaosEvent back = mapper.readValue(lines.get(1), ChaosEvent.class);
        assertEquals(EventType.CONFIDENCE_FALLBACK, back.type);
        assertEquals("bound not finite", back.detail);
        assertEquals(0, store.persistFailures());
    }

    @Test
    @DisplayName("memory-only store has no persisted lines")
    void memoryOnly() throws Exception {
        assertTrue(new EventStore(4).readAllRawLines().isEmpty());
    }

    @Test
    @DisplayName("reporter stamps the active context")
    void reporter() {
        PersonalityResolver personality = new PersonalityResolver();
        EventStore store = new EventStore(8);
        ChaosReporter reporter = new ChaosReporter(store, personality);
        try (PersonalityResolver.Scope ignored = personality.push(Mood.SNARKY, 9)) {
            reporter.report(EventType.CONFIDENCE_TIMEOUT, "eventually_until", "gave up");
        }
        ChaosEvent e = store.recent().get(0);
        assertEquals("snarky", e.mood);
        assertEquals(9, e.chaosLevel);
        assertEquals("eventually_until", e.construct);
        assertTrue(e.tsEpochMs > 0);
    }
}
