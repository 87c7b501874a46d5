package org.calista.kinda.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.kinda.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;

/**
 * Chaos telemetry: bounded in-memory ring plus per-type counters, optionally mirrored to JSONL.
 *
 * <p>{@link #record} is called from inside fuzzy constructs and never throws on persistence
 * problems; they are logged and counted in {@link #persistFailures()}.</p>
 */
public final class EventStore {

    private static final Logger log = LoggerFactory.getLogger(EventStore.class);

    private final int capacity;
    private final FileIO io;          // nullable: memory only
    private final ObjectMapper mapper;
    private final Path file;

    private final ArrayDeque<ChaosEvent> ring;
    private final EnumMap<EventType, Long> counts = new EnumMap<>(EventType.class);
    private long persistFailures;

    public EventStore(int capacity) {
        this(capacity, null, null, null);
    }

    public EventStore(int capacity, FileIO io, ObjectMapper mapper, Path file) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0: " + capacity);
        if (io != null) {
            Objects.requireNonNull(mapper, "mapper");
            Objects.requireNonNull(file, "file");
        }
        this.capacity = capacity;
        this.io = io;
        this.mapper = mapper;
        this.file = file;
        this.ring = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public void record(ChaosEvent e) {
        Objects.requireNonNull(e, "event");
        synchronized (this) {
            if (ring.size() == capacity) ring.pollFirst();
            ring.addLast(e);
            counts.merge(e.type, 1L, Long::sum);
        }
        log.debug("chaos event: {}", e);
        if (io != null) persist(e);
    }

    private void persist(ChaosEvent e) {
        try {
            io.appendJsonl(file, mapper.writeValueAsString(e));
        } catch (IOException ex) {
            synchronized (this) {
                persistFailures++;
            }
            log.warn("Failed to persist chaos event to {}: {}", file, ex.toString());
        }
    }

    public synchronized List<ChaosEvent> recent() {
        return new ArrayList<>(ring);
    }

    public synchronized long count(EventType type) {
        return counts.getOrDefault(type, 0L);
    }

    public synchronized long total() {
        long t = 0;
        for (long v : counts.values()) t += v;
        return t;
    }

    public synchronized long persistFailures() {
        return persistFailures;
    }

    public synchronized void clear() {
        ring.clear();
        counts.clear();
    }

    /** Raw JSONL lines from the persisted log; empty when persistence is off. */
    public List<String> readAllRawLines() throws IOException {
        if (io == null) return List.of();
        return io.readJsonl(file);
    }

    public int capacity() {
        return capacity;
    }
}
