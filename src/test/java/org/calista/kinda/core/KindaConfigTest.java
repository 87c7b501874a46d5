package org.calista.kinda.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.kinda.io.FileIO;
import org.calista.kinda.personality.InvalidConfigurationException;
import org.calista.kinda.personality.Mood;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class KindaConfigTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("missing config is created with defaults")
    void createsDefaults(@TempDir Path dir) throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("config/kinda.json");

        KindaConfig cfg = KindaConfig.loadOrCreate(io, file, mapper);

        assertTrue(Files.exists(file));
        assertEquals("playful", cfg.personality.mood);
        assertEquals(5, cfg.personality.chaosLevel);
        assertNull(cfg.personality.seed);
        assertEquals(".knda", cfg.transform.extension);
        assertEquals(Mood.PLAYFUL, cfg.activeContext().mood());

        KindaConfig again = KindaConfig.loadOrCreate(io, file, mapper);
        assertEquals(cfg.transform.sourceDir, again.transform.sourceDir);
    }

    @Test
    @DisplayName("empty config file is recreated")
    void emptyFile(@TempDir Path dir) throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("kinda.json");
        io.writeString(file, "  \n");

        KindaConfig cfg = KindaConfig.loadOrCreate(io, file, mapper);

        assertEquals(1024, cfg.events.capacity);
        assertFalse(io.readString(file).isBlank());
    }

    @Test
    @DisplayName("partial config keeps defaults for the rest")
    void partial(@TempDir Path dir) throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("kinda.json");
        io.writeString(file, "{\"personality\":{\"mood\":\"Snarky\",\"chaosLevel\":8,\"seed\":42}}");

        KindaConfig cfg = KindaConfig.loadOrCreate(io, file, mapper);

        assertEquals(Mood.SNARKY, cfg.activeContext().mood());
        assertEquals(8, cfg.activeContext().chaosLevel());
        assertEquals(42L, cfg.personality.seed);
        assertEquals(100, cfg.loops.bufferSize);
    }

    @Test
    @DisplayName("validate normalises out-of-range values")
    void validate() {
        KindaConfig cfg = new KindaConfig();
        cfg.transform.extension = "kinda";
        cfg.transform.defaultIndent = "x";
        cfg.loops.bufferSize = 10;
        cfg.loops.minSamples = 50;
        cfg.loops.maxEvaluations = 3;
        cfg.loops.confidenceZ = Double.NaN;
        cfg.events.capacity = 0;

        cfg.validate();

        assertEquals(".kinda", cfg.transform.extension);
        assertEquals("    ", cfg.transform.defaultIndent);
        assertEquals(10, cfg.loops.minSamples);
        assertEquals(1_000, cfg.loops.maxEvaluations);
        assertEquals(1.645, cfg.loops.confidenceZ);
        assertEquals(1024, cfg.events.capacity);
        assertEquals(10, cfg.loopSettings().bufferSize);
    }

    @Test
    @DisplayName("unknown mood or chaos level is a configuration error")
    void invalidPersonality() {
        KindaConfig cfg = new KindaConfig();
        cfg.personality.mood = "grumpy";
        assertThrows(InvalidConfigurationException.class, cfg::activeContext);

        cfg.personality.mood = "chaotic";
        cfg.personality.chaosLevel = 11;
        assertThrows(InvalidConfigurationException.class, cfg::activeContext);
    }
}
