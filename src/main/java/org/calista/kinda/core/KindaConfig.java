package org.calista.kinda.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.kinda.io.FileIO;
import org.calista.kinda.loop.LoopSettings;
import org.calista.kinda.personality.ActiveContext;
import org.calista.kinda.transform.TransformOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * KindaConfig: простой POJO конфиг.
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует структурные значения; mood и chaosLevel проверяет PersonalityResolver
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class KindaConfig {

    private static final Logger log = LoggerFactory.getLogger(KindaConfig.class);

    public String baseDir = "build/kinda";
    public Personality personality = new Personality();
    public Loops loops = new Loops();
    public Composition composition = new Composition();
    public Transform transform = new Transform();
    public Events events = new Events();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Personality {
        public String mood = "playful";
        public int chaosLevel = 5;
        /** null: unseeded. */
        public Long seed = null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Loops {
        public int sometimesWhileMaxCycles = 10_000;

        // eventually_until
        public int bufferSize = 100;
        public int minSamples = 5;
        public int maxEvaluations = 1_000;
        public double confidenceZ = 1.645;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Composition {
        /** false: tolerance markers use the direct implementation. */
        public boolean enabled = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Transform {
        public String sourceDir = "src/main/kinda";
        /** Relative to baseDir. */
        public String outputDir = "generated-sources/kinda";
        public String extension = ".knda";
        public boolean writeSourceMaps = true;
        public String runtimeClass = TransformOptions.DEFAULT_RUNTIME_CLASS;
        public int maxLineLength = 10_000;
        public String defaultIndent = "    ";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public int capacity = 1024;
        public boolean persist = false;
        public String logFile = "events.jsonl";
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static KindaConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            KindaConfig created = new KindaConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            KindaConfig created = new KindaConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        KindaConfig cfg = mapper.readValue(json, KindaConfig.class);
        if (cfg == null) cfg = new KindaConfig();

        cfg.validate();
        return cfg;
    }

    /**
     * Перезаписывает конфиг на диск (pretty JSON).
     */
    public static void save(FileIO io, Path configFile, ObjectMapper mapper, KindaConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, KindaConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "build/kinda";

        if (personality == null) personality = new Personality();
        if (personality.mood == null || personality.mood.isBlank()) personality.mood = "playful";

        if (loops == null) loops = new Loops();
        if (loops.sometimesWhileMaxCycles < 1) loops.sometimesWhileMaxCycles = 10_000;
        if (loops.bufferSize < 1) loops.bufferSize = 100;
        if (loops.minSamples < 1) loops.minSamples = 1;
        if (loops.minSamples > loops.bufferSize) loops.minSamples = loops.bufferSize;
        if (loops.maxEvaluations < loops.minSamples) loops.maxEvaluations = Math.max(loops.minSamples, 1_000);
        if (!(loops.confidenceZ > 0.0) || !Double.isFinite(loops.confidenceZ)) loops.confidenceZ = 1.645;

        if (composition == null) composition = new Composition();

        if (transform == null) transform = new Transform();
        if (transform.sourceDir == null || transform.sourceDir.isBlank()) transform.sourceDir = "src/main/kinda";
        if (transform.outputDir == null || transform.outputDir.isBlank()) transform.outputDir = "generated-sources/kinda";
        if (transform.extension == null || transform.extension.isBlank()) transform.extension = ".knda";
        if (!transform.extension.startsWith(".")) transform.extension = "." + transform.extension;
        if (transform.runtimeClass == null || transform.runtimeClass.isBlank())
            transform.runtimeClass = TransformOptions.DEFAULT_RUNTIME_CLASS;
        if (transform.maxLineLength < 1) transform.maxLineLength = 10_000;
        if (transform.defaultIndent == null || transform.defaultIndent.isEmpty() || !transform.defaultIndent.isBlank())
            transform.defaultIndent = "    ";

        if (events == null) events = new Events();
        if (events.capacity < 1) events.capacity = 1024;
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "events.jsonl";
    }

    // -------------------- Views --------------------

    public LoopSettings loopSettings() {
        return new LoopSettings(loops.sometimesWhileMaxCycles, loops.bufferSize, loops.minSamples,
                loops.maxEvaluations, loops.confidenceZ);
    }

    public TransformOptions transformOptions() {
        return new TransformOptions(transform.runtimeClass, true, transform.maxLineLength, transform.defaultIndent);
    }

    /**
     * @throws org.calista.kinda.personality.InvalidConfigurationException for an unknown mood or a chaos level outside 1..10
     */
    public ActiveContext activeContext() {
        return ActiveContext.of(personality.mood, personality.chaosLevel);
    }
}
