package org.calista.kinda.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.kinda.compose.PatternRegistry;
import org.calista.kinda.events.EventStore;
import org.calista.kinda.io.FileIO;
import org.calista.kinda.personality.MoodProfiles;
import org.calista.kinda.personality.PersonalityResolver;
import org.calista.kinda.runtime.Kinda;
import org.calista.kinda.runtime.KindaRuntime;
import org.calista.kinda.runtime.RandomSource;
import org.calista.kinda.transform.KindaSyntaxException;
import org.calista.kinda.transform.SourceTransformer;
import org.calista.kinda.transform.TransformResult;
import org.calista.kinda.transform.impl.KindaTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * KindaKernel: instance-owned container for config, IO, runtime and transformer.
 *
 * Lifecycle:
 *   1) build(config)     -> loadOrCreate config, wire stores and runtime
 *   2) transformTree()   -> build-time pass over the dialect sources
 *   3) installRuntime()  -> make the runtime visible to transformed code
 *   4) close()           -> uninstall the runtime if this kernel installed it
 */
public final class KindaKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KindaKernel.class);

    private static final String SOURCE_MAP_SUFFIX = ".map.json";

    private final FileIO io;
    private final ObjectMapper mapper;
    private final KindaConfig cfg;
    private final Path sourceRoot;

    private final EventStore events;
    private final PersonalityResolver personality;
    private final KindaRuntime runtime;
    private final SourceTransformer transformer;

    private volatile boolean installed;

    private KindaKernel(FileIO io, ObjectMapper mapper, KindaConfig cfg, Path sourceRoot,
                        EventStore events, PersonalityResolver personality,
                        KindaRuntime runtime, SourceTransformer transformer) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.sourceRoot = Objects.requireNonNull(sourceRoot, "sourceRoot");
        this.events = Objects.requireNonNull(events, "events");
        this.personality = Objects.requireNonNull(personality, "personality");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory where config lives; relative baseDir and sourceDir resolve against it.
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private MoodProfiles profiles;
        private PatternRegistry registry;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder profiles(MoodProfiles profiles) {
            this.profiles = Objects.requireNonNull(profiles, "profiles");
            return this;
        }

        public Builder registry(PatternRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
            return this;
        }

        /**
         * Loads or creates the config and wires everything. Nothing is transformed or installed yet.
         *
         * @throws org.calista.kinda.personality.InvalidConfigurationException for an unknown mood or chaos level
         */
        public KindaKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // Config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            KindaConfig cfg = KindaConfig.loadOrCreate(external, cfgPath, om);

            FileIO io = new FileIO(resolveAgainst(configRoot, cfg.baseDir), charset, true);
            io.ensureBaseDir();

            EventStore events = cfg.events.persist
                    ? new EventStore(cfg.events.capacity, io, om, io.resolve(cfg.events.logFile))
                    : new EventStore(cfg.events.capacity);

            PersonalityResolver personality = new PersonalityResolver(
                    profiles != null ? profiles : MoodProfiles.defaults(), cfg.activeContext());

            KindaRuntime runtime = KindaRuntime.builder()
                    .personality(personality)
                    .random(RandomSource.of(cfg.personality.seed))
                    .events(events)
                    .registry(registry != null ? registry : new PatternRegistry())
                    .loopSettings(cfg.loopSettings())
                    .compositionEnabled(cfg.composition.enabled)
                    .build();

            SourceTransformer transformer = new KindaTransformer(cfg.transformOptions());
            Path sourceRoot = resolveAgainst(configRoot, cfg.transform.sourceDir);

            KindaKernel k = new KindaKernel(io, om, cfg, sourceRoot, events, personality, runtime, transformer);
            k.logCreated(cfgPath);
            return k;
        }

        private static Path resolveAgainst(Path root, String p) {
            Path path = Path.of(p);
            return (path.isAbsolute() ? path : root.resolve(path)).toAbsolutePath().normalize();
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Transform (build time)
    // ---------------------------------------------------------------------

    /**
     * Transforms every dialect file under the source dir into the output dir, keeping relative paths.
     * A syntax error fails that file only and removes whatever an earlier run generated for it.
     */
    public TransformReport transformTree() throws IOException {
        TransformReport report = new TransformReport();
        String ext = cfg.transform.extension;
        List<Path> sources = io.walk(sourceRoot, ext);
        Path outRoot = io.resolve(cfg.transform.outputDir);

        for (Path src : sources) {
            String rel = sourceRoot.relativize(src).toString().replace('\\', '/');
            String outRel = rel.substring(0, rel.length() - ext.length());
            Path out = outRoot.resolve(outRel);
            Path map = outRoot.resolve(outRel + SOURCE_MAP_SUFFIX);
            try {
                TransformResult result = transformer.transform(io.readString(src), rel);
                io.writeString(out, result.text);
                if (cfg.transform.writeSourceMaps) {
                    result.sourceMap.generatedFile = outRel;
                    io.writeString(map, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result.sourceMap));
                }
                report.transformed(out, result.nodes.size());
                log.debug("transformed {} -> {} ({} marker(s))", rel, out, result.nodes.size());
            } catch (KindaSyntaxException e) {
                report.failed(src, e);
                log.error("{}", e.getMessage());
                // output of an earlier run must not outlive a failed file
                io.delete(out);
                io.delete(map);
            }
        }

        if (log.isInfoEnabled()) {
            log.info("transformTree: sourceDir={}, outputDir={}, {}", sourceRoot, outRoot, report);
        }
        return report;
    }

    // ---------------------------------------------------------------------
    // Runtime (execution time)
    // ---------------------------------------------------------------------

    /** Makes {@link #runtime()} the one the static facade uses. */
    public synchronized void installRuntime() {
        KindaRuntime previous = Kinda.install(runtime);
        installed = true;
        if (previous != null && previous != runtime) log.debug("replaced previously installed runtime");
    }

    public boolean isInstalled() {
        return installed;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public KindaConfig config() { return cfg; }
    public Path sourceRoot() { return sourceRoot; }
    public EventStore eventStore() { return events; }
    public PersonalityResolver personality() { return personality; }
    public KindaRuntime runtime() { return runtime; }
    public SourceTransformer transformer() { return transformer; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public synchronized void close() {
        if (!installed) return;
        installed = false;
        if (!Kinda.uninstall(runtime)) log.debug("runtime was already replaced in the facade");
    }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("KindaKernel created: config={}, baseDir={}, mood={}, chaos={}, seed={}",
                cfgPath, io.baseDir(), personality.current().mood().id(), personality.current().chaosLevel(),
                cfg.personality.seed);
    }
}
