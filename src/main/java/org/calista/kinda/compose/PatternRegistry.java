package org.calista.kinda.compose;

import org.calista.kinda.compose.impl.IshTolerancePattern;
import org.calista.kinda.compose.impl.ThresholdPattern;
import org.calista.kinda.compose.impl.UnionPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily built, cached patterns keyed by (name, mode).
 *
 * <p>{@link #register(String, PatternMode)} is create-or-fetch: repeated calls with the same
 * pair return the same instance for the lifetime of the registry.</p>
 */
public final class PatternRegistry {

    private static final Logger log = LoggerFactory.getLogger(PatternRegistry.class);

    public static final String ISH = "ish";
    public static final String SORTA = "sorta";
    public static final String CONSENSUS = "consensus";

    @FunctionalInterface
    public interface PatternFactory {
        CompositionPattern create(String name, PatternMode mode);
    }

    private final ConcurrentHashMap<String, CompositionPattern> patterns = new ConcurrentHashMap<>();
    private final Map<String, PatternFactory> builtIns = Map.of(
            ISH, IshTolerancePattern::new,
            SORTA, (name, mode) -> {
                requireGate(name, mode);
                return UnionPattern.sorta(name);
            },
            CONSENSUS, (name, mode) -> {
                requireGate(name, mode);
                return ThresholdPattern.consensus(name);
            }
    );

    /**
     * @throws IllegalArgumentException for a name with no built-in recipe or an unsupported mode
     */
    public CompositionPattern register(String name, PatternMode mode) {
        Objects.requireNonNull(name, "name");
        PatternFactory f = builtIns.get(name);
        if (f == null) throw new IllegalArgumentException("no built-in composition pattern named '" + name + "'");
        return register(name, mode, f);
    }

    public CompositionPattern register(String name, PatternMode mode, PatternFactory factory) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(factory, "factory");
        return patterns.computeIfAbsent(CompositionPattern.key(name, mode), k -> {
            CompositionPattern created = Objects.requireNonNull(factory.create(name, mode), "factory returned null");
            if (created.mode() != mode || !created.name().equals(name)) {
                throw new IllegalStateException("factory for " + k + " produced " + created.key());
            }
            log.debug("Composition pattern created: {}", created);
            return created;
        });
    }

    public int size() {
        return patterns.size();
    }

    /** Teardown: drops every cached instance. */
    public void clear() {
        patterns.clear();
    }

    private static void requireGate(String name, PatternMode mode) {
        if (mode != PatternMode.GATE) throw new IllegalArgumentException(name + " supports gate mode only, got " + mode);
    }
}
