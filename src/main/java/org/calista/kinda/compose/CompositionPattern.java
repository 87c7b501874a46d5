package org.calista.kinda.compose;

import org.calista.kinda.runtime.Primitives;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Named recipe for a complex construct built from {@link Primitives}.
 *
 * <p>Subclasses override the entry point matching their {@link PatternMode}. Evaluation runs
 * through {@link #guard(Supplier)}, which turns runtime exceptions into typed failures;
 * {@link Error}s are not caught.</p>
 */
public abstract class CompositionPattern {

    private final String name;
    private final PatternMode mode;

    protected CompositionPattern(String name, PatternMode mode) {
        this.name = Objects.requireNonNull(name, "name");
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public final String name() {
        return name;
    }

    public final PatternMode mode() {
        return mode;
    }

    /** Registry key. */
    public final String key() {
        return key(name, mode);
    }

    public static String key(String name, PatternMode mode) {
        return name + "#" + mode.name().toLowerCase(Locale.ROOT);
    }

    public CompositionResult<Boolean> compare(Primitives p, Object left, Object right, Double tolerance) {
        return unsupported(PatternMode.COMPARISON);
    }

    public CompositionResult<Number> assign(Primitives p, Object current, Object target) {
        return unsupported(PatternMode.ASSIGNMENT);
    }

    public CompositionResult<Boolean> evaluate(Primitives p, boolean condition) {
        return unsupported(PatternMode.GATE);
    }

    protected final <T> CompositionResult<T> unsupported(PatternMode asked) {
        return CompositionResult.failure(FailureReason.INTERNAL_STATE,
                name + " (" + mode + ") cannot evaluate in " + asked + " mode", null);
    }

    protected static <T> CompositionResult<T> guard(Supplier<T> body) {
        try {
            return CompositionResult.success(body.get());
        } catch (ClassCastException | NumberFormatException | ArithmeticException e) {
            return CompositionResult.failure(FailureReason.CONVERSION, e.toString(), e);
        } catch (IllegalStateException e) {
            return CompositionResult.failure(FailureReason.INTERNAL_STATE, e.toString(), e);
        } catch (RuntimeException e) {
            return CompositionResult.failure(FailureReason.UNEXPECTED, e.toString(), e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + key() + "}";
    }
}
