package org.calista.kinda.transform;

import java.util.Objects;

/**
 * Transformer knobs. Data only, validated on construction.
 */
public final class TransformOptions {

    public static final String DEFAULT_RUNTIME_CLASS = "org.calista.kinda.runtime.Kinda";

    /** Fully qualified name of the facade the generated calls target. */
    public final String runtimeClass;

    /** Add an import of {@link #runtimeClass} when something was rewritten. */
    public final boolean injectImport;

    /** Lines longer than this are rejected. */
    public final int maxLineLength;

    /** Indentation unit used when it cannot be read from the surrounding code. */
    public final String defaultIndent;

    public TransformOptions(String runtimeClass, boolean injectImport, int maxLineLength, String defaultIndent) {
        this.runtimeClass = Objects.requireNonNull(runtimeClass, "runtimeClass").trim();
        if (this.runtimeClass.isEmpty() || this.runtimeClass.endsWith(".")) {
            throw new IllegalArgumentException("runtimeClass must be a class name: '" + runtimeClass + "'");
        }
        if (maxLineLength < 1) throw new IllegalArgumentException("maxLineLength must be >= 1");
        Objects.requireNonNull(defaultIndent, "defaultIndent");
        if (defaultIndent.isEmpty() || !defaultIndent.isBlank()) {
            throw new IllegalArgumentException("defaultIndent must be non-empty whitespace");
        }
        this.injectImport = injectImport;
        this.maxLineLength = maxLineLength;
        this.defaultIndent = defaultIndent;
    }

    public static TransformOptions defaults() {
        return new TransformOptions(DEFAULT_RUNTIME_CLASS, true, 10_000, "    ");
    }

    /** Simple name used in generated calls. */
    public String runtimeSimpleName() {
        int dot = runtimeClass.lastIndexOf('.');
        return dot < 0 ? runtimeClass : runtimeClass.substring(dot + 1);
    }
}
