package org.calista.kinda.compose;

import java.util.Objects;

/**
 * Outcome of one pattern evaluation: a value, or a typed failure the caller decides how to recover from.
 */
public final class CompositionResult<T> {

    private final T value;
    private final FailureReason reason;
    private final String detail;
    private final RuntimeException cause;

    private CompositionResult(T value, FailureReason reason, String detail, RuntimeException cause) {
        this.value = value;
        this.reason = reason;
        this.detail = detail;
        this.cause = cause;
    }

    public static <T> CompositionResult<T> success(T value) {
        return new CompositionResult<>(Objects.requireNonNull(value, "value"), null, null, null);
    }

    public static <T> CompositionResult<T> failure(FailureReason reason, String detail, RuntimeException cause) {
        return new CompositionResult<>(null, Objects.requireNonNull(reason, "reason"), detail, cause);
    }

    public boolean isSuccess() {
        return reason == null;
    }

    /**
     * @throws IllegalStateException on a failed result
     */
    public T value() {
        if (reason != null) throw new IllegalStateException("no value: " + reason + " (" + detail + ")", cause);
        return value;
    }

    public FailureReason reason() {
        return reason;
    }

    public String detail() {
        return detail;
    }

    public RuntimeException cause() {
        return cause;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success(" + value + ")" : "Failure(" + reason + ": " + detail + ")";
    }
}
