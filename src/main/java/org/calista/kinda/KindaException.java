package org.calista.kinda;

/**
 * Root of the engine's unchecked failures.
 * IO and config loading keep throwing {@link java.io.IOException}.
 */
public class KindaException extends RuntimeException {

    public KindaException(String message) {
        super(message);
    }

    public KindaException(String message, Throwable cause) {
        super(message, cause);
    }
}
