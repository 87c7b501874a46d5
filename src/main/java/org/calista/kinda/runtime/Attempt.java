package org.calista.kinda.runtime;

/**
 * Primary side of {@code ~welp}: evaluated once, may fail with any exception.
 */
@FunctionalInterface
public interface Attempt<T> {
    T get() throws Exception;
}
