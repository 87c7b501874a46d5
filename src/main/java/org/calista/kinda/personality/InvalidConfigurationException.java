package org.calista.kinda.personality;

import org.calista.kinda.KindaException;

/**
 * Unknown mood, out-of-range chaos level or a broken override value.
 * Raised where the context is set, never clamped away.
 */
public class InvalidConfigurationException extends KindaException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
