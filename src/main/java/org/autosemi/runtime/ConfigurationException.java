package org.autosemi.runtime;

import java.io.Serial;

/**
 * Raised when project settings cannot be read or contain values of the wrong type.
 */
public class ConfigurationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
