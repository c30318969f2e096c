package io.hearthwarrio.statetrail.core.config;

/**
 * Thrown when settings cannot be read or mapped.
 */
public class SettingsException extends RuntimeException {
    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }

    public SettingsException(String message) {
        super(message);
    }
}
