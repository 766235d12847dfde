package io.dynamis.optics.api;

/**
 * Thrown when a configuration value is rejected at the point of assignment.
 * Values are never clamped silently.
 */
public final class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
