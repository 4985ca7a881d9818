package io.github.jakubt4.constellation.exception;

/**
 * Raised when a constellation or ground-station configuration is invalid.
 *
 * <p>Permanent: the same input always fails, so callers must not retry.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(final String message) {
        super(message);
    }
}
