package de.bsommerfeld.dashboard.core.config;

/**
 * Thrown when {@code config.toml} cannot be read, parsed or written.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
