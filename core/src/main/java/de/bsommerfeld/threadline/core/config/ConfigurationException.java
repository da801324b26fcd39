package de.bsommerfeld.threadline.core.config;

/**
 * Raised when {@code threadline.toml} exists but cannot be read or parsed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
