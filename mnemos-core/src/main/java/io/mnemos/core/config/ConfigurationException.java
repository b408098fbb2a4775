package io.mnemos.core.config;

/**
 * Fatal misconfiguration detected at startup. Not retryable.
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
