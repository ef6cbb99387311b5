package com.raditha.jarl.config;

/**
 * Invalid configuration: bad TOML, an unknown rule or category in a
 * selection, conflicting options or a malformed R version.
 * <p>
 * Raised before any file is analyzed.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
