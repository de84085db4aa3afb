package com.stashguard.config;

/**
 * Thrown when a configuration value has the wrong type or is out of range.
 */
public class ConfigValidationException extends Exception {

    public ConfigValidationException(String message) {
        super(message);
    }
}
