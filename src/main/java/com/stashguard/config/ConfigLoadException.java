package com.stashguard.config;

/**
 * Thrown when the service configuration file exists but cannot be read or parsed.
 */
public class ConfigLoadException extends Exception {

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
