package com.stashguard.templates;

/**
 * Thrown when the item template catalog cannot be read.
 * Callers should treat this as retryable.
 */
public class CatalogUnavailableException extends Exception {

    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
