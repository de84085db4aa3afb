package com.stashguard.identity;

/**
 * Thrown when a credential is missing, unknown or otherwise cannot be resolved to a player.
 */
public class AuthenticationException extends Exception {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
