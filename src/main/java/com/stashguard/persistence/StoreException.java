package com.stashguard.persistence;

/**
 * Thrown when the document store cannot complete a read or a commit.
 * A failed commit has applied none of its writes.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
