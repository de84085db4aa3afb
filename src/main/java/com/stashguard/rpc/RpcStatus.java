package com.stashguard.rpc;

/**
 * Error codes returned to RPC callers, with the HTTP status used when served over HTTP.
 */
public enum RpcStatus {

    /** Missing or invalid credential. Never retried internally. */
    UNAUTHENTICATED(401),
    /** Submission cooldown has not elapsed. The caller should back off. */
    RESOURCE_EXHAUSTED(429),
    /** Structural or semantic validation failure. Nothing was written. */
    INVALID_ARGUMENT(400),
    /** A referenced template does not exist. */
    NOT_FOUND(404),
    /** Catalog or store unavailable. Retryable with backoff. */
    UNAVAILABLE(503),
    METHOD_NOT_FOUND(404),
    INTERNAL(500);

    private final int httpStatus;

    RpcStatus(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * @return true if the same call may succeed later without changes
     */
    public boolean isRetryable() {
        return this == RESOURCE_EXHAUSTED || this == UNAVAILABLE;
    }
}
